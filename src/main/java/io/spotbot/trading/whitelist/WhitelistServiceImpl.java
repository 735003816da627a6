package io.spotbot.trading.whitelist;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.exceptions.OperationalException;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.exchange.model.MarketInfo;
import io.spotbot.exchange.model.Ticker;
import io.spotbot.helpers.MathHelper;
import io.spotbot.helpers.SymbolHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class WhitelistServiceImpl implements WhitelistService {
    private final ExchangeService exchangeService;
    private final BotProperties properties;
    private final WhitelistCache cache;

    private volatile List<String> activeWhitelist = List.of();

    @Override
    public List<String> genPairWhitelist(String quoteCurrency) {
        Optional<List<String>> cached = cache.get(quoteCurrency);
        if (cached.isPresent()) {
            return cached.get();
        }

        if (!exchangeService.supportsTickers()) {
            throw new OperationalException("Exchange does not support dynamic whitelist. "
                    + "Please edit your config and restart the bot");
        }

        List<String> pairs = exchangeService.getTickers().entrySet().stream()
                .filter(e -> SymbolHelper.isPair(e.getKey()) && quoteCurrency.equals(SymbolHelper.quoteOf(e.getKey())))
                .sorted(Comparator.comparing((Map.Entry<String, Ticker> e) -> volume(e.getValue())).reversed())
                .map(Map.Entry::getKey)
                .toList();
        log.info("🔄 Generated dynamic whitelist for {}: {} pairs", quoteCurrency, pairs.size());
        cache.put(quoteCurrency, pairs);
        return pairs;
    }

    @Override
    public List<String> refreshWhitelist(List<String> whitelist) {
        List<String> blacklist = properties.getPairBlacklist();
        Set<String> wanted = new HashSet<>(whitelist);
        Set<String> usable = new HashSet<>();

        for (MarketInfo market : exchangeService.getMarkets()) {
            if (!properties.getStakeCurrency().equals(market.getQuote())) {
                continue;
            }
            String pair = market.getPair();
            if (!wanted.contains(pair) || blacklist.contains(pair)) {
                continue;
            }
            if (!market.isActive()) {
                log.info("Ignoring {} from whitelist. Market is not active.", pair);
                continue;
            }
            usable.add(pair);
        }

        return whitelist.stream()
                .filter(usable::contains)
                .toList();
    }

    @Override
    public List<String> updateActiveWhitelist() {
        int topN = properties.getDynamicWhitelist();
        List<String> source = topN > 0
                ? genPairWhitelist(properties.getStakeCurrency())
                : properties.getPairWhitelist();

        List<String> sanitized = refreshWhitelist(source);
        if (topN > 0 && sanitized.size() > topN) {
            sanitized = sanitized.subList(0, topN);
        }
        activeWhitelist = List.copyOf(sanitized);
        return activeWhitelist;
    }

    @Override
    public List<String> getActiveWhitelist() {
        return activeWhitelist;
    }

    private static BigDecimal volume(Ticker ticker) {
        return MathHelper.nvl(ticker.getQuoteVolume());
    }
}
