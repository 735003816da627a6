package io.spotbot.notification;

import io.spotbot.configs.service.CacheConfig;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.exchange.model.Ticker;
import io.spotbot.helpers.SymbolHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

import static io.spotbot.helpers.MathHelper.MC;

@Slf4j
@Service
@RequiredArgsConstructor
public class FiatConvertServiceImpl implements FiatConvertService {
    private final ExchangeService exchangeService;
    private final CacheManager cacheManager;

    @Override
    public BigDecimal convertAmount(BigDecimal amount, String cryptoSymbol, String fiatSymbol) {
        if (cryptoSymbol.equalsIgnoreCase(fiatSymbol)) {
            return amount;
        }
        return amount.multiply(getPrice(cryptoSymbol, fiatSymbol), MC);
    }

    @Override
    public BigDecimal getPrice(String cryptoSymbol, String fiatSymbol) {
        if (cryptoSymbol.equalsIgnoreCase(fiatSymbol)) {
            return BigDecimal.ONE;
        }
        String pair = SymbolHelper.toPair(cryptoSymbol, fiatSymbol);
        Cache cache = cacheManager.getCache(CacheConfig.FIAT_RATES);
        BigDecimal cached = cache != null ? cache.get(pair, BigDecimal.class) : null;
        if (cached != null) {
            return cached;
        }

        try {
            Ticker ticker = exchangeService.getTicker(pair);
            if (ticker.getLast() == null) {
                return BigDecimal.ZERO;
            }
            if (cache != null) {
                cache.put(pair, ticker.getLast());
            }
            return ticker.getLast();
        } catch (RuntimeException e) {
            // failed lookups are not cached
            log.warn("No {} rate available: {}", pair, e.getMessage());
            return BigDecimal.ZERO;
        }
    }
}
