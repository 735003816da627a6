package io.spotbot.exchange;

import com.binance.connector.futures.client.exceptions.BinanceClientException;
import com.binance.connector.futures.client.exceptions.BinanceConnectorException;
import com.binance.connector.futures.client.exceptions.BinanceServerException;
import com.binance.connector.futures.client.impl.UMFuturesClientImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.spotbot.configs.properties.BotProperties;
import io.spotbot.configs.service.AppConfig;
import io.spotbot.exceptions.DependencyException;
import io.spotbot.exceptions.OperationalException;
import io.spotbot.exceptions.TemporaryException;
import io.spotbot.exchange.enums.OrderSide;
import io.spotbot.exchange.enums.OrderStatus;
import io.spotbot.exchange.mapper.ExchangeMapper;
import io.spotbot.exchange.model.*;
import io.spotbot.helpers.MathHelper;
import io.spotbot.helpers.SymbolHelper;
import io.spotbot.klines.enums.IntervalE;
import io.spotbot.klines.mapper.KlineMapper;
import io.spotbot.klines.model.KlineModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class BinanceExchangeServiceImpl implements ExchangeService {
    private static final String BASE_URL_KLINES = "/fapi/v1/klines";
    private static final int KLINES_LIMIT = 500;
    private static final int[] DEPTH_LIMITS = {5, 10, 20, 50, 100, 500, 1000};
    // insufficient balance/margin, rejected or unknown order: the bot can carry on
    private static final Set<Integer> RECOVERABLE_ERROR_CODES = Set.of(-1013, -1111, -2010, -2011, -2013, -2018, -2019, -4164);

    private final UMFuturesClientImpl client;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AppConfig appConfig;
    private final BotProperties properties;
    private final Clock clock;

    private final Map<String, MarketInfo> marketsByPair = new ConcurrentHashMap<>();
    private final Map<String, ExchangeOrder> dryRunOrders = new ConcurrentHashMap<>();
    private final AtomicLong dryRunSequence = new AtomicLong();

    @Override
    public String getName() {
        return properties.getExchange().getName();
    }

    @Override
    public boolean supportsTickers() {
        return true;
    }

    @Override
    public Ticker getTicker(String pair) {
        LinkedHashMap<String, Object> params = symbolParams(pair);
        JsonNode ticker24h = read(call("ticker24H " + pair, () -> client.market().ticker24H(params)));
        JsonNode book = read(call("bookTicker " + pair, () -> client.market().bookTicker(symbolParams(pair))));
        return ExchangeMapper.tickerFromRest(ticker24h, book, pair);
    }

    @Override
    public OrderBook getOrderBook(String pair, int depth) {
        LinkedHashMap<String, Object> params = symbolParams(pair);
        params.put("limit", depthLimit(depth));
        return ExchangeMapper.orderBookFromRest(read(call("depth " + pair, () -> client.market().depth(params))));
    }

    @Override
    public Map<String, Ticker> getTickers() {
        if (marketsByPair.isEmpty()) {
            getMarkets();
        }
        Map<String, String> pairBySymbol = new HashMap<>();
        marketsByPair.values().forEach(m -> pairBySymbol.put(m.getSymbol(), m.getPair()));

        JsonNode array = read(call("ticker24H", () -> client.market().ticker24H(new LinkedHashMap<>())));
        Map<String, Ticker> tickers = new LinkedHashMap<>();
        for (JsonNode node : array) {
            String pair = pairBySymbol.get(node.path("symbol").asText());
            if (pair != null) {
                tickers.put(pair, ExchangeMapper.tickerFromRest(node, null, pair));
            }
        }
        return tickers;
    }

    @Override
    public List<MarketInfo> getMarkets() {
        List<MarketInfo> markets = ExchangeMapper.marketsFromExchangeInfo(
                read(call("exchangeInfo", () -> client.market().exchangeInfo())));
        markets.forEach(m -> marketsByPair.put(m.getPair(), m));
        return markets;
    }

    @Override
    public List<KlineModel> getTickerHistory(String pair, IntervalE interval) {
        String url = String.format("%s%s?symbol=%s&interval=%s&limit=%d",
                appConfig.getBinanceUrl(), BASE_URL_KLINES, SymbolHelper.toSymbol(pair), interval.getValue(), KLINES_LIMIT);
        log.debug("Getting klines from: {}", url);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new TemporaryException("Klines request failed: HTTP " + response.statusCode() + " - " + response.body());
            }
            return KlineMapper.getKlineModels(pair, interval, response.body());
        } catch (IOException e) {
            throw new TemporaryException("Could not load ticker history for " + pair, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TemporaryException("Interrupted while loading ticker history for " + pair, e);
        }
    }

    @Override
    public String buy(String pair, BigDecimal rate, BigDecimal amount) {
        if (properties.isDryRun()) {
            return dryRunOrder(pair, OrderSide.BUY, rate, amount);
        }
        return placeLimitOrder(pair, OrderSide.BUY, rate, amount);
    }

    @Override
    public String sell(String pair, BigDecimal rate, BigDecimal amount) {
        if (properties.isDryRun()) {
            return dryRunOrder(pair, OrderSide.SELL, rate, amount);
        }
        return placeLimitOrder(pair, OrderSide.SELL, rate, amount);
    }

    @Override
    public void cancelOrder(String orderId, String pair) {
        if (properties.isDryRun()) {
            return;
        }
        LinkedHashMap<String, Object> params = symbolParams(pair);
        params.put("orderId", Long.parseLong(orderId));
        call("cancelOrder " + orderId, () -> client.account().cancelOrder(params));
        log.info("🗑 Order {} for {} cancelled", orderId, pair);
    }

    @Override
    public ExchangeOrder getOrder(String orderId, String pair) {
        if (properties.isDryRun()) {
            ExchangeOrder order = dryRunOrders.get(orderId);
            if (order == null) {
                throw new DependencyException("Dry-run order " + orderId + " not found");
            }
            return order;
        }
        LinkedHashMap<String, Object> params = symbolParams(pair);
        params.put("orderId", Long.parseLong(orderId));
        return ExchangeMapper.orderFromRest(read(call("queryOrder " + orderId, () -> client.account().queryOrder(params))), pair);
    }

    @Override
    public List<OrderFill> getTradesForOrder(String orderId, String pair, LocalDateTime since) {
        if (properties.isDryRun()) {
            return List.of();
        }
        LinkedHashMap<String, Object> params = symbolParams(pair);
        params.put("startTime", since.toInstant(ZoneOffset.UTC).toEpochMilli());
        List<OrderFill> fills = ExchangeMapper.fillsFromRest(
                read(call("accountTradeList " + pair, () -> client.account().accountTradeList(params))), pair);
        return fills.stream()
                .filter(f -> orderId.equals(f.getOrderId()))
                .toList();
    }

    @Override
    public BigDecimal getFee(String pair, FeeType feeType) {
        BotProperties.Exchange fees = properties.getExchange();
        return feeType == FeeType.MAKER ? fees.getMakerFee() : fees.getTakerFee();
    }

    @Override
    public BigDecimal getBalance(String currency) {
        if (properties.isDryRun()) {
            return properties.getDryRunWallet();
        }
        JsonNode account = read(call("accountInformation", () -> client.account().accountInformation(new LinkedHashMap<>())));
        return ExchangeMapper.balanceFromAccount(account, currency);
    }

    @Override
    public String getPairDetailUrl(String pair) {
        return "https://www.binance.com/en/futures/" + SymbolHelper.toSymbol(pair);
    }

    private String placeLimitOrder(String pair, OrderSide side, BigDecimal rate, BigDecimal amount) {
        MarketInfo market = marketFor(pair);
        BigDecimal price = MathHelper.floorToStep(rate, market != null ? market.getTickSize() : null);
        BigDecimal quantity = MathHelper.floorToStep(amount, market != null ? market.getStepSize() : null);

        LinkedHashMap<String, Object> params = symbolParams(pair);
        params.put("side", side.name());
        params.put("type", "LIMIT");
        params.put("timeInForce", "GTC");
        params.put("quantity", quantity.toPlainString());
        params.put("price", price.toPlainString());

        log.info("📤 Sending limit order request: {}", params);
        JsonNode response = read(call("newOrder " + pair, () -> client.account().newOrder(params)));
        String orderId = response.path("orderId").asText(null);
        if (orderId == null) {
            throw new OperationalException("Exchange did not return an order id for " + pair + ": " + response);
        }
        log.info("✅ {} order {} placed for {} (price={}, qty={})", side, orderId, pair, price, quantity);
        return orderId;
    }

    private String dryRunOrder(String pair, OrderSide side, BigDecimal rate, BigDecimal amount) {
        String orderId = DRY_RUN_ORDER_PREFIX + side.name().toLowerCase() + "_" + dryRunSequence.incrementAndGet();
        dryRunOrders.put(orderId, ExchangeOrder.builder()
                .id(orderId)
                .pair(pair)
                .side(side)
                .status(OrderStatus.CLOSED)
                .type("LIMIT")
                .price(rate)
                .amount(amount)
                .filled(amount)
                .remaining(BigDecimal.ZERO)
                .datetime(LocalDateTime.now(clock))
                .build());
        log.info("🧪 Dry-run {} order {} for {} (price={}, qty={})", side, orderId, pair, rate, amount);
        return orderId;
    }

    private MarketInfo marketFor(String pair) {
        if (!marketsByPair.containsKey(pair)) {
            getMarkets();
        }
        return marketsByPair.get(pair);
    }

    private LinkedHashMap<String, Object> symbolParams(String pair) {
        LinkedHashMap<String, Object> params = new LinkedHashMap<>();
        params.put("symbol", SymbolHelper.toSymbol(pair));
        return params;
    }

    private static int depthLimit(int depth) {
        for (int limit : DEPTH_LIMITS) {
            if (depth <= limit) {
                return limit;
            }
        }
        return DEPTH_LIMITS[DEPTH_LIMITS.length - 1];
    }

    private String call(String action, Supplier<String> request) {
        try {
            return request.get();
        } catch (BinanceClientException e) {
            if (RECOVERABLE_ERROR_CODES.contains(e.getErrorCode())) {
                throw new DependencyException(action + " rejected by exchange: " + e.getErrMsg(), e);
            }
            throw new OperationalException(action + " failed (code " + e.getErrorCode() + "): " + e.getErrMsg(), e);
        } catch (BinanceServerException | BinanceConnectorException e) {
            throw new TemporaryException(action + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode read(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TemporaryException("Unreadable exchange response: " + json, e);
        }
    }
}
