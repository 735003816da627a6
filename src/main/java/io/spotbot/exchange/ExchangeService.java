package io.spotbot.exchange;

import io.spotbot.exchange.model.*;
import io.spotbot.klines.enums.IntervalE;
import io.spotbot.klines.model.KlineModel;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything the bot needs from an exchange. Pairs are written as {@code BASE/QUOTE}.
 * Failures surface as {@link io.spotbot.exceptions.TemporaryException},
 * {@link io.spotbot.exceptions.DependencyException} or
 * {@link io.spotbot.exceptions.OperationalException}.
 */
public interface ExchangeService {
    String DRY_RUN_ORDER_PREFIX = "dry_run_";

    String getName();

    boolean supportsTickers();

    Ticker getTicker(String pair);

    OrderBook getOrderBook(String pair, int depth);

    Map<String, Ticker> getTickers();

    List<MarketInfo> getMarkets();

    List<KlineModel> getTickerHistory(String pair, IntervalE interval);

    String buy(String pair, BigDecimal rate, BigDecimal amount);

    String sell(String pair, BigDecimal rate, BigDecimal amount);

    void cancelOrder(String orderId, String pair);

    ExchangeOrder getOrder(String orderId, String pair);

    List<OrderFill> getTradesForOrder(String orderId, String pair, LocalDateTime since);

    BigDecimal getFee(String pair, FeeType feeType);

    BigDecimal getBalance(String currency);

    String getPairDetailUrl(String pair);

    enum FeeType {
        MAKER,
        TAKER
    }
}
