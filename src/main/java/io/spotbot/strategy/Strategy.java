package io.spotbot.strategy;

import io.spotbot.klines.enums.IntervalE;
import io.spotbot.strategy.model.AnalyzedCandle;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Pluggable trading strategy. Implementations are Spring beans, the active one is picked by
 * {@link StrategyResolver} from {@code bot.strategy}.
 */
public interface Strategy {
    String getName();

    void populateIndicators(List<AnalyzedCandle> candles, String pair);

    void populateBuyTrend(List<AnalyzedCandle> candles, String pair);

    void populateSellTrend(List<AnalyzedCandle> candles, String pair);

    /**
     * Negative fraction, e.g. -0.10 for a 10% stop loss.
     */
    BigDecimal getStoploss();

    /**
     * Minutes since open -> required profit, walked in insertion order.
     */
    LinkedHashMap<Integer, BigDecimal> getMinimalRoi();

    IntervalE getTickerInterval();
}
