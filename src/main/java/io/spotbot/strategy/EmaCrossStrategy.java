package io.spotbot.strategy;

import io.spotbot.calculator.Calculator;
import io.spotbot.klines.enums.IntervalE;
import io.spotbot.strategy.model.AnalyzedCandle;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Buys when the fast EMA crosses above the slow one and RSI is not overbought,
 * sells on the opposite cross or when RSI gets hot.
 */
@Component(EmaCrossStrategy.NAME)
public class EmaCrossStrategy implements Strategy {
    public static final String NAME = "emaCrossStrategy";

    public static final String EMA_FAST = "ema_fast";
    public static final String EMA_SLOW = "ema_slow";
    public static final String RSI = "rsi";

    private static final int EMA_FAST_PERIOD = 9;
    private static final int EMA_SLOW_PERIOD = 21;
    private static final int RSI_PERIOD = 14;
    private static final double RSI_BUY_MAX = 70.0;
    private static final double RSI_SELL_MIN = 80.0;

    private static final BigDecimal STOPLOSS = new BigDecimal("-0.10");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void populateIndicators(List<AnalyzedCandle> candles, String pair) {
        if (candles.isEmpty()) {
            return;
        }
        double[] fast = Calculator.ema(candles, EMA_FAST_PERIOD);
        double[] slow = Calculator.ema(candles, EMA_SLOW_PERIOD);
        double[] rsi = Calculator.rsi(candles, RSI_PERIOD);

        for (int i = 0; i < candles.size(); i++) {
            AnalyzedCandle candle = candles.get(i);
            candle.putIndicator(EMA_FAST, fast[i]);
            candle.putIndicator(EMA_SLOW, slow[i]);
            candle.putIndicator(RSI, rsi[i]);
        }
    }

    @Override
    public void populateBuyTrend(List<AnalyzedCandle> candles, String pair) {
        for (int i = 1; i < candles.size(); i++) {
            AnalyzedCandle prev = candles.get(i - 1);
            AnalyzedCandle cur = candles.get(i);
            boolean crossUp = below(prev, EMA_FAST, EMA_SLOW) && above(cur, EMA_FAST, EMA_SLOW);
            cur.setBuy(crossUp && valid(cur.indicator(RSI)) && cur.indicator(RSI) < RSI_BUY_MAX);
        }
    }

    @Override
    public void populateSellTrend(List<AnalyzedCandle> candles, String pair) {
        for (int i = 1; i < candles.size(); i++) {
            AnalyzedCandle prev = candles.get(i - 1);
            AnalyzedCandle cur = candles.get(i);
            boolean crossDown = above(prev, EMA_FAST, EMA_SLOW) && below(cur, EMA_FAST, EMA_SLOW);
            boolean hot = valid(cur.indicator(RSI)) && cur.indicator(RSI) > RSI_SELL_MIN;
            cur.setSell(crossDown || hot);
        }
    }

    @Override
    public BigDecimal getStoploss() {
        return STOPLOSS;
    }

    @Override
    public LinkedHashMap<Integer, BigDecimal> getMinimalRoi() {
        LinkedHashMap<Integer, BigDecimal> roi = new LinkedHashMap<>();
        roi.put(0, new BigDecimal("0.04"));
        roi.put(20, new BigDecimal("0.02"));
        roi.put(30, new BigDecimal("0.01"));
        roi.put(40, BigDecimal.ZERO);
        return roi;
    }

    @Override
    public IntervalE getTickerInterval() {
        return IntervalE.FIVE_MINUTES;
    }

    private static boolean above(AnalyzedCandle candle, String a, String b) {
        Double x = candle.indicator(a);
        Double y = candle.indicator(b);
        return valid(x) && valid(y) && x > y;
    }

    private static boolean below(AnalyzedCandle candle, String a, String b) {
        Double x = candle.indicator(a);
        Double y = candle.indicator(b);
        return valid(x) && valid(y) && x < y;
    }

    private static boolean valid(Double value) {
        return value != null && !value.isNaN();
    }
}
