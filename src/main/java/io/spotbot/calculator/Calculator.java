package io.spotbot.calculator;

import io.spotbot.strategy.model.AnalyzedCandle;
import lombok.experimental.UtilityClass;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.Num;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

@UtilityClass
public class Calculator {

    /**
     * EMA of close prices for every candle; {@code NaN} until enough candles are available.
     */
    public static double[] ema(List<AnalyzedCandle> candles, int period) {
        ClosePriceIndicator closePrice = new ClosePriceIndicator(createBarSeries(candles));
        return values(new EMAIndicator(closePrice, period), candles.size(), period);
    }

    public static double[] rsi(List<AnalyzedCandle> candles, int period) {
        ClosePriceIndicator closePrice = new ClosePriceIndicator(createBarSeries(candles));
        return values(new RSIIndicator(closePrice, period), candles.size(), period);
    }

    private static double[] values(Indicator<Num> indicator, int size, int period) {
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            result[i] = i >= period - 1 ? indicator.getValue(i).doubleValue() : Double.NaN;
        }
        return result;
    }

    private static BarSeries createBarSeries(List<AnalyzedCandle> candles) {
        if (candles == null || candles.isEmpty()) {
            throw new IllegalArgumentException("Candle list cannot be null or empty");
        }

        BarSeries series = new BaseBarSeries();
        for (AnalyzedCandle candle : candles) {
            series.addBar(
                    ZonedDateTime.ofInstant(candle.getDate(), ZoneId.of("UTC")),
                    series.numOf(candle.getOpen()),
                    series.numOf(candle.getHigh()),
                    series.numOf(candle.getLow()),
                    series.numOf(candle.getClose()),
                    series.numOf(candle.getVolume())
            );
        }
        return series;
    }
}
