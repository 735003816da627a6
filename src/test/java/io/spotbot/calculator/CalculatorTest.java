package io.spotbot.calculator;

import io.spotbot.strategy.model.AnalyzedCandle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Calculator Tests")
class CalculatorTest {

    private static List<AnalyzedCandle> flat(int size, String price) {
        List<AnalyzedCandle> candles = new ArrayList<>();
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        for (int i = 0; i < size; i++) {
            BigDecimal p = new BigDecimal(price);
            candles.add(AnalyzedCandle.builder()
                    .date(start.plusSeconds(60L * i))
                    .open(p).high(p).low(p).close(p)
                    .volume(BigDecimal.ONE)
                    .build());
        }
        return candles;
    }

    @Test
    @DisplayName("EMA is undefined until the period is filled")
    void testEmaWarmup() {
        double[] ema = Calculator.ema(flat(12, "100"), 9);

        assertEquals(12, ema.length);
        assertTrue(Double.isNaN(ema[7]));
        assertEquals(100.0, ema[8], 1e-9);
        assertEquals(100.0, ema[11], 1e-9);
    }

    @Test
    @DisplayName("Empty candle list is rejected")
    void testEmptyCandles() {
        assertThrows(IllegalArgumentException.class, () -> Calculator.rsi(List.of(), 14));
    }
}
