package io.spotbot.strategy;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.klines.enums.IntervalE;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StrategyResolver Tests")
class StrategyResolverTest {

    @Test
    @DisplayName("Strategy defaults are used without overrides")
    void testDefaults() {
        BotProperties properties = new BotProperties();
        properties.setStrategy(EmaCrossStrategy.NAME);

        StrategyResolver resolver = new StrategyResolver(List.of(new EmaCrossStrategy()), properties);

        assertEquals(EmaCrossStrategy.NAME, resolver.getStrategy().getName());
        assertEquals(new BigDecimal("-0.10"), resolver.getStoploss());
        assertEquals(IntervalE.FIVE_MINUTES, resolver.getTickerInterval());
        assertEquals(4, resolver.getMinimalRoi().size());
    }

    @Test
    @DisplayName("Config values override strategy defaults")
    void testOverrides() {
        LinkedHashMap<Integer, BigDecimal> roi = new LinkedHashMap<>();
        roi.put(0, new BigDecimal("0.05"));
        BotProperties properties = new BotProperties();
        properties.setStrategy(EmaCrossStrategy.NAME);
        properties.setStoploss(new BigDecimal("-0.05"));
        properties.setMinimalRoi(roi);
        properties.setTickerInterval("1h");

        StrategyResolver resolver = new StrategyResolver(List.of(new EmaCrossStrategy()), properties);

        assertEquals(new BigDecimal("-0.05"), resolver.getStoploss());
        assertEquals(IntervalE.ONE_HOUR, resolver.getTickerInterval());
        assertEquals(roi, resolver.getMinimalRoi());
    }

    @Test
    @DisplayName("Unknown strategy name fails fast")
    void testUnknownStrategy() {
        BotProperties properties = new BotProperties();
        properties.setStrategy("missing");

        assertThrows(IllegalStateException.class,
                () -> new StrategyResolver(List.of(new EmaCrossStrategy()), properties));
    }
}
