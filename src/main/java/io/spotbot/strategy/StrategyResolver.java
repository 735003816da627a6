package io.spotbot.strategy;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.klines.enums.IntervalE;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Picks the strategy named in {@code bot.strategy} and merges config overrides
 * (stoploss, minimal ROI, ticker interval) on top of its defaults.
 */
@Slf4j
@Getter
@Component
public class StrategyResolver {
    private final Strategy strategy;
    private final BigDecimal stoploss;
    private final LinkedHashMap<Integer, BigDecimal> minimalRoi;
    private final IntervalE tickerInterval;

    public StrategyResolver(List<Strategy> strategies, BotProperties properties) {
        this.strategy = strategies.stream()
                .filter(s -> s.getName().equals(properties.getStrategy()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown strategy '" + properties.getStrategy()
                        + "', available: " + strategies.stream().map(Strategy::getName).collect(Collectors.joining(", "))));

        if (properties.getStoploss() != null) {
            log.info("Override strategy stoploss with config value: {}", properties.getStoploss());
            this.stoploss = properties.getStoploss();
        } else {
            this.stoploss = strategy.getStoploss();
        }

        if (properties.getMinimalRoi() != null && !properties.getMinimalRoi().isEmpty()) {
            log.info("Override strategy minimal ROI with config value: {}", properties.getMinimalRoi());
            this.minimalRoi = new LinkedHashMap<>(properties.getMinimalRoi());
        } else {
            this.minimalRoi = strategy.getMinimalRoi();
        }

        if (properties.getTickerInterval() != null && !properties.getTickerInterval().isBlank()) {
            log.info("Override strategy ticker interval with config value: {}", properties.getTickerInterval());
            this.tickerInterval = IntervalE.fromString(properties.getTickerInterval());
        } else {
            this.tickerInterval = strategy.getTickerInterval();
        }

        log.info("Using strategy '{}' (stoploss={}, interval={}, roi={})",
                strategy.getName(), stoploss, tickerInterval.getValue(), minimalRoi);
    }
}
