package io.spotbot.signal;

import io.spotbot.exchange.ExchangeService;
import io.spotbot.klines.enums.IntervalE;
import io.spotbot.klines.model.KlineModel;
import io.spotbot.signal.model.Signal;
import io.spotbot.strategy.Strategy;
import io.spotbot.strategy.StrategyResolver;
import io.spotbot.strategy.model.AnalyzedCandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

@Slf4j
@Service
@RequiredArgsConstructor
public class SignalServiceImpl implements SignalService {
    private static final Duration STALE_GRACE = Duration.ofMinutes(5);

    private final ExchangeService exchangeService;
    private final StrategyResolver strategyResolver;
    private final Clock clock;

    @Override
    public Signal getSignal(String pair, IntervalE interval) {
        List<KlineModel> history = exchangeService.getTickerHistory(pair, interval);
        if (history == null || history.isEmpty()) {
            log.warn("Empty ticker history for pair {}", pair);
            return Signal.NONE;
        }

        List<AnalyzedCandle> candles;
        try {
            candles = analyzeTicker(history, pair);
        } catch (IllegalArgumentException e) {
            log.warn("Unable to analyze ticker for pair {}: {}", pair, e.getMessage());
            return Signal.NONE;
        } catch (Exception e) {
            log.error("Unexpected error when analyzing ticker for pair {}", pair, e);
            return Signal.NONE;
        }

        if (candles.isEmpty()) {
            log.warn("Empty dataframe for pair {}", pair);
            return Signal.NONE;
        }

        AnalyzedCandle latest = candles.get(candles.size() - 1);
        Instant staleBefore = clock.instant()
                .minus(Duration.ofMinutes(interval.getMinutes() * 2L))
                .minus(STALE_GRACE);
        if (latest.getDate().isBefore(staleBefore)) {
            log.warn("Outdated history for pair {}. Last tick is {} minutes old",
                    pair, Duration.between(latest.getDate(), clock.instant()).toMinutes());
            return Signal.NONE;
        }

        Signal signal = new Signal(latest.isBuy(), latest.isSell());
        log.debug("trigger: {} (pair={}) buy={} sell={}", latest.getDate(), pair, signal.isBuy(), signal.isSell());
        return signal;
    }

    @Override
    public List<AnalyzedCandle> analyzeTicker(List<KlineModel> klines, String pair) {
        Strategy strategy = strategyResolver.getStrategy();
        List<AnalyzedCandle> candles = parseTickerHistory(klines);
        if (candles.isEmpty()) {
            return candles;
        }
        strategy.populateIndicators(candles, pair);
        strategy.populateBuyTrend(candles, pair);
        strategy.populateSellTrend(candles, pair);
        return candles;
    }

    /**
     * Sorts by open time, merges duplicate timestamps and drops the last (still forming) candle.
     */
    @Override
    public List<AnalyzedCandle> parseTickerHistory(List<KlineModel> klines) {
        TreeMap<Long, AnalyzedCandle> byOpenTime = new TreeMap<>();
        for (KlineModel k : klines) {
            if (k.getOpenPrice() == null || k.getClosePrice() == null) {
                throw new IllegalArgumentException("Incomplete kline at " + k.getOpenTime());
            }
            AnalyzedCandle existing = byOpenTime.get(k.getOpenTime());
            if (existing == null) {
                byOpenTime.put(k.getOpenTime(), AnalyzedCandle.builder()
                        .date(k.getOpenTimeInstant())
                        .open(k.getOpenPrice())
                        .high(k.getHighPrice())
                        .low(k.getLowPrice())
                        .close(k.getClosePrice())
                        .volume(k.getVolume())
                        .build());
            } else {
                existing.setHigh(existing.getHigh().max(k.getHighPrice()));
                existing.setLow(existing.getLow().min(k.getLowPrice()));
                existing.setClose(k.getClosePrice());
                existing.setVolume(existing.getVolume().max(k.getVolume()));
            }
        }
        List<AnalyzedCandle> candles = new ArrayList<>(byOpenTime.values());
        if (!candles.isEmpty()) {
            candles.remove(candles.size() - 1);
        }
        return candles;
    }
}
