package io.spotbot.signal;

import io.spotbot.exchange.ExchangeService;
import io.spotbot.klines.enums.IntervalE;
import io.spotbot.klines.model.KlineModel;
import io.spotbot.signal.model.Signal;
import io.spotbot.strategy.Strategy;
import io.spotbot.strategy.StrategyResolver;
import io.spotbot.strategy.model.AnalyzedCandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SignalServiceImpl Tests")
class SignalServiceImplTest {
    private static final String PAIR = "ETH/USDT";
    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Mock
    private ExchangeService exchangeService;
    @Mock
    private StrategyResolver strategyResolver;

    private SignalServiceImpl signalService;

    @BeforeEach
    void setUp() {
        signalService = new SignalServiceImpl(exchangeService, strategyResolver, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static KlineModel kline(Instant openTime, String close) {
        KlineModel kline = new KlineModel();
        kline.setOpenTime(openTime.toEpochMilli());
        kline.setCloseTime(openTime.toEpochMilli() + IntervalE.FIVE_MINUTES.getMillis() - 1);
        kline.setPair(PAIR);
        kline.setInterval(IntervalE.FIVE_MINUTES);
        kline.setOpenPrice(new BigDecimal(close));
        kline.setHighPrice(new BigDecimal(close));
        kline.setLowPrice(new BigDecimal(close));
        kline.setClosePrice(new BigDecimal(close));
        kline.setVolume(BigDecimal.TEN);
        return kline;
    }

    // 5m klines from start up to and including end
    private static List<KlineModel> klines(Instant start, Instant end) {
        List<KlineModel> klines = new ArrayList<>();
        for (Instant t = start; !t.isAfter(end); t = t.plusSeconds(300)) {
            klines.add(kline(t, "100"));
        }
        return klines;
    }

    @Test
    @DisplayName("Signal is read from the latest closed candle")
    void testBuySignal() {
        when(exchangeService.getTickerHistory(PAIR, IntervalE.FIVE_MINUTES))
                .thenReturn(klines(Instant.parse("2024-01-01T11:00:00Z"), NOW));
        when(strategyResolver.getStrategy()).thenReturn(new LastCandleStrategy(true, false));

        Signal signal = signalService.getSignal(PAIR, IntervalE.FIVE_MINUTES);

        assertTrue(signal.isBuy());
        assertFalse(signal.isSell());
    }

    @Test
    @DisplayName("Outdated history yields no signal")
    void testStaleHistory() {
        // latest closed candle opens at 11:35, older than 12:00 - 2 * 5m - 5m
        when(exchangeService.getTickerHistory(PAIR, IntervalE.FIVE_MINUTES))
                .thenReturn(klines(Instant.parse("2024-01-01T10:00:00Z"), Instant.parse("2024-01-01T11:40:00Z")));
        when(strategyResolver.getStrategy()).thenReturn(new LastCandleStrategy(true, true));

        assertEquals(Signal.NONE, signalService.getSignal(PAIR, IntervalE.FIVE_MINUTES));
    }

    @Test
    @DisplayName("Empty history yields no signal")
    void testEmptyHistory() {
        when(exchangeService.getTickerHistory(PAIR, IntervalE.FIVE_MINUTES)).thenReturn(List.of());

        assertEquals(Signal.NONE, signalService.getSignal(PAIR, IntervalE.FIVE_MINUTES));
        verifyNoInteractions(strategyResolver);
    }

    @Test
    @DisplayName("Strategy failures are contained")
    void testStrategyFailure() {
        when(exchangeService.getTickerHistory(PAIR, IntervalE.FIVE_MINUTES))
                .thenReturn(klines(Instant.parse("2024-01-01T11:00:00Z"), NOW));
        Strategy broken = mock(Strategy.class);
        doThrow(new IllegalArgumentException("not enough data")).when(broken).populateIndicators(anyList(), eq(PAIR));
        when(strategyResolver.getStrategy()).thenReturn(broken);

        assertEquals(Signal.NONE, signalService.getSignal(PAIR, IntervalE.FIVE_MINUTES));
    }

    @Test
    @DisplayName("Candles are sorted, merged per timestamp and the forming one is dropped")
    void testParseTickerHistory() {
        Instant t0 = Instant.parse("2024-01-01T11:00:00Z");
        Instant t1 = t0.plusSeconds(300);
        Instant t2 = t1.plusSeconds(300);

        KlineModel first = kline(t1, "101");
        KlineModel duplicate = kline(t1, "102");
        duplicate.setHighPrice(new BigDecimal("105"));
        duplicate.setLowPrice(new BigDecimal("99"));
        duplicate.setVolume(new BigDecimal("3"));

        List<AnalyzedCandle> candles = signalService.parseTickerHistory(
                List.of(kline(t2, "103"), first, kline(t0, "100"), duplicate));

        assertEquals(2, candles.size());
        assertEquals(t0, candles.get(0).getDate());
        AnalyzedCandle merged = candles.get(1);
        assertEquals(t1, merged.getDate());
        assertEquals(new BigDecimal("105"), merged.getHigh());
        assertEquals(new BigDecimal("99"), merged.getLow());
        assertEquals(new BigDecimal("102"), merged.getClose());
        assertEquals(BigDecimal.TEN, merged.getVolume());
    }

    @Test
    @DisplayName("Incomplete klines are rejected")
    void testParseIncompleteKline() {
        KlineModel broken = kline(NOW, "100");
        broken.setClosePrice(null);

        assertThrows(IllegalArgumentException.class, () -> signalService.parseTickerHistory(List.of(broken)));
    }

    private record LastCandleStrategy(boolean buy, boolean sell) implements Strategy {
        @Override
        public String getName() {
            return "lastCandle";
        }

        @Override
        public void populateIndicators(List<AnalyzedCandle> candles, String pair) {
        }

        @Override
        public void populateBuyTrend(List<AnalyzedCandle> candles, String pair) {
            candles.get(candles.size() - 1).setBuy(buy);
        }

        @Override
        public void populateSellTrend(List<AnalyzedCandle> candles, String pair) {
            candles.get(candles.size() - 1).setSell(sell);
        }

        @Override
        public BigDecimal getStoploss() {
            return new BigDecimal("-0.10");
        }

        @Override
        public LinkedHashMap<Integer, BigDecimal> getMinimalRoi() {
            return new LinkedHashMap<>();
        }

        @Override
        public IntervalE getTickerInterval() {
            return IntervalE.FIVE_MINUTES;
        }
    }
}
