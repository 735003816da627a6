package io.spotbot.trading.decision;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.strategy.StrategyResolver;
import io.spotbot.trade.enums.SellType;
import io.spotbot.trade.model.Trade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SellDecision Tests")
class SellDecisionTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 12, 0);
    private static final String PAIR = "ETH/USDT";

    @Mock
    private StrategyResolver strategyResolver;

    @Mock
    private ExchangeService exchangeService;

    private BotProperties properties;
    private SellDecision sellDecision;
    private Trade trade;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        sellDecision = new SellDecision(strategyResolver, properties, exchangeService);

        LinkedHashMap<Integer, BigDecimal> roi = new LinkedHashMap<>();
        roi.put(0, new BigDecimal("0.10"));
        roi.put(30, new BigDecimal("0.05"));
        roi.put(60, new BigDecimal("0.02"));
        lenient().when(strategyResolver.getMinimalRoi()).thenReturn(roi);
        lenient().when(strategyResolver.getStoploss()).thenReturn(new BigDecimal("-0.10"));

        trade = Trade.builder()
                .pair(PAIR)
                .amount(BigDecimal.ONE)
                .stakeAmount(new BigDecimal("100"))
                .openRate(new BigDecimal("100"))
                .feeOpen(BigDecimal.ZERO)
                .feeClose(BigDecimal.ZERO)
                .openDate(NOW.minusMinutes(45))
                .build();
    }

    @Test
    @DisplayName("ROI entry whose window has passed triggers a sell")
    void testMinRoiReachedAfterWindow() {
        // 45 minutes: (0, 0.10) not met, (30, 0.05) met
        assertTrue(sellDecision.minRoiReached(trade, new BigDecimal("0.06"), NOW));
    }

    @Test
    @DisplayName("ROI entry whose window has not passed short-circuits")
    void testMinRoiNotYetEligible() {
        trade.setOpenDate(NOW.minusMinutes(20));

        assertFalse(sellDecision.minRoiReached(trade, new BigDecimal("0.06"), NOW));
        assertTrue(sellDecision.minRoiReached(trade, new BigDecimal("0.11"), NOW));
    }

    @Test
    @DisplayName("ROI table is walked in defined order, not sorted")
    void testMinRoiDefinitionOrder() {
        LinkedHashMap<Integer, BigDecimal> roi = new LinkedHashMap<>();
        roi.put(60, new BigDecimal("0.01"));
        roi.put(0, new BigDecimal("0.01"));
        when(strategyResolver.getMinimalRoi()).thenReturn(roi);

        assertFalse(sellDecision.minRoiReached(trade, new BigDecimal("0.50"), NOW));
    }

    @Test
    @DisplayName("Should sell on ROI")
    void testShouldSellOnRoi() {
        SellType result = sellDecision.shouldSell(trade, new BigDecimal("106"), NOW, false, false);

        assertEquals(SellType.ROI, result);
        assertEquals(0, new BigDecimal("90").compareTo(trade.getStopLoss()));
    }

    @Test
    @DisplayName("Stop loss wins over a sell signal")
    void testStopLossBeforeSellSignal() {
        properties.getExperimental().setUseSellSignal(true);

        SellType result = sellDecision.shouldSell(trade, new BigDecimal("89"), NOW, false, true);

        assertEquals(SellType.STOP_LOSS, result);
    }

    @Test
    @DisplayName("Trailing stop ratchets up and never down")
    void testTrailingStop() {
        properties.getTrailingStop().setEnabled(true);
        LinkedHashMap<Integer, BigDecimal> roi = new LinkedHashMap<>();
        roi.put(0, new BigDecimal("10"));
        when(strategyResolver.getMinimalRoi()).thenReturn(roi);

        assertEquals(SellType.NONE, sellDecision.shouldSell(trade, new BigDecimal("100"), NOW, false, false));
        assertEquals(0, new BigDecimal("90").compareTo(trade.getStopLoss()));

        assertEquals(SellType.NONE, sellDecision.shouldSell(trade, new BigDecimal("120"), NOW, false, false));
        assertEquals(0, new BigDecimal("108").compareTo(trade.getStopLoss()));

        assertEquals(SellType.NONE, sellDecision.shouldSell(trade, new BigDecimal("110"), NOW, false, false));
        assertEquals(0, new BigDecimal("108").compareTo(trade.getStopLoss()));

        assertEquals(SellType.TRAILING_STOP_LOSS, sellDecision.shouldSell(trade, new BigDecimal("107"), NOW, false, false));
        assertEquals(0, new BigDecimal("90").compareTo(trade.getInitialStopLoss()));
    }

    @Test
    @DisplayName("Positive trailing offset applies only while in profit")
    void testTrailingStopPositive() {
        properties.getTrailingStop().setEnabled(true);
        properties.getTrailingStop().setPositive(new BigDecimal("0.02"));
        LinkedHashMap<Integer, BigDecimal> roi = new LinkedHashMap<>();
        roi.put(0, new BigDecimal("10"));
        when(strategyResolver.getMinimalRoi()).thenReturn(roi);

        sellDecision.shouldSell(trade, new BigDecimal("95"), NOW, false, false);
        assertEquals(0, new BigDecimal("90").compareTo(trade.getStopLoss()));

        sellDecision.shouldSell(trade, new BigDecimal("120"), NOW, false, false);
        assertEquals(0, new BigDecimal("117.6").compareTo(trade.getStopLoss()));
    }

    @Test
    @DisplayName("Sell signal is used when enabled")
    void testSellSignal() {
        properties.getExperimental().setUseSellSignal(true);

        assertEquals(SellType.SELL_SIGNAL, sellDecision.shouldSell(trade, new BigDecimal("95"), NOW, false, true));
        assertEquals(SellType.NONE, sellDecision.shouldSell(trade, new BigDecimal("95"), NOW, true, true));
    }

    @Test
    @DisplayName("Sell signal is ignored when disabled")
    void testSellSignalDisabled() {
        assertEquals(SellType.NONE, sellDecision.shouldSell(trade, new BigDecimal("95"), NOW, false, true));
    }

    @Test
    @DisplayName("Sell profit only suppresses signal sells at a loss")
    void testSellProfitOnly() {
        properties.getExperimental().setUseSellSignal(true);
        properties.getExperimental().setSellProfitOnly(true);

        assertEquals(SellType.NONE, sellDecision.shouldSell(trade, new BigDecimal("95"), NOW, false, true));
        assertEquals(SellType.SELL_SIGNAL, sellDecision.shouldSell(trade, new BigDecimal("101"), NOW, false, true));
    }

    @Test
    @DisplayName("Unmet sell conditions leave the trade unchanged")
    void testIdempotentWhenNoSell() {
        trade.setOpenDate(NOW.minusMinutes(5));
        trade.setStopLoss(new BigDecimal("90"));
        trade.setInitialStopLoss(new BigDecimal("90"));
        Trade before = trade.toBuilder().build();

        for (int i = 0; i < 3; i++) {
            assertEquals(SellType.NONE, sellDecision.shouldSell(trade, new BigDecimal("101"), NOW, false, false));
        }

        assertEquals(before.getStopLoss(), trade.getStopLoss());
        assertEquals(before.getInitialStopLoss(), trade.getInitialStopLoss());
        assertEquals(before.getAmount(), trade.getAmount());
        assertEquals(before.getOpenOrderId(), trade.getOpenOrderId());
        assertEquals(before.getCloseRate(), trade.getCloseRate());
        assertTrue(trade.isOpen());
    }

    @Test
    @DisplayName("ROI rate covers round trip fees and is truncated")
    void testGetRoiRate() {
        when(exchangeService.getFee(PAIR, ExchangeService.FeeType.TAKER)).thenReturn(new BigDecimal("0.001"));

        BigDecimal rate = sellDecision.getRoiRate(trade, new BigDecimal("99"), NOW);

        // 100 * 1.10 * 1.0021
        assertEquals(0, new BigDecimal("110.231").compareTo(rate));
        assertEquals(8, rate.scale());
    }

    @Test
    @DisplayName("ROI rate falls back when no window has passed")
    void testGetRoiRateFallback() {
        trade.setOpenDate(NOW);
        when(exchangeService.getFee(PAIR, ExchangeService.FeeType.TAKER)).thenReturn(new BigDecimal("0.001"));

        assertEquals(new BigDecimal("99"), sellDecision.getRoiRate(trade, new BigDecimal("99"), NOW));
    }
}
