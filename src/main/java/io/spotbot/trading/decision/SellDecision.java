package io.spotbot.trading.decision;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.helpers.MathHelper;
import io.spotbot.strategy.StrategyResolver;
import io.spotbot.trade.enums.SellType;
import io.spotbot.trade.model.Trade;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

import static io.spotbot.helpers.MathHelper.MC;

/**
 * Decides whether an open trade should be sold at a given rate.
 * <p>
 * Order of checks: stop loss (initialised from the open rate on first use), trailing ratchet,
 * minimal ROI table, then the strategy sell signal. A hit stop loss always wins.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SellDecision {
    // round trip fee exposure (buy + sell) with a little margin
    private static final BigDecimal ROI_FEE_FACTOR = new BigDecimal("2.1");

    private final StrategyResolver strategyResolver;
    private final BotProperties properties;
    private final ExchangeService exchangeService;

    public SellType shouldSell(Trade trade, BigDecimal rate, LocalDateTime now, boolean buy, boolean sell) {
        BigDecimal currentProfit = trade.calcProfitPercent(rate);

        SellType stopLoss = stopLossReached(trade, rate, currentProfit);
        if (stopLoss.isSell()) {
            return stopLoss;
        }

        if (minRoiReached(trade, currentProfit, now)) {
            log.debug("📈 Required profit reached for {} (profit={})", trade.getPair(), currentProfit);
            return SellType.ROI;
        }

        BotProperties.Experimental experimental = properties.getExperimental();
        if (experimental.isSellProfitOnly() && currentProfit.signum() <= 0) {
            log.debug("{} not in profit ({}), ignoring sell signal", trade.getPair(), currentProfit);
            return SellType.NONE;
        }

        if (sell && !buy && experimental.isUseSellSignal()) {
            log.debug("🔻 Sell signal received for {}", trade.getPair());
            return SellType.SELL_SIGNAL;
        }
        return SellType.NONE;
    }

    /**
     * Initialises the stop loss, tests it against {@code rate} and, when trailing is enabled, ratchets it
     * up relative to the current rate.
     */
    public SellType stopLossReached(Trade trade, BigDecimal rate, BigDecimal currentProfit) {
        BigDecimal stoploss = strategyResolver.getStoploss();
        if (trade.getStopLoss() == null) {
            trade.adjustStopLoss(trade.getOpenRate(), stoploss);
        }

        if (trade.getStopLoss().compareTo(rate) >= 0) {
            boolean trailed = trade.getInitialStopLoss() != null
                    && trade.getStopLoss().compareTo(trade.getInitialStopLoss()) > 0;
            log.info("🛑 {} stop loss hit for {}: stop={} rate={} initial={}",
                    trailed ? "Trailing" : "Initial", trade.getPair(), trade.getStopLoss(), rate, trade.getInitialStopLoss());
            return trailed ? SellType.TRAILING_STOP_LOSS : SellType.STOP_LOSS;
        }

        BotProperties.TrailingStop trailing = properties.getTrailingStop();
        if (trailing.isEnabled()) {
            BigDecimal value = stoploss;
            if (trailing.getPositive() != null && currentProfit.signum() > 0) {
                value = trailing.getPositive();
            }
            BigDecimal before = trade.getStopLoss();
            trade.adjustStopLoss(rate, value);
            if (trade.getStopLoss().compareTo(before) != 0) {
                log.debug("Trailing stop for {} moved {} -> {}", trade.getPair(), before, trade.getStopLoss());
            }
        }
        return SellType.NONE;
    }

    /**
     * Walks the ROI table in its defined order. The first entry whose window has not elapsed yet
     * short-circuits with {@code false}.
     */
    public boolean minRoiReached(Trade trade, BigDecimal currentProfit, LocalDateTime now) {
        double minutesOpen = minutesOpen(trade, now);
        for (Map.Entry<Integer, BigDecimal> entry : strategyResolver.getMinimalRoi().entrySet()) {
            if (minutesOpen <= entry.getKey()) {
                return false;
            }
            if (currentProfit.compareTo(entry.getValue()) > 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Limit price that locks in the first passed ROI step after fees, or {@code fallback} if no step has passed.
     */
    public BigDecimal getRoiRate(Trade trade, BigDecimal fallback, LocalDateTime now) {
        double minutesOpen = minutesOpen(trade, now);
        BigDecimal fee = exchangeService.getFee(trade.getPair(), ExchangeService.FeeType.TAKER);
        for (Map.Entry<Integer, BigDecimal> entry : strategyResolver.getMinimalRoi().entrySet()) {
            if (minutesOpen > entry.getKey()) {
                BigDecimal roiRate = trade.getOpenRate()
                        .multiply(BigDecimal.ONE.add(entry.getValue()), MC)
                        .multiply(BigDecimal.ONE.add(ROI_FEE_FACTOR.multiply(fee, MC)), MC);
                roiRate = MathHelper.trunc(roiRate, MathHelper.PRICE_SCALE);
                log.info("Trying to sell {} at ROI rate {}", trade.getPair(), roiRate);
                return roiRate;
            }
        }
        return fallback;
    }

    private static double minutesOpen(Trade trade, LocalDateTime now) {
        return Duration.between(trade.getOpenDate(), now).toMillis() / 60_000.0;
    }
}
