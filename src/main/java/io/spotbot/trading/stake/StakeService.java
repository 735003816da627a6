package io.spotbot.trading.stake;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.helpers.MathHelper;
import io.spotbot.trade.model.Trade;
import io.spotbot.trade.service.TradeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static io.spotbot.helpers.MathHelper.MC;

@Slf4j
@Component
@RequiredArgsConstructor
public class StakeService {
    private final TradeService tradeService;
    private final BotProperties properties;

    /**
     * Stake for the next trade. In high risk mode it grows with the realised profit of closed trades.
     */
    public BigDecimal getStakeAmount() {
        BigDecimal stake = properties.getStakeAmount();
        if (properties.isHighRiskTrading()) {
            return getHighStakeAmount(stake);
        }
        return stake;
    }

    /**
     * initial balance = stake * max_open_trades, profit % = (initial + closed profit) / initial - 1,
     * minus the open fee twice. Only applies while there are free trade slots.
     */
    public BigDecimal getHighStakeAmount(BigDecimal stakeAmount) {
        long tradesLeft = properties.getMaxOpenTrades() - tradeService.countOpenTrades();
        if (tradesLeft <= 0) {
            return stakeAmount;
        }

        BigDecimal initialBalance = stakeAmount.multiply(BigDecimal.valueOf(properties.getMaxOpenTrades()), MC);
        ProfitsFees profitsFees = getTradeProfitsFees();
        log.debug("initial balance {}, total profits {}, total fees {}",
                initialBalance, profitsFees.profit(), profitsFees.meanFee());

        if (profitsFees.profit().signum() <= 0) {
            return stakeAmount;
        }
        BigDecimal profitPercent = initialBalance.add(profitsFees.profit(), MC)
                .divide(initialBalance, MC)
                .subtract(BigDecimal.ONE)
                .subtract(profitsFees.meanFee().multiply(BigDecimal.valueOf(2), MC));
        BigDecimal stakeNet = stakeAmount.multiply(BigDecimal.ONE.add(MathHelper.trunc(profitPercent, 2)), MC);
        BigDecimal newStake = MathHelper.trunc(stakeNet, MathHelper.PRICE_SCALE);
        log.info("High risk stake amount: {} (total profit {}%)", newStake,
                profitPercent.multiply(BigDecimal.valueOf(100)).setScale(2, RoundingMode.HALF_UP));
        return newStake;
    }

    /**
     * Sum of realised profit over closed trades and the mean opening fee over all of them.
     */
    public ProfitsFees getTradeProfitsFees() {
        List<Trade> closed = tradeService.getClosedTrades();
        BigDecimal profit = BigDecimal.ZERO;
        BigDecimal fees = BigDecimal.ZERO;
        for (Trade trade : closed) {
            profit = profit.add(trade.calcProfit());
            fees = fees.add(MathHelper.nvl(trade.getFeeOpen()));
        }
        BigDecimal meanFee = closed.isEmpty() ? BigDecimal.ZERO : fees.divide(BigDecimal.valueOf(closed.size()), MC);
        return new ProfitsFees(profit, meanFee, closed.size());
    }

    public record ProfitsFees(BigDecimal profit, BigDecimal meanFee, int tradeCount) {
    }
}
