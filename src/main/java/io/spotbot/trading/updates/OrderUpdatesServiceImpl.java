package io.spotbot.trading.updates;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.exceptions.DependencyException;
import io.spotbot.exceptions.OperationalException;
import io.spotbot.exceptions.TemporaryException;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.exchange.enums.OrderSide;
import io.spotbot.exchange.model.ExchangeOrder;
import io.spotbot.exchange.model.OrderFee;
import io.spotbot.exchange.model.OrderFill;
import io.spotbot.helpers.SymbolHelper;
import io.spotbot.notification.NotificationService;
import io.spotbot.trade.model.Trade;
import io.spotbot.trade.service.TradeService;
import io.spotbot.utils.logging.TradingLogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static io.spotbot.helpers.MathHelper.MC;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderUpdatesServiceImpl implements OrderUpdatesService {
    private final ExchangeService exchangeService;
    private final TradeService tradeService;
    private final NotificationService notificationService;
    private final TradingLogWriter tradingLogWriter;
    private final BotProperties properties;

    @Override
    public BigDecimal getRealAmount(Trade trade, ExchangeOrder order) {
        BigDecimal orderAmount = order.getAmount();
        if (trade.getFeeOpen() == null || trade.getFeeOpen().signum() == 0 || order.isOpen()) {
            return orderAmount;
        }

        String base = SymbolHelper.baseOf(trade.getPair());
        OrderFee fee = order.getFee();
        if (fee != null && fee.getCurrency() != null && fee.getCost() != null) {
            if (base.equals(fee.getCurrency())) {
                BigDecimal newAmount = orderAmount.subtract(fee.getCost());
                log.info("Applying fee on amount for {} (from {} to {}) from order", trade.getPair(), orderAmount, newAmount);
                return newAmount;
            }
        }

        List<OrderFill> fills = exchangeService.getTradesForOrder(trade.getOpenOrderId(), trade.getPair(), trade.getOpenDate());
        if (fills.isEmpty()) {
            log.info("Applying fee on amount for {} failed: no fills found", trade.getPair());
            return orderAmount;
        }

        BigDecimal amount = BigDecimal.ZERO;
        BigDecimal feeAbs = BigDecimal.ZERO;
        for (OrderFill fill : fills) {
            amount = amount.add(fill.getAmount());
            OrderFee fillFee = fill.getFee();
            // only a fee charged in the base currency changes what we hold
            if (fillFee != null && fillFee.getCost() != null && base.equals(fillFee.getCurrency())) {
                feeAbs = feeAbs.add(fillFee.getCost());
            }
        }

        if (amount.compareTo(orderAmount) != 0) {
            log.warn("Amount {} does not match amount {} for {}", amount, orderAmount, trade.getPair());
            throw new OperationalException("Half bought? Amounts don't match");
        }
        BigDecimal realAmount = amount.subtract(feeAbs);
        if (feeAbs.signum() != 0) {
            log.info("Applying fee on amount for {} (from {} to {}) from fills", trade.getPair(), orderAmount, realAmount);
        }
        return realAmount;
    }

    @Override
    public void checkHandleTimedout(LocalDateTime now) {
        BotProperties.UnfilledTimeout timeout = properties.getUnfilledTimeout();
        LocalDateTime buyThreshold = now.minusMinutes(timeout.getBuy());
        LocalDateTime sellThreshold = now.minusMinutes(timeout.getSell());

        for (Trade trade : tradeService.getTradesWithOpenOrders()) {
            if (trade.getOpenOrderId() == null) {
                continue;
            }
            try {
                ExchangeOrder order = exchangeService.getOrder(trade.getOpenOrderId(), trade.getPair());
                if (!order.isOpen() || order.getDatetime() == null) {
                    continue;
                }
                if (order.getSide() == OrderSide.BUY && order.getDatetime().isBefore(buyThreshold)) {
                    handleTimedoutLimitBuy(trade, order);
                } else if (order.getSide() == OrderSide.SELL && order.getDatetime().isBefore(sellThreshold)) {
                    handleTimedoutLimitSell(trade, order);
                }
            } catch (TemporaryException | DependencyException e) {
                log.info("Cannot handle order {} of {}: {}", trade.getOpenOrderId(), trade.getPair(), e.getMessage());
            }
        }
    }

    @Override
    public boolean handleTimedoutLimitBuy(Trade trade, ExchangeOrder order) {
        exchangeService.cancelOrder(trade.getOpenOrderId(), trade.getPair());
        return releaseBuy(trade, order, "Timeout", "BUY_TIMEOUT");
    }

    @Override
    public boolean handleTimedoutLimitSell(Trade trade, ExchangeOrder order) {
        exchangeService.cancelOrder(trade.getOpenOrderId(), trade.getPair());
        return releaseSell(trade, order, "Timeout", "SELL_TIMEOUT");
    }

    @Override
    public boolean handleCanceledOrder(Trade trade, ExchangeOrder order) {
        log.info("Order {} of {} was canceled on the exchange", order.getId(), trade.getPair());
        if (order.getSide() == OrderSide.BUY) {
            return releaseBuy(trade, order, "Canceled", "BUY_CANCELED");
        }
        releaseSell(trade, order, "Canceled", "SELL_CANCELED");
        return false;
    }

    @Override
    public void settleDryRunOrders(LocalDateTime now) {
        for (Trade trade : tradeService.getTradesWithOpenOrders()) {
            String orderId = trade.getOpenOrderId();
            if (orderId == null || !orderId.startsWith(ExchangeService.DRY_RUN_ORDER_PREFIX)) {
                continue;
            }
            // simulated orders fill immediately at the requested rate
            if (trade.getCloseRateRequested() != null) {
                trade.close(trade.getCloseRateRequested(), now);
            } else {
                trade.setOpenOrderId(null);
            }
            tradeService.save(trade);
            log.info("🧪 Settled dry-run order {} of {} left from a previous run", orderId, trade.getPair());
        }
    }

    private boolean releaseBuy(Trade trade, ExchangeOrder order, String label, String event) {
        BigDecimal filled = order.getAmount().subtract(nvlRemaining(order));
        if (filled.signum() <= 0) {
            tradeService.delete(trade);
            log.info("⏱ {}: buy order for {} unfilled, trade removed", label, trade.getPair());
            tradingLogWriter.write(trade.getPair(), event, "order=" + order.getId() + " unfilled, trade removed");
            notificationService.send("*" + label + ":* Unfilled buy order for " + trade.getPair() + " cancelled");
            return true;
        }

        trade.setAmount(filled);
        trade.setStakeAmount(filled.multiply(trade.getOpenRate(), MC));
        trade.setOpenOrderId(null);
        tradeService.save(trade);
        log.info("⏱ {}: buy order for {} partially filled, keeping {}", label, trade.getPair(), filled);
        tradingLogWriter.write(trade.getPair(), event, "order=" + order.getId() + " partially filled, amount=" + filled);
        notificationService.send("*" + label + ":* Remaining buy order for " + trade.getPair() + " cancelled");
        return false;
    }

    private boolean releaseSell(Trade trade, ExchangeOrder order, String label, String event) {
        BigDecimal sold = order.getAmount().subtract(nvlRemaining(order));
        if (sold.signum() <= 0) {
            trade.reopen();
            tradeService.save(trade);
            log.info("⏱ {}: sell order for {} unfilled, trade open again", label, trade.getPair());
            tradingLogWriter.write(trade.getPair(), event, "order=" + order.getId() + " unfilled");
            notificationService.send("*" + label + ":* Unfilled sell order for " + trade.getPair() + " cancelled");
            return true;
        }

        // partially sold: keep holding what is left, stake shrinks with it
        BigDecimal left = trade.getAmount().subtract(sold);
        trade.setStakeAmount(trade.getStakeAmount().multiply(left, MC).divide(trade.getAmount(), MC));
        trade.setAmount(left);
        trade.reopen();
        tradeService.save(trade);
        log.info("⏱ {}: sell order for {} partially filled, sold {} keeping {}", label, trade.getPair(), sold, left);
        tradingLogWriter.write(trade.getPair(), event, "order=" + order.getId() + " sold=" + sold + " left=" + left);
        notificationService.send("*" + label + ":* Remaining sell order for " + trade.getPair() + " cancelled");
        return false;
    }

    private static BigDecimal nvlRemaining(ExchangeOrder order) {
        return order.getRemaining() == null ? BigDecimal.ZERO : order.getRemaining();
    }
}
