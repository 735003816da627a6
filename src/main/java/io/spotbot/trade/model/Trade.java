package io.spotbot.trade.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.spotbot.exchange.enums.OrderSide;
import io.spotbot.exchange.enums.OrderStatus;
import io.spotbot.exchange.model.ExchangeOrder;
import io.spotbot.trade.enums.SellType;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

import static io.spotbot.helpers.MathHelper.MC;
import static io.spotbot.helpers.MathHelper.PRICE_SCALE;

@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@Document(collection = "trades")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Trade {
    @Id
    private String id;
    private int botId;
    private String exchange;
    private String pair;

    // economics
    private BigDecimal stakeAmount;
    private BigDecimal amount;
    private BigDecimal openRate;
    private BigDecimal openRateRequested;
    private BigDecimal closeRate;
    private BigDecimal closeRateRequested;
    private BigDecimal closeProfit;
    private BigDecimal feeOpen;
    private BigDecimal feeClose;

    // risk
    private BigDecimal stopLoss;
    private BigDecimal initialStopLoss;

    private String openOrderId;
    @Builder.Default
    private boolean open = true;
    private SellType sellReason;

    private LocalDateTime openDate;
    private LocalDateTime closeDate;
    @LastModifiedDate
    private LocalDateTime lastModified;

    /**
     * Applies a filled order: a closed buy fixes the entry, a closed sell closes the trade.
     * Open or canceled orders and orders without a price are ignored.
     */
    public void update(ExchangeOrder order, LocalDateTime now) {
        if (order.getStatus() != OrderStatus.CLOSED || order.getPrice() == null) {
            return;
        }
        if (order.getSide() == OrderSide.BUY) {
            openRate = order.getPrice();
            amount = order.getAmount();
            openOrderId = null;
        } else if (order.getSide() == OrderSide.SELL) {
            close(order.getPrice(), now);
        }
    }

    public void close(BigDecimal rate, LocalDateTime now) {
        closeRate = rate;
        closeProfit = calcProfitPercent(rate);
        closeDate = now;
        open = false;
        openOrderId = null;
    }

    /**
     * Reverts a sell that did not happen, the trade is open again.
     */
    public void reopen() {
        closeRate = null;
        closeProfit = null;
        closeDate = null;
        closeRateRequested = null;
        sellReason = null;
        open = true;
        openOrderId = null;
    }

    /**
     * Moves the stop loss to {@code currentPrice * (1 - |stoploss|)}. The first call also fixes the
     * initial stop loss, afterwards the stop loss can only go up.
     */
    public void adjustStopLoss(BigDecimal currentPrice, BigDecimal stoploss) {
        BigDecimal newLoss = currentPrice.multiply(BigDecimal.ONE.subtract(stoploss.abs()), MC);

        if (stopLoss == null) {
            initialStopLoss = newLoss;
            stopLoss = newLoss;
            return;
        }
        if (newLoss.compareTo(stopLoss) > 0) {
            stopLoss = newLoss;
        }
    }

    // amount * open rate + opening fee
    public BigDecimal calcOpenTradePrice() {
        BigDecimal buyTrade = amount.multiply(openRate, MC);
        return buyTrade.add(buyTrade.multiply(nvlFee(feeOpen), MC), MC);
    }

    // amount * rate - closing fee
    public BigDecimal calcCloseTradePrice(BigDecimal rate) {
        BigDecimal sellTrade = amount.multiply(rate, MC);
        return sellTrade.subtract(sellTrade.multiply(nvlFee(feeClose), MC), MC);
    }

    public BigDecimal calcProfit(BigDecimal rate) {
        return calcCloseTradePrice(rate).subtract(calcOpenTradePrice(), MC)
                .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal calcProfit() {
        return closeRate == null ? BigDecimal.ZERO : calcProfit(closeRate);
    }

    public BigDecimal calcProfitPercent(BigDecimal rate) {
        return calcCloseTradePrice(rate).divide(calcOpenTradePrice(), MC)
                .subtract(BigDecimal.ONE)
                .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal nvlFee(BigDecimal fee) {
        return fee == null ? BigDecimal.ZERO : fee;
    }
}
