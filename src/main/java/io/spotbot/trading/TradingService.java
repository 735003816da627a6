package io.spotbot.trading;

import io.spotbot.trade.enums.SellType;
import io.spotbot.trade.model.Trade;

import java.math.BigDecimal;

public interface TradingService {
    /**
     * Refreshes an outstanding order of the trade and, once nothing is pending, runs the sell path.
     *
     * @return true if the trade was closed or a sell order was placed
     */
    boolean processMaybeExecuteSell(Trade trade);

    /**
     * Sell path for an open trade without pending order.
     *
     * @throws IllegalStateException if the trade is already closed
     */
    boolean handleTrade(Trade trade);

    boolean checkSell(Trade trade, BigDecimal sellRate, boolean buy, boolean sell);

    void executeSell(Trade trade, BigDecimal limit, SellType sellType);

    /**
     * @return true if a new trade was opened
     */
    boolean processMaybeExecuteBuy();

    boolean createTrade();

    /**
     * Sells at the current bid regardless of the sell rules.
     */
    Trade forceSell(String tradeId);
}
