package io.spotbot.trading.updates;

import io.spotbot.exchange.model.ExchangeOrder;
import io.spotbot.trade.model.Trade;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public interface OrderUpdatesService {
    /**
     * Amount actually received for {@code order}, i.e. without a fee charged in the base currency.
     *
     * @throws io.spotbot.exceptions.OperationalException if the order fills do not add up to the order amount
     */
    BigDecimal getRealAmount(Trade trade, ExchangeOrder order);

    /**
     * Cancels buy / sell orders that stayed open longer than the configured timeouts.
     */
    void checkHandleTimedout(LocalDateTime now);

    /**
     * @return true if nothing was filled and the trade was removed
     */
    boolean handleTimedoutLimitBuy(Trade trade, ExchangeOrder order);

    /**
     * @return true if nothing was sold and the trade is open again with its full amount
     */
    boolean handleTimedoutLimitSell(Trade trade, ExchangeOrder order);

    /**
     * Books an order the exchange canceled (expired, rejected, canceled by hand) like a timeout:
     * an unfilled buy removes the trade, a partial one shrinks it, a sell reopens the trade.
     *
     * @return true if the trade was removed
     */
    boolean handleCanceledOrder(Trade trade, ExchangeOrder order);

    /**
     * Dry-run orders only live in memory. Trades still pointing at one after a restart are settled
     * as filled at their requested rate.
     */
    void settleDryRunOrders(LocalDateTime now);
}
