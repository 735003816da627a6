package io.spotbot.exchange.model;

import io.spotbot.exchange.enums.OrderSide;
import io.spotbot.exchange.enums.OrderStatus;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Read-only view of an exchange order.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class ExchangeOrder {
    private String id;
    private String pair;
    private OrderSide side;
    private OrderStatus status;
    private String type;            // LIMIT, MARKET
    private BigDecimal price;
    private BigDecimal amount;      // requested
    private BigDecimal filled;
    private BigDecimal remaining;
    private OrderFee fee;           // null when the exchange does not embed it
    private LocalDateTime datetime;

    public boolean isOpen() {
        return status == OrderStatus.OPEN;
    }
}
