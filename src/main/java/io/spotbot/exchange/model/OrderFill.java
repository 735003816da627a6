package io.spotbot.exchange.model;

import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single execution belonging to an order.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class OrderFill {
    private String orderId;
    private String pair;
    private BigDecimal price;
    private BigDecimal amount;
    private OrderFee fee;
    private LocalDateTime time;
}
