package io.spotbot.exchange.model;

import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class OrderFee {
    private String currency;
    private BigDecimal cost;
}
