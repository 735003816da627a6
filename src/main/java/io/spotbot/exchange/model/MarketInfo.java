package io.spotbot.exchange.model;

import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class MarketInfo {
    private String pair;            // BTC/USDT
    private String symbol;          // BTCUSDT
    private String base;
    private String quote;
    private boolean active;
    private BigDecimal tickSize;
    private BigDecimal stepSize;
}
