package io.spotbot.exchange.model;

import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Ticker {
    private String pair;                // BTC/USDT
    private BigDecimal ask;             // best ask
    private BigDecimal bid;             // best bid
    private BigDecimal last;            // last trade price
    private BigDecimal high;            // 24h high
    private BigDecimal low;             // 24h low
    private BigDecimal quoteVolume;     // 24h volume in quote currency
}
