package io.spotbot.trade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfitDto {
    private String stakeCurrency;
    private BigDecimal closedProfit;
    private BigDecimal closedProfitFiat;
    private String fiatCurrency;
    private BigDecimal meanOpenFee;
    private int closedTrades;
}
