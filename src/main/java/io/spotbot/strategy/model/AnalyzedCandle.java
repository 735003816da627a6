package io.spotbot.strategy.model;

import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One closed candle plus whatever the strategy computed for it.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class AnalyzedCandle {
    private Instant date;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;

    @Builder.Default
    private Map<String, Double> indicators = new HashMap<>();
    private boolean buy;
    private boolean sell;

    public Double indicator(String name) {
        return indicators.get(name);
    }

    public void putIndicator(String name, Double value) {
        indicators.put(name, value);
    }
}
