package io.spotbot.klines.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.spotbot.klines.enums.IntervalE;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class KlineModel {
    private long openTime;

    private long closeTime;

    private String pair;

    private IntervalE interval;

    private BigDecimal openPrice;

    private BigDecimal closePrice;

    private BigDecimal highPrice;

    private BigDecimal lowPrice;

    private BigDecimal volume;

    public Instant getOpenTimeInstant() {
        return Instant.ofEpochMilli(openTime);
    }
}
