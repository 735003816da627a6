package io.spotbot.klines.enums;

import lombok.Getter;

@Getter
public enum IntervalE {
    ONE_MINUTE("1m", 1),
    FIVE_MINUTES("5m", 5),
    FIFTEEN_MINUTES("15m", 15),
    THIRTY_MINUTES("30m", 30),
    ONE_HOUR("1h", 60),
    TWO_HOURS("2h", 120),
    FOUR_HOURS("4h", 240),
    SIX_HOURS("6h", 360),
    TWELVE_HOURS("12h", 720),
    ONE_DAY("1d", 1440);

    private final String value;
    private final int minutes;

    IntervalE(String value, int minutes) {
        this.value = value;
        this.minutes = minutes;
    }

    public long getMillis() {
        return minutes * 60_000L;
    }

    public static IntervalE fromString(String value) {
        for (IntervalE interval : values()) {
            if (interval.value.equals(value)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Invalid interval: " + value);
    }
}
