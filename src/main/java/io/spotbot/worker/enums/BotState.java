package io.spotbot.worker.enums;

public enum BotState {
    RUNNING,
    STOPPED;

    public static BotState fromString(String value) {
        if (value == null || value.isBlank()) {
            return STOPPED;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
