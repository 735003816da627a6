package io.spotbot.exchange.enums;

public enum OrderStatus {
    OPEN,      // NEW, PARTIALLY_FILLED
    CLOSED,    // FILLED
    CANCELED;  // CANCELED, EXPIRED, REJECTED

    public static OrderStatus fromBinance(String status) {
        if (status == null) {
            return null;
        }
        return switch (status.toUpperCase()) {
            case "NEW", "PARTIALLY_FILLED", "OPEN" -> OPEN;
            case "FILLED", "CLOSED" -> CLOSED;
            case "CANCELED", "CANCELLED", "EXPIRED", "REJECTED", "EXPIRED_IN_MATCH" -> CANCELED;
            default -> throw new IllegalArgumentException("Unknown order status: " + status);
        };
    }
}
