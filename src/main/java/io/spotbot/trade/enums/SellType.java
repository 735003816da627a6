package io.spotbot.trade.enums;

public enum SellType {
    NONE,
    STOP_LOSS,
    TRAILING_STOP_LOSS,
    ROI,
    SELL_SIGNAL,
    FORCE_SELL;

    public boolean isSell() {
        return this != NONE;
    }
}
