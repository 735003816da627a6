package io.spotbot.helpers;

import lombok.experimental.UtilityClass;

@UtilityClass
public class SymbolHelper {

    // BTC/USDT -> BTCUSDT
    public static String toSymbol(String pair) {
        return pair.replace("/", "").replace("_", "").toUpperCase();
    }

    public static String toPair(String base, String quote) {
        return base.toUpperCase() + "/" + quote.toUpperCase();
    }

    public static String baseOf(String pair) {
        String[] parts = split(pair);
        return parts.length == 2 ? parts[0] : pair;
    }

    public static String quoteOf(String pair) {
        String[] parts = split(pair);
        return parts.length == 2 ? parts[1] : null;
    }

    // exactly one separator, e.g. BTC/USDT
    public static boolean isPair(String value) {
        return value != null && split(value).length == 2;
    }

    private static String[] split(String pair) {
        return pair.replace("_", "/").split("/");
    }
}
