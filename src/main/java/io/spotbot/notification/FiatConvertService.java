package io.spotbot.notification;

import java.math.BigDecimal;

public interface FiatConvertService {
    /**
     * Converts {@code amount} of {@code cryptoSymbol} into {@code fiatSymbol}. Returns zero when no rate is known.
     */
    BigDecimal convertAmount(BigDecimal amount, String cryptoSymbol, String fiatSymbol);

    BigDecimal getPrice(String cryptoSymbol, String fiatSymbol);
}
