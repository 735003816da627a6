package io.spotbot.trading.whitelist;

import java.util.List;

public interface WhitelistService {
    /**
     * Pairs quoted in {@code quoteCurrency}, highest 24h quote volume first. Cached for 30 minutes.
     */
    List<String> genPairWhitelist(String quoteCurrency);

    /**
     * Drops pairs that are unknown to the exchange, inactive or blacklisted. Order is preserved.
     */
    List<String> refreshWhitelist(List<String> whitelist);

    /**
     * Rebuilds the whitelist used by the buy path (dynamic top-N or the configured list).
     */
    List<String> updateActiveWhitelist();

    List<String> getActiveWhitelist();
}
