package io.spotbot.trading.whitelist;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volume ranked pair lists per quote currency, valid for {@link #TTL}.
 */
@Component
@RequiredArgsConstructor
public class WhitelistCache {
    public static final Duration TTL = Duration.ofMinutes(30);

    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public Optional<List<String>> get(String quoteCurrency) {
        Entry entry = entries.get(quoteCurrency);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.storedAt().plus(TTL))) {
            entries.remove(quoteCurrency);
            return Optional.empty();
        }
        return Optional.of(entry.pairs());
    }

    public void put(String quoteCurrency, List<String> pairs) {
        entries.put(quoteCurrency, new Entry(List.copyOf(pairs), clock.instant()));
    }

    public void clear() {
        entries.clear();
    }

    private record Entry(List<String> pairs, Instant storedAt) {
    }
}
