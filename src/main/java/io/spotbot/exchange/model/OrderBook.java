package io.spotbot.exchange.model;

import io.spotbot.exceptions.DependencyException;
import lombok.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of an order book, both sides sorted best-first as [price, size].
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class OrderBook {
    @Builder.Default
    private List<List<BigDecimal>> bids = new ArrayList<>();
    @Builder.Default
    private List<List<BigDecimal>> asks = new ArrayList<>();

    // 1-based level, as configured by the user
    public BigDecimal bidPrice(int level) {
        return priceAt(bids, level);
    }

    public BigDecimal askPrice(int level) {
        return priceAt(asks, level);
    }

    public BigDecimal totalBidVolume() {
        return sumSizes(bids);
    }

    public BigDecimal totalAskVolume() {
        return sumSizes(asks);
    }

    private static BigDecimal priceAt(List<List<BigDecimal>> side, int level) {
        if (level < 1 || level > side.size()) {
            throw new DependencyException("Order book has " + side.size() + " levels, requested " + level);
        }
        return side.get(level - 1).get(0);
    }

    private static BigDecimal sumSizes(List<List<BigDecimal>> side) {
        return side.stream()
                .map(level -> level.get(1))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
