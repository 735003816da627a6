package io.spotbot.exchange.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import io.spotbot.exchange.enums.OrderSide;
import io.spotbot.exchange.enums.OrderStatus;
import io.spotbot.exchange.model.*;
import io.spotbot.helpers.SymbolHelper;
import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

@UtilityClass
public class ExchangeMapper {

    public static ExchangeOrder orderFromRest(JsonNode node, String pair) {
        if (node == null || node.isMissingNode()) return null;

        BigDecimal amount = parseBigDecimal(node, "origQty");
        BigDecimal filled = parseBigDecimal(node, "executedQty");
        if (filled == null) filled = BigDecimal.ZERO;
        BigDecimal remaining = amount != null ? amount.subtract(filled) : null;

        // avgPrice is 0 until something is executed
        BigDecimal price = parseBigDecimal(node, "avgPrice");
        if (price == null || price.signum() == 0) {
            price = parseBigDecimal(node, "price");
        }

        long time = node.path("time").asLong(0);
        if (time == 0) {
            time = node.path("updateTime").asLong(0);
        }

        return ExchangeOrder.builder()
                .id(node.path("orderId").asText(null))
                .pair(pair)
                .side(OrderSide.fromString(node.path("side").asText(null)))
                .status(OrderStatus.fromBinance(node.path("status").asText(null)))
                .type(node.path("type").asText(null))
                .price(price)
                .amount(amount)
                .filled(filled)
                .remaining(remaining)
                .datetime(time > 0 ? toDateTime(time) : null)
                .build();
    }

    public static List<OrderFill> fillsFromRest(JsonNode array, String pair) {
        List<OrderFill> fills = new ArrayList<>();
        if (array == null || !array.isArray()) return fills;

        for (JsonNode node : array) {
            OrderFee fee = null;
            if (node.hasNonNull("commission") && node.hasNonNull("commissionAsset")) {
                fee = OrderFee.builder()
                        .currency(node.get("commissionAsset").asText())
                        .cost(parseBigDecimal(node, "commission"))
                        .build();
            }
            fills.add(OrderFill.builder()
                    .orderId(node.path("orderId").asText(null))
                    .pair(pair)
                    .price(parseBigDecimal(node, "price"))
                    .amount(parseBigDecimal(node, "qty"))
                    .fee(fee)
                    .time(toDateTime(node.path("time").asLong(0)))
                    .build());
        }
        return fills;
    }

    public static OrderBook orderBookFromRest(JsonNode node) {
        return OrderBook.builder()
                .bids(parseLevelArray(node.get("bids")))
                .asks(parseLevelArray(node.get("asks")))
                .build();
    }

    public static Ticker tickerFromRest(JsonNode ticker24h, JsonNode bookTicker, String pair) {
        return Ticker.builder()
                .pair(pair)
                .ask(bookTicker != null ? parseBigDecimal(bookTicker, "askPrice") : null)
                .bid(bookTicker != null ? parseBigDecimal(bookTicker, "bidPrice") : null)
                .last(parseBigDecimal(ticker24h, "lastPrice"))
                .high(parseBigDecimal(ticker24h, "highPrice"))
                .low(parseBigDecimal(ticker24h, "lowPrice"))
                .quoteVolume(parseBigDecimal(ticker24h, "quoteVolume"))
                .build();
    }

    public static List<MarketInfo> marketsFromExchangeInfo(JsonNode root) {
        List<MarketInfo> markets = new ArrayList<>();
        JsonNode symbols = root.path("symbols");
        for (JsonNode node : symbols) {
            String base = node.path("baseAsset").asText();
            String quote = node.path("quoteAsset").asText();

            BigDecimal tickSize = null;
            BigDecimal stepSize = null;
            for (JsonNode filter : node.path("filters")) {
                switch (filter.path("filterType").asText()) {
                    case "PRICE_FILTER" -> tickSize = parseBigDecimal(filter, "tickSize");
                    case "LOT_SIZE" -> stepSize = parseBigDecimal(filter, "stepSize");
                    default -> { }
                }
            }

            markets.add(MarketInfo.builder()
                    .pair(SymbolHelper.toPair(base, quote))
                    .symbol(node.path("symbol").asText())
                    .base(base)
                    .quote(quote)
                    .active("TRADING".equals(node.path("status").asText()))
                    .tickSize(tickSize)
                    .stepSize(stepSize)
                    .build());
        }
        return markets;
    }

    public static BigDecimal balanceFromAccount(JsonNode root, String currency) {
        for (JsonNode asset : root.path("assets")) {
            if (currency.equalsIgnoreCase(asset.path("asset").asText())) {
                BigDecimal available = parseBigDecimal(asset, "availableBalance");
                return available != null ? available : BigDecimal.ZERO;
            }
        }
        return BigDecimal.ZERO;
    }

    private static List<List<BigDecimal>> parseLevelArray(JsonNode arrayNode) {
        List<List<BigDecimal>> levels = new ArrayList<>();
        if (arrayNode == null || !arrayNode.isArray()) return levels;
        for (JsonNode level : arrayNode) {
            if (level.isArray() && level.size() >= 2) {
                List<BigDecimal> entry = new ArrayList<>(2);
                entry.add(new BigDecimal(level.get(0).asText()));
                entry.add(new BigDecimal(level.get(1).asText()));
                levels.add(entry);
            }
        }
        return levels;
    }

    private static LocalDateTime toDateTime(long epochMillis) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), ZoneOffset.UTC);
    }

    private static BigDecimal parseBigDecimal(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) return null;
        String text = node.get(field).asText();
        if (text == null || text.isBlank()) return null;
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
