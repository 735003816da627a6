package io.spotbot.exchange.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.spotbot.exchange.enums.OrderSide;
import io.spotbot.exchange.enums.OrderStatus;
import io.spotbot.exchange.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExchangeMapper Tests")
class ExchangeMapperTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    @DisplayName("Partially filled order maps to an open order with remaining amount")
    void testOrderFromRest() throws Exception {
        JsonNode node = json("""
                {"orderId": 8886774, "symbol": "ETHUSDT", "status": "PARTIALLY_FILLED", "side": "BUY",
                 "type": "LIMIT", "price": "2000.00", "avgPrice": "1999.50", "origQty": "1.000",
                 "executedQty": "0.400", "time": 1704110400000}
                """);

        ExchangeOrder order = ExchangeMapper.orderFromRest(node, "ETH/USDT");

        assertEquals("8886774", order.getId());
        assertEquals(OrderSide.BUY, order.getSide());
        assertEquals(OrderStatus.OPEN, order.getStatus());
        assertTrue(order.isOpen());
        assertEquals(new BigDecimal("1999.50"), order.getPrice());
        assertEquals(new BigDecimal("0.600"), order.getRemaining());
        assertEquals(LocalDateTime.of(2024, 1, 1, 12, 0), order.getDatetime());
    }

    @Test
    @DisplayName("Limit price is used until something is executed")
    void testOrderWithoutExecution() throws Exception {
        JsonNode node = json("""
                {"orderId": 1, "status": "NEW", "side": "SELL", "type": "LIMIT", "price": "2100.00",
                 "avgPrice": "0.00", "origQty": "1.000", "executedQty": "0", "updateTime": 1704110400000}
                """);

        ExchangeOrder order = ExchangeMapper.orderFromRest(node, "ETH/USDT");

        assertEquals(new BigDecimal("2100.00"), order.getPrice());
        assertEquals(0, order.getFilled().signum());
        assertEquals(OrderSide.SELL, order.getSide());
    }

    @Test
    @DisplayName("Account trades carry their commission as fee")
    void testFillsFromRest() throws Exception {
        JsonNode array = json("""
                [{"orderId": 42, "price": "2000", "qty": "0.5", "commission": "0.0005",
                  "commissionAsset": "ETH", "time": 1704110400000},
                 {"orderId": 42, "price": "2001", "qty": "0.5", "time": 1704110401000}]
                """);

        List<OrderFill> fills = ExchangeMapper.fillsFromRest(array, "ETH/USDT");

        assertEquals(2, fills.size());
        assertEquals("42", fills.get(0).getOrderId());
        assertEquals("ETH", fills.get(0).getFee().getCurrency());
        assertEquals(new BigDecimal("0.0005"), fills.get(0).getFee().getCost());
        assertNull(fills.get(1).getFee());
    }

    @Test
    @DisplayName("Exchange info maps to markets with their filters")
    void testMarketsFromExchangeInfo() throws Exception {
        JsonNode root = json("""
                {"symbols": [
                  {"symbol": "ETHUSDT", "status": "TRADING", "baseAsset": "ETH", "quoteAsset": "USDT",
                   "filters": [{"filterType": "PRICE_FILTER", "tickSize": "0.01"},
                               {"filterType": "LOT_SIZE", "stepSize": "0.001"},
                               {"filterType": "MIN_NOTIONAL", "notional": "5"}]},
                  {"symbol": "LUNAUSDT", "status": "SETTLING", "baseAsset": "LUNA", "quoteAsset": "USDT",
                   "filters": []}
                ]}
                """);

        List<MarketInfo> markets = ExchangeMapper.marketsFromExchangeInfo(root);

        assertEquals(2, markets.size());
        MarketInfo eth = markets.get(0);
        assertEquals("ETH/USDT", eth.getPair());
        assertTrue(eth.isActive());
        assertEquals(new BigDecimal("0.01"), eth.getTickSize());
        assertEquals(new BigDecimal("0.001"), eth.getStepSize());
        assertFalse(markets.get(1).isActive());
    }

    @Test
    @DisplayName("Order book and ticker are parsed from REST payloads")
    void testOrderBookAndTicker() throws Exception {
        OrderBook book = ExchangeMapper.orderBookFromRest(json("""
                {"bids": [["1999.9", "3"], ["1999.8", "2"]], "asks": [["2000.1", "1"]]}
                """));
        Ticker ticker = ExchangeMapper.tickerFromRest(
                json("""
                        {"lastPrice": "2000.0", "highPrice": "2100", "lowPrice": "1900", "quoteVolume": "123456.7"}
                        """),
                json("""
                        {"bidPrice": "1999.9", "askPrice": "2000.1"}
                        """),
                "ETH/USDT");

        assertEquals(new BigDecimal("1999.8"), book.bidPrice(2));
        assertEquals(new BigDecimal("5"), book.totalBidVolume());
        assertEquals(new BigDecimal("2000.1"), book.askPrice(1));
        assertEquals(new BigDecimal("1999.9"), ticker.getBid());
        assertEquals(new BigDecimal("123456.7"), ticker.getQuoteVolume());
    }

    @Test
    @DisplayName("Balance of an unknown asset is zero")
    void testBalanceFromAccount() throws Exception {
        JsonNode account = json("""
                {"assets": [{"asset": "USDT", "availableBalance": "150.5"}]}
                """);

        assertEquals(new BigDecimal("150.5"), ExchangeMapper.balanceFromAccount(account, "usdt"));
        assertEquals(BigDecimal.ZERO, ExchangeMapper.balanceFromAccount(account, "BNB"));
    }
}
