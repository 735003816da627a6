package io.spotbot.trading.price;

import io.spotbot.configs.properties.BotProperties;
import io.spotbot.exceptions.DependencyException;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.exchange.model.OrderBook;
import io.spotbot.exchange.model.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PriceTargetService Tests")
class PriceTargetServiceTest {
    private static final String PAIR = "ETH/USDT";

    @Mock
    private ExchangeService exchangeService;

    private BotProperties properties;
    private PriceTargetService priceTargetService;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        priceTargetService = new PriceTargetService(exchangeService, properties);
    }

    private void givenTicker(String ask, String last) {
        when(exchangeService.getTicker(PAIR)).thenReturn(Ticker.builder()
                .pair(PAIR)
                .ask(new BigDecimal(ask))
                .bid(new BigDecimal(ask).subtract(BigDecimal.ONE))
                .last(new BigDecimal(last))
                .build());
    }

    @Test
    @DisplayName("Uses ask when it is below last price")
    void testAskBelowLast() {
        givenTicker("20", "21");

        assertEquals(new BigDecimal("20"), priceTargetService.getTargetBid(PAIR));
        verify(exchangeService, never()).getOrderBook(anyString(), anyInt());
    }

    @Test
    @DisplayName("Blends ask and last by the configured balance")
    void testAskLastBalance() {
        givenTicker("20", "5");

        assertEquals(0, new BigDecimal("20").compareTo(priceTargetService.getTargetBid(PAIR)));

        properties.getBidStrategy().setAskLastBalance(BigDecimal.ONE);
        assertEquals(0, new BigDecimal("5").compareTo(priceTargetService.getTargetBid(PAIR)));

        properties.getBidStrategy().setAskLastBalance(new BigDecimal("0.5"));
        assertEquals(0, new BigDecimal("12.5").compareTo(priceTargetService.getTargetBid(PAIR)));
    }

    @Test
    @DisplayName("Order book bid plus one satoshi when below the ticker rate")
    void testOrderBookRate() {
        properties.getBidStrategy().setUseBookOrder(true);
        properties.getBidStrategy().setBookOrderTop(2);
        givenTicker("20", "21");
        when(exchangeService.getOrderBook(PAIR, 2)).thenReturn(OrderBook.builder()
                .bids(List.of(List.of(new BigDecimal("19.9"), BigDecimal.ONE), List.of(new BigDecimal("19.5"), BigDecimal.ONE)))
                .build());

        assertEquals(new BigDecimal("19.50000001"), priceTargetService.getTargetBid(PAIR));
    }

    @Test
    @DisplayName("Ticker rate wins when it is lower than the order book rate")
    void testOrderBookTickerLower() {
        properties.getBidStrategy().setUseBookOrder(true);
        givenTicker("19", "21");
        when(exchangeService.getOrderBook(PAIR, 1)).thenReturn(OrderBook.builder()
                .bids(List.of(List.of(new BigDecimal("19.9"), BigDecimal.ONE)))
                .build());

        assertEquals(new BigDecimal("19"), priceTargetService.getTargetBid(PAIR));
    }

    @Test
    @DisplayName("Percent from top lowers the rate, truncated to 8 decimals")
    void testPercentFromTop() {
        properties.getBidStrategy().setPercentFromTop(new BigDecimal("0.003"));
        givenTicker("0.12345678", "0.2");

        // 0.12345678 * 0.997 = 0.12308640966
        assertEquals(new BigDecimal("0.12308640"), priceTargetService.getTargetBid(PAIR));
    }

    @Test
    @DisplayName("Order book shorter than the configured top is a dependency failure")
    void testOrderBookTooThin() {
        properties.getBidStrategy().setUseBookOrder(true);
        properties.getBidStrategy().setBookOrderTop(3);
        givenTicker("20", "21");
        when(exchangeService.getOrderBook(PAIR, 3)).thenReturn(OrderBook.builder()
                .bids(List.of(List.of(new BigDecimal("19.9"), BigDecimal.ONE)))
                .build());

        DependencyException ex = assertThrows(DependencyException.class, () -> priceTargetService.getTargetBid(PAIR));
        assertEquals("Order book has 1 levels, requested 3", ex.getMessage());
    }
}
