package io.spotbot.notification;

import com.github.benmanes.caffeine.cache.Caffeine;
import io.spotbot.configs.service.CacheConfig;
import io.spotbot.exceptions.TemporaryException;
import io.spotbot.exchange.ExchangeService;
import io.spotbot.exchange.model.Ticker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FiatConvertServiceImpl Tests")
class FiatConvertServiceImplTest {
    @Mock
    private ExchangeService exchangeService;

    private FiatConvertServiceImpl fiatConvertService;

    @BeforeEach
    void setUp() {
        CacheConfig cacheConfig = new CacheConfig();
        fiatConvertService = new FiatConvertServiceImpl(exchangeService,
                cacheConfig.cacheManager(Caffeine.newBuilder()));
    }

    @Test
    @DisplayName("Amount is converted with the last price and the rate is cached")
    void testConvertAmount() {
        when(exchangeService.getTicker("USDT/USD")).thenReturn(Ticker.builder().last(new BigDecimal("0.99")).build());

        assertEquals(new BigDecimal("9.7911"), fiatConvertService.convertAmount(new BigDecimal("9.89"), "USDT", "USD"));
        assertEquals(new BigDecimal("0.99"), fiatConvertService.getPrice("USDT", "USD"));
        verify(exchangeService, times(1)).getTicker("USDT/USD");
    }

    @Test
    @DisplayName("Same currency converts one to one")
    void testSameCurrency() {
        assertEquals(new BigDecimal("5"), fiatConvertService.convertAmount(new BigDecimal("5"), "usdt", "USDT"));
        verifyNoInteractions(exchangeService);
    }

    @Test
    @DisplayName("Unavailable rate converts to zero and is retried next time")
    void testUnavailableRate() {
        when(exchangeService.getTicker("USDT/EUR")).thenThrow(new TemporaryException("no such market"));

        assertEquals(BigDecimal.ZERO, fiatConvertService.getPrice("USDT", "EUR"));
        assertEquals(BigDecimal.ZERO, fiatConvertService.getPrice("USDT", "EUR"));
        verify(exchangeService, times(2)).getTicker("USDT/EUR");
    }
}
