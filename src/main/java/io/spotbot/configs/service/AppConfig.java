package io.spotbot.configs.service;

import com.binance.connector.futures.client.impl.UMFuturesClientImpl;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Slf4j
@Getter
@Configuration
public class AppConfig {

    @Value("${binance.url}")
    private String binanceUrl;

    @Value("${api.key:}")
    private String apiKey;

    @Value("${secret.key:}")
    private String secretKey;

    @Bean
    public UMFuturesClientImpl umFuturesClient() {
        log.info("BINANCE_URL {}", binanceUrl);
        if (apiKey.isBlank() || secretKey.isBlank()) {
            log.warn("⚠️ API keys are not configured, only public endpoints will work");
        }
        return new UMFuturesClientImpl(apiKey, secretKey, binanceUrl);
    }

    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }
}
