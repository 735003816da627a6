package io.spotbot.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.spotbot.configs.properties.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Posts {@code {"text": "..."}} to the configured webhook (Slack / Mattermost / Discord compatible).
 * When disabled the message only goes to the log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookNotificationService implements NotificationService {
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;

    @Override
    public void send(String message) {
        BotProperties.Notification config = properties.getNotification();
        if (!config.isEnabled() || config.getWebhookUrl() == null || config.getWebhookUrl().isBlank()) {
            log.info("📣 {}", message);
            return;
        }

        try {
            String body = objectMapper.writeValueAsString(Map.of("text", message));
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(config.getWebhookUrl()))
                    .timeout(Duration.ofSeconds(10))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();

            httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                    .whenComplete((response, error) -> {
                        if (error != null) {
                            log.warn("Notification failed: {}", error.getMessage());
                        } else if (response.statusCode() >= 300) {
                            log.warn("Notification rejected: HTTP {}", response.statusCode());
                        }
                    });
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Could not send notification: {}", e.getMessage());
        }
    }
}
