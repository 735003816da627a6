package io.spotbot.notification;

/**
 * Fire-and-forget delivery of bot messages. Implementations must never throw.
 */
public interface NotificationService {
    void send(String message);
}
