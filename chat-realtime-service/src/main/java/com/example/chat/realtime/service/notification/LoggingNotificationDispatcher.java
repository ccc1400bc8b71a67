package com.example.chat.realtime.service.notification;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public Mono<Void> notifyUser(String userId, Map<String, Object> payload) {
        return Mono.fromRunnable(() -> log.info("Push notification for offline user {}: {}", userId, payload.get("type")));
    }
}
