package com.example.chat.realtime.service.notification;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Out-of-band (push) delivery for users who are not connected.
 */
public interface NotificationDispatcher {

    Mono<Void> notifyUser(String userId, Map<String, Object> payload);
}
