package com.example.chat.realtime.service;

import com.example.chat.realtime.service.call.CallSignalingService;
import com.example.chat.realtime.service.dispatch.EventDispatcher;
import com.example.chat.realtime.service.dispatch.OutboundEvent;
import com.example.chat.realtime.service.dispatch.OutboundEventType;
import com.example.chat.realtime.service.notification.NotificationDispatcher;
import com.example.chat.realtime.service.session.SessionRegistry;
import com.example.chat.shared.aspect.Monitored;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for the CRUD layer: turns already-persisted changes into real-time events.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored("event-publisher")
public class RealtimeEventPublisher {

    private final EventDispatcher eventDispatcher;
    private final SessionRegistry sessionRegistry;
    private final NotificationDispatcher notificationDispatcher;
    private final CallSignalingService callSignalingService;

    /**
     * Broadcasts {@code new_message} to the room except the sender. Recipients the caller names
     * that have no open connection are handed to the notification dispatcher instead.
     *
     * @return the number of connections the message was written to
     */
    public Mono<Integer> publishNewMessage(String chatId, String senderId, Map<String, Object> message,
                                           Collection<String> recipientIds) {
        Map<String, Object> data = new LinkedHashMap<>(message);
        data.putIfAbsent("chat_id", chatId);
        data.putIfAbsent("sender_id", senderId);

        Mono<Integer> broadcast = eventDispatcher.broadcastToRoom(chatId,
                OutboundEvent.toRoom(chatId, senderId, OutboundEventType.NEW_MESSAGE, data), senderId);

        if (recipientIds == null || recipientIds.isEmpty()) {
            return broadcast;
        }
        Map<String, Object> notification = OutboundEvent.fields(
                "type", OutboundEventType.NEW_MESSAGE.wireName(),
                "chat_id", chatId,
                "sender_id", senderId,
                "message", data);

        Mono<Void> pushOffline = Flux.fromIterable(recipientIds)
                .distinct()
                .filter(recipientId -> !recipientId.equals(senderId) && !sessionRegistry.isOnline(recipientId))
                .flatMap(recipientId -> notificationDispatcher.notifyUser(recipientId, notification)
                        .onErrorResume(e -> {
                            log.warn("Failed to hand message for chat {} to notifications for user {}: {}",
                                    chatId, recipientId, e.getMessage());
                            return Mono.empty();
                        }))
                .then();

        return broadcast.flatMap(delivered -> pushOffline.thenReturn(delivered));
    }

    public Mono<Integer> publishMessageUpdated(String chatId, Map<String, Object> message) {
        Map<String, Object> data = new LinkedHashMap<>(message);
        data.putIfAbsent("chat_id", chatId);
        return eventDispatcher.broadcastToRoom(chatId,
                OutboundEvent.toRoom(chatId, null, OutboundEventType.MESSAGE_UPDATED, data), null);
    }

    public Mono<Integer> publishMessageDeleted(String chatId, String messageId) {
        return eventDispatcher.broadcastToRoom(chatId,
                OutboundEvent.toRoom(chatId, null, OutboundEventType.MESSAGE_DELETED,
                        OutboundEvent.fields("message_id", messageId, "chat_id", chatId)), null);
    }

    public Mono<Integer> publishToUser(String userId, OutboundEventType type, Map<String, Object> data) {
        return eventDispatcher.dispatch(OutboundEvent.toUser(userId, type, data));
    }

    public Mono<Integer> publishCallEvent(OutboundEventType type, Map<String, Object> data, Collection<String> participants) {
        return callSignalingService.broadcastCallEvent(type, data, participants);
    }
}
