package com.example.chat.realtime.service.typing;

import com.example.chat.realtime.service.dispatch.EventDispatcher;
import com.example.chat.realtime.service.dispatch.OutboundEvent;
import com.example.chat.realtime.service.dispatch.OutboundEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class TypingIndicatorService {

    private final TypingTracker typingTracker;
    private final EventDispatcher eventDispatcher;

    /**
     * Records the typing state and tells the rest of the room about it.
     */
    public Mono<Integer> setTyping(String roomId, String userId, boolean isTyping) {
        if (isTyping) {
            typingTracker.markTyping(roomId, userId);
        } else {
            typingTracker.clearTyping(roomId, userId);
        }
        return eventDispatcher.broadcastToRoom(roomId, typingEvent(roomId, userId, isTyping), userId);
    }

    /**
     * Clears the user's entry in one room, announcing a stop only if there was one.
     */
    public Mono<Integer> stopTypingIn(String roomId, String userId) {
        if (!typingTracker.clearTyping(roomId, userId)) {
            return Mono.just(0);
        }
        return eventDispatcher.broadcastToRoom(roomId, typingEvent(roomId, userId, false), userId);
    }

    /**
     * Clears every entry of the user and announces a stop in each affected room.
     */
    public Mono<Integer> stopTypingEverywhere(String userId) {
        return announceStopped(typingTracker.clearUser(userId));
    }

    /**
     * Removes stale entries and announces a stop for each, as if the client had sent one.
     */
    public Mono<Integer> expireStale() {
        List<TypingKey> expired = typingTracker.sweepExpired();
        if (!expired.isEmpty()) {
            log.debug("Expired {} stale typing indicators", expired.size());
        }
        return announceStopped(expired);
    }

    private Mono<Integer> announceStopped(List<TypingKey> keys) {
        if (keys.isEmpty()) {
            return Mono.just(0);
        }
        return Flux.fromIterable(keys)
                .flatMap(key -> eventDispatcher.broadcastToRoom(key.roomId(),
                        typingEvent(key.roomId(), key.userId(), false), key.userId()))
                .reduce(0, Integer::sum);
    }

    private static OutboundEvent typingEvent(String roomId, String userId, boolean isTyping) {
        return OutboundEvent.toRoom(roomId, userId, OutboundEventType.TYPING_INDICATOR,
                OutboundEvent.fields("chat_id", roomId, "user_id", userId, "is_typing", isTyping));
    }
}
