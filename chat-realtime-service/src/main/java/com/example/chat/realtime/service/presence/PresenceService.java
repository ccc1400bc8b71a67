package com.example.chat.realtime.service.presence;

import com.example.chat.realtime.service.dispatch.EventDispatcher;
import com.example.chat.realtime.service.dispatch.OutboundEvent;
import com.example.chat.realtime.service.dispatch.OutboundEventType;
import com.example.chat.realtime.service.room.RoomMembershipIndex;
import com.example.chat.realtime.service.session.PresenceChangedEvent;
import com.example.chat.realtime.service.session.SessionRegistry;
import com.example.chat.realtime.service.typing.TypingIndicatorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Set;

/**
 * Announces online/offline transitions to everyone who shares a room with the user.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PresenceService {

    private final SessionRegistry sessionRegistry;
    private final RoomMembershipIndex roomMembershipIndex;
    private final EventDispatcher eventDispatcher;
    private final TypingIndicatorService typingIndicatorService;

    @EventListener
    public void onPresenceChanged(PresenceChangedEvent event) {
        broadcastPresence(event).subscribe(
                delivered -> log.debug("Presence of user {} (online={}) delivered to {} connections",
                        event.getUserId(), event.isOnline(), delivered),
                error -> log.error("Failed to broadcast presence of user {}", event.getUserId(), error));
    }

    /**
     * Sends one {@code user_status} to each peer, however many rooms they share with the user.
     * Going offline also ends the user's typing indicators.
     */
    public Mono<Integer> broadcastPresence(PresenceChangedEvent event) {
        String userId = event.getUserId();
        Set<String> peers = roomMembershipIndex.peersOf(userId);

        Mono<Integer> status = peers.isEmpty()
                ? Mono.just(0)
                : eventDispatcher.sendToUsers(peers, OutboundEvent.toUsers(peers, OutboundEventType.USER_STATUS,
                        OutboundEvent.fields(
                                "user_id", userId,
                                "is_online", event.isOnline(),
                                "last_seen", event.getLastSeen() != null ? event.getLastSeen().toString() : null)));

        if (event.isOnline()) {
            return status;
        }
        return status.flatMap(sent -> typingIndicatorService.stopTypingEverywhere(userId).map(stops -> sent + stops));
    }

    public boolean isOnline(String userId) {
        return sessionRegistry.isOnline(userId);
    }

    public Instant lastSeen(String userId) {
        return sessionRegistry.lastSeen(userId).orElse(null);
    }

    /**
     * Members of the room that currently have at least one open connection.
     */
    public Set<String> onlineMembersOf(String roomId) {
        Set<String> members = roomMembershipIndex.membersOf(roomId);
        members.removeIf(member -> !sessionRegistry.isOnline(member));
        return members;
    }
}
