package com.example.chat.realtime.controller;

import com.example.chat.realtime.dto.CallEventRequest;
import com.example.chat.realtime.dto.DeliveryResponse;
import com.example.chat.realtime.dto.DirectEventRequest;
import com.example.chat.realtime.dto.PresenceResponse;
import com.example.chat.realtime.dto.PublishMessageRequest;
import com.example.chat.realtime.dto.RealtimeStatsResponse;
import com.example.chat.realtime.dto.UpdateMessageRequest;
import com.example.chat.realtime.service.RealtimeEventPublisher;
import com.example.chat.realtime.service.dispatch.OutboundEventType;
import com.example.chat.realtime.service.location.LocationTrackingService;
import com.example.chat.realtime.service.location.UserLocation;
import com.example.chat.realtime.service.presence.PresenceService;
import com.example.chat.realtime.service.room.RoomMembershipIndex;
import com.example.chat.realtime.service.session.SessionRegistry;
import com.example.chat.realtime.service.typing.TypingTracker;
import com.example.chat.shared.exception.ResourceNotFoundException;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Called by the CRUD services once a change is stored, and by operators for live state.
 */
@RestController
@RequestMapping("/api/realtime")
@RequiredArgsConstructor
@Slf4j
public class RealtimeEventController {

    private final RealtimeEventPublisher eventPublisher;
    private final PresenceService presenceService;
    private final SessionRegistry sessionRegistry;
    private final RoomMembershipIndex roomMembershipIndex;
    private final TypingTracker typingTracker;
    private final LocationTrackingService locationTrackingService;

    @PostMapping("/chats/{chatId}/messages")
    @RateLimiter(name = "eventPublishLimiter")
    public Mono<ResponseEntity<DeliveryResponse>> publishNewMessage(@PathVariable String chatId,
                                                                    @Valid @RequestBody PublishMessageRequest request) {
        log.info("Publishing new message in chat {} from user {}", chatId, request.getSenderId());
        return eventPublisher.publishNewMessage(chatId, request.getSenderId(), request.getMessage(), request.getRecipientIds())
                .map(delivered -> ResponseEntity.ok(new DeliveryResponse(OutboundEventType.NEW_MESSAGE.wireName(), delivered)));
    }

    @PutMapping("/chats/{chatId}/messages/{messageId}")
    @RateLimiter(name = "eventPublishLimiter")
    public Mono<ResponseEntity<DeliveryResponse>> publishMessageUpdated(@PathVariable String chatId,
                                                                        @PathVariable String messageId,
                                                                        @Valid @RequestBody UpdateMessageRequest request) {
        log.info("Publishing update of message {} in chat {}", messageId, chatId);
        request.getMessage().putIfAbsent("id", messageId);
        return eventPublisher.publishMessageUpdated(chatId, request.getMessage())
                .map(delivered -> ResponseEntity.ok(new DeliveryResponse(OutboundEventType.MESSAGE_UPDATED.wireName(), delivered)));
    }

    @DeleteMapping("/chats/{chatId}/messages/{messageId}")
    @RateLimiter(name = "eventPublishLimiter")
    public Mono<ResponseEntity<DeliveryResponse>> publishMessageDeleted(@PathVariable String chatId,
                                                                        @PathVariable String messageId) {
        log.info("Publishing deletion of message {} in chat {}", messageId, chatId);
        return eventPublisher.publishMessageDeleted(chatId, messageId)
                .map(delivered -> ResponseEntity.ok(new DeliveryResponse(OutboundEventType.MESSAGE_DELETED.wireName(), delivered)));
    }

    @PostMapping("/users/{userId}/events")
    @RateLimiter(name = "eventPublishLimiter")
    public Mono<ResponseEntity<DeliveryResponse>> publishToUser(@PathVariable String userId,
                                                                @Valid @RequestBody DirectEventRequest request) {
        OutboundEventType type = OutboundEventType.fromWireName(request.getType())
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + request.getType()));
        log.info("Publishing {} to user {}", type.wireName(), userId);
        return eventPublisher.publishToUser(userId, type, request.getData())
                .map(delivered -> ResponseEntity.ok(new DeliveryResponse(type.wireName(), delivered)));
    }

    @PostMapping("/calls/events")
    @RateLimiter(name = "eventPublishLimiter")
    public Mono<ResponseEntity<DeliveryResponse>> publishCallEvent(@Valid @RequestBody CallEventRequest request) {
        OutboundEventType type = OutboundEventType.fromWireName(request.getType())
                .filter(RealtimeEventController::isCallEvent)
                .orElseThrow(() -> new IllegalArgumentException("Not a call event type: " + request.getType()));
        log.info("Publishing {} to {} call participants", type.wireName(), request.getParticipants().size());
        return eventPublisher.publishCallEvent(type, request.getData(), request.getParticipants())
                .map(delivered -> ResponseEntity.ok(new DeliveryResponse(type.wireName(), delivered)));
    }

    @GetMapping("/users/{userId}/presence")
    public ResponseEntity<PresenceResponse> getPresence(@PathVariable String userId) {
        PresenceResponse response = PresenceResponse.builder()
                .userId(userId)
                .online(presenceService.isOnline(userId))
                .lastSeen(presenceService.lastSeen(userId))
                .connections(sessionRegistry.connectionIdsFor(userId).size())
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/users/{userId}/location")
    public ResponseEntity<UserLocation> getLatestLocation(@PathVariable String userId) {
        return locationTrackingService.latestLocation(userId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("No known location for user " + userId));
    }

    @GetMapping("/chats/{chatId}/online-users")
    public ResponseEntity<List<String>> getOnlineUsers(@PathVariable String chatId) {
        Set<String> online = new TreeSet<>(presenceService.onlineMembersOf(chatId));
        return ResponseEntity.ok(List.copyOf(online));
    }

    @GetMapping("/stats")
    public ResponseEntity<RealtimeStatsResponse> getStats() {
        return ResponseEntity.ok(RealtimeStatsResponse.builder()
                .connections(sessionRegistry.connectionCount())
                .onlineUsers(sessionRegistry.onlineUserCount())
                .activeRooms(roomMembershipIndex.roomCount())
                .typingEntries(typingTracker.size())
                .activeLocationShares(locationTrackingService.activeShareCount())
                .build());
    }

    private static boolean isCallEvent(OutboundEventType type) {
        return type == OutboundEventType.INCOMING_CALL || type.name().startsWith("CALL_");
    }
}
