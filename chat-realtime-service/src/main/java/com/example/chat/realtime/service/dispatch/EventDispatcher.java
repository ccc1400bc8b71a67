package com.example.chat.realtime.service.dispatch;

import com.example.chat.realtime.service.room.RoomMembershipIndex;
import com.example.chat.realtime.service.session.ConnectionHandle;
import com.example.chat.realtime.service.session.ConnectionLifecycleManager;
import com.example.chat.realtime.service.session.SessionRegistry;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig.ChatMetricsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Resolves an event's address to open connections and writes the serialized frame to each.
 * <p>
 * Delivery is best effort. Each connection write is bounded by the configured write timeout;
 * a write that fails or times out gets that connection terminated and counts as not delivered.
 * The returned Monos never error, and a broken connection never holds up the others.
 */
@Service
@Slf4j
public class EventDispatcher {

    private final SessionRegistry sessionRegistry;
    private final RoomMembershipIndex roomMembershipIndex;
    private final ConnectionLifecycleManager connectionLifecycleManager;
    private final OutboundEventFactory eventFactory;
    private final ChatMetricsCollector metricsCollector;
    private final Duration writeTimeout;

    public EventDispatcher(SessionRegistry sessionRegistry,
                           RoomMembershipIndex roomMembershipIndex,
                           ConnectionLifecycleManager connectionLifecycleManager,
                           OutboundEventFactory eventFactory,
                           ChatMetricsCollector metricsCollector,
                           AppProperties appProperties) {
        this.sessionRegistry = sessionRegistry;
        this.roomMembershipIndex = roomMembershipIndex;
        this.connectionLifecycleManager = connectionLifecycleManager;
        this.eventFactory = eventFactory;
        this.metricsCollector = metricsCollector;
        this.writeTimeout = appProperties.getDispatch().getWriteTimeout();
    }

    /**
     * Delivers the event to whatever its address resolves to.
     *
     * @return the number of connections the frame was written to
     */
    public Mono<Integer> dispatch(OutboundEvent event) {
        EventAddress address = event.getAddress();
        if (address instanceof EventAddress.User user) {
            return sendToUser(user.userId(), event);
        }
        if (address instanceof EventAddress.Users users) {
            return sendToUsers(users.userIds(), event);
        }
        if (address instanceof EventAddress.Room room) {
            return broadcastToRoom(room.roomId(), event, room.excludeUserId());
        }
        if (address instanceof EventAddress.Connection connection) {
            return sendToConnection(connection.handle(), event);
        }
        throw new IllegalArgumentException("Unsupported event address: " + address);
    }

    public Mono<Integer> sendToUser(String userId, OutboundEvent event) {
        return sendToUsers(List.of(userId), event);
    }

    public Mono<Integer> sendToUsers(Collection<String> userIds, OutboundEvent event) {
        Set<String> recipients = Set.copyOf(userIds);
        if (recipients.isEmpty()) {
            return Mono.just(0);
        }
        String frame = eventFactory.serialize(event);
        if (frame == null) {
            return Mono.just(0);
        }
        return Flux.fromIterable(recipients)
                .flatMap(userId -> deliverToUser(userId, frame, event.getType()))
                .reduce(0, Integer::sum);
    }

    /**
     * Writes the event to every connection of every room member except {@code excludeUserId}.
     * A room without members is a no-op.
     */
    public Mono<Integer> broadcastToRoom(String roomId, OutboundEvent event, String excludeUserId) {
        Set<String> members = roomMembershipIndex.membersOf(roomId);
        if (excludeUserId != null) {
            members.remove(excludeUserId);
        }
        if (members.isEmpty()) {
            log.trace("No recipients in room {} for {}", roomId, event.getType());
            return Mono.just(0);
        }
        return sendToUsers(members, event);
    }

    public Mono<Integer> sendToConnection(ConnectionHandle handle, OutboundEvent event) {
        String frame = eventFactory.serialize(event);
        if (frame == null) {
            return Mono.just(0);
        }
        return write(handle, frame, event.getType());
    }

    private Mono<Integer> deliverToUser(String userId, String frame, OutboundEventType type) {
        List<ConnectionHandle> handles = sessionRegistry.handlesFor(userId);
        if (handles.isEmpty()) {
            log.trace("User {} has no open connections, skipping {}", userId, type);
            return Mono.just(0);
        }
        return Flux.fromIterable(handles)
                .flatMap(handle -> write(handle, frame, type))
                .reduce(0, Integer::sum);
    }

    private Mono<Integer> write(ConnectionHandle handle, String frame, OutboundEventType type) {
        return Mono.defer(() -> handle.getChannel().send(frame))
                .timeout(writeTimeout)
                .then(Mono.fromCallable(() -> {
                    metricsCollector.incrementCounter("chat.dispatch.delivered", "type", type.wireName());
                    return 1;
                }))
                .onErrorResume(error -> {
                    log.warn("Failed to deliver {} to user {} on connection {}: {}. Terminating connection.",
                            type, handle.getUserId(), handle.getConnectionId(), describe(error));
                    metricsCollector.incrementCounter("chat.dispatch.failed", "type", type.wireName());
                    connectionLifecycleManager.close(handle, "Delivery failed");
                    return Mono.just(0);
                });
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
