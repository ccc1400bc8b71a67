package com.example.chat.realtime.service.session;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maps each user to the set of connections they currently have open.
 * <p>
 * A user is online iff their connection set is non-empty. Every transition of a user's set
 * happens inside {@link ConcurrentHashMap#compute}, so concurrent register/unregister calls for
 * the same user are serialized while different users never contend. Nothing here performs I/O.
 */
@Component
@Slf4j
public class SessionRegistry {

    private final Map<String, Map<String, ConnectionHandle>> userConnections = new ConcurrentHashMap<>();
    private final Map<String, ConnectionHandle> connectionsById = new ConcurrentHashMap<>();

    private final Cache<String, Instant> lastSeen;
    private final Clock clock;

    public SessionRegistry(Clock clock, Cache<String, Instant> lastSeenCache) {
        this.clock = clock;
        this.lastSeen = lastSeenCache;
    }

    public RegistrationResult register(String userId, ConnectionChannel channel) {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(channel, "channel");

        Instant now = clock.instant();
        ConnectionHandle handle = new ConnectionHandle(UUID.randomUUID().toString(), userId, now, channel);
        AtomicBoolean becameOnline = new AtomicBoolean(false);

        userConnections.compute(userId, (key, connections) -> {
            Map<String, ConnectionHandle> target = connections;
            if (target == null) {
                target = new ConcurrentHashMap<>();
            }
            if (target.isEmpty()) {
                becameOnline.set(true);
            }
            target.put(handle.getConnectionId(), handle);
            lastSeen.put(key, now);
            return target;
        });
        connectionsById.put(handle.getConnectionId(), handle);

        log.debug("Registered connection {} for user {} (firstConnection={})", handle.getConnectionId(), userId, becameOnline.get());
        return new RegistrationResult(handle, becameOnline.get());
    }

    /**
     * Removes one connection. Unknown ids and repeated calls are no-ops.
     */
    public UnregistrationResult unregister(String userId, String connectionId) {
        if (userId == null || connectionId == null) {
            return UnregistrationResult.notRegistered();
        }

        Instant now = clock.instant();
        AtomicReference<ConnectionHandle> removed = new AtomicReference<>();
        AtomicBoolean becameOffline = new AtomicBoolean(false);

        userConnections.computeIfPresent(userId, (key, connections) -> {
            ConnectionHandle handle = connections.remove(connectionId);
            if (handle == null) {
                return connections;
            }
            removed.set(handle);
            if (connections.isEmpty()) {
                becameOffline.set(true);
                lastSeen.put(key, now);
                return null;
            }
            return connections;
        });

        ConnectionHandle handle = removed.get();
        if (handle == null) {
            log.debug("Ignoring unregister of unknown connection {} for user {}", connectionId, userId);
            return UnregistrationResult.notRegistered();
        }
        connectionsById.remove(connectionId);

        log.debug("Unregistered connection {} for user {} (lastConnection={})", connectionId, userId, becameOffline.get());
        return new UnregistrationResult(handle, becameOffline.get(), becameOffline.get() ? now : null);
    }

    public boolean isOnline(String userId) {
        Map<String, ConnectionHandle> connections = userConnections.get(userId);
        return connections != null && !connections.isEmpty();
    }

    public Set<String> connectionIdsFor(String userId) {
        Map<String, ConnectionHandle> connections = userConnections.get(userId);
        return connections == null ? Set.of() : Set.copyOf(connections.keySet());
    }

    public List<ConnectionHandle> handlesFor(String userId) {
        Map<String, ConnectionHandle> connections = userConnections.get(userId);
        return connections == null ? List.of() : List.copyOf(connections.values());
    }

    public Optional<ConnectionHandle> findConnection(String connectionId) {
        return Optional.ofNullable(connectionsById.get(connectionId));
    }

    /**
     * Time of the user's most recent connect or last disconnect, if still remembered.
     */
    public Optional<Instant> lastSeen(String userId) {
        return Optional.ofNullable(lastSeen.getIfPresent(userId));
    }

    public List<ConnectionHandle> activeConnections() {
        return new ArrayList<>(connectionsById.values());
    }

    public int connectionCount() {
        return connectionsById.size();
    }

    public int onlineUserCount() {
        return userConnections.size();
    }
}
