package com.example.chat.realtime.service.session;

import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens and closes connections against the {@link SessionRegistry} and announces the
 * resulting online/offline transitions as {@link PresenceChangedEvent}s.
 * <p>
 * Announcements for one user are made by one thread at a time and always carry the registry's
 * state at the moment of publishing, so the last event published for a user matches
 * {@link SessionRegistry#isOnline} once connects and disconnects settle. A flap that is undone
 * before it is announced produces no event.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionLifecycleManager {

    private final SessionRegistry sessionRegistry;
    private final ApplicationEventPublisher eventPublisher;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    /** Users whose presence is being announced or was last announced as online. */
    private final ConcurrentHashMap<String, Announcer> announcers = new ConcurrentHashMap<>();

    public ConnectionHandle open(String userId, ConnectionChannel channel) {
        RegistrationResult result = sessionRegistry.register(userId, channel);
        ConnectionHandle handle = result.getHandle();
        log.info("Connection {} opened for user {}", handle.getConnectionId(), userId);

        if (result.isBecameOnline()) {
            announce(userId);
        }
        return handle;
    }

    /**
     * Unregisters and closes the connection. Safe to call any number of times; only the first
     * call for a registered connection has an effect.
     *
     * @return true if this call removed the connection
     */
    public boolean close(ConnectionHandle handle, String reason) {
        if (handle == null) {
            return false;
        }
        UnregistrationResult result = sessionRegistry.unregister(handle.getUserId(), handle.getConnectionId());
        if (!result.isRemoved()) {
            return false;
        }

        try {
            handle.getChannel().close(reason);
        } catch (Exception e) {
            log.warn("Error closing connection {} for user {}: {}", handle.getConnectionId(), handle.getUserId(), e.getMessage());
        }
        log.info("Connection {} closed for user {}: {}", handle.getConnectionId(), handle.getUserId(), reason);

        if (result.isBecameOffline()) {
            announce(handle.getUserId());
        }
        return true;
    }

    @PreDestroy
    public void closeAll() {
        shuttingDown.set(true);
        int open = sessionRegistry.connectionCount();
        if (open == 0) {
            return;
        }
        log.info("Closing {} open connections for shutdown...", open);
        sessionRegistry.activeConnections().forEach(handle -> close(handle, "Server shutting down"));
        log.info("All connections closed.");
    }

    private void announce(String userId) {
        AtomicBoolean drainer = new AtomicBoolean();
        Announcer announcer = announcers.compute(userId, (key, existing) -> {
            Announcer current = existing != null ? existing : new Announcer();
            drainer.set(current.pending.getAndIncrement() == 0);
            return current;
        });
        if (!drainer.get()) {
            // The thread already announcing this user re-reads the registry before it stops.
            return;
        }

        int missed = 1;
        do {
            boolean online = sessionRegistry.isOnline(userId);
            if (online != announcer.announcedOnline) {
                announcer.announcedOnline = online;
                publish(userId, online);
            }
            missed = announcer.pending.addAndGet(-missed);
        } while (missed != 0);

        announcers.computeIfPresent(userId, (key, current) ->
                current.pending.get() == 0 && !current.announcedOnline ? null : current);
    }

    private void publish(String userId, boolean online) {
        if (shuttingDown.get()) {
            return;
        }
        Instant lastSeen = sessionRegistry.lastSeen(userId).orElse(null);
        try {
            eventPublisher.publishEvent(online
                    ? PresenceChangedEvent.online(userId, lastSeen)
                    : PresenceChangedEvent.offline(userId, lastSeen));
        } catch (RuntimeException e) {
            log.error("Failed to announce presence of user {} (online={})", userId, online, e);
        }
    }

    private static final class Announcer {
        final AtomicInteger pending = new AtomicInteger();
        /** Written only by the thread that moved {@link #pending} off zero. */
        volatile boolean announcedOnline;
    }
}
