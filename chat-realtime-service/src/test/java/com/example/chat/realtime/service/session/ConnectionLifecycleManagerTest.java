package com.example.chat.realtime.service.session;

import com.example.chat.realtime.support.MutableClock;
import com.example.chat.realtime.support.RecordingChannel;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionLifecycleManagerTest {

    private final List<Object> published = new CopyOnWriteArrayList<>();
    private SessionRegistry registry;
    private ConnectionLifecycleManager manager;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(new MutableClock(Instant.parse("2024-03-01T12:00:00Z")), Caffeine.newBuilder().build());
        manager = new ConnectionLifecycleManager(registry, published::add);
    }

    @Test
    void publishesOnlineOnlyForFirstConnection() {
        manager.open("alice", new RecordingChannel());
        manager.open("alice", new RecordingChannel());

        assertThat(published).hasSize(1);
        PresenceChangedEvent event = (PresenceChangedEvent) published.get(0);
        assertThat(event.getUserId()).isEqualTo("alice");
        assertThat(event.isOnline()).isTrue();
    }

    @Test
    void closeIsIdempotentAndClosesTheChannelOnce() {
        RecordingChannel channel = new RecordingChannel();
        ConnectionHandle handle = manager.open("alice", channel);
        published.clear();

        assertThat(manager.close(handle, "bye")).isTrue();
        assertThat(manager.close(handle, "bye again")).isFalse();

        assertThat(channel.closeCount()).isEqualTo(1);
        assertThat(channel.closeReason()).isEqualTo("bye");
        assertThat(published).hasSize(1);
        assertThat(((PresenceChangedEvent) published.get(0)).isOnline()).isFalse();
    }

    @Test
    void closingOneOfSeveralConnectionsKeepsUserOnline() {
        ConnectionHandle first = manager.open("alice", new RecordingChannel());
        manager.open("alice", new RecordingChannel());
        published.clear();

        manager.close(first, "one tab closed");

        assertThat(published).isEmpty();
        assertThat(registry.isOnline("alice")).isTrue();
    }

    @Test
    void closeAllDoesNotAnnouncePresenceDuringShutdown() {
        RecordingChannel a = new RecordingChannel();
        RecordingChannel b = new RecordingChannel();
        manager.open("alice", a);
        manager.open("bob", b);
        published.clear();

        manager.closeAll();

        assertThat(registry.connectionCount()).isZero();
        assertThat(a.closeCount()).isEqualTo(1);
        assertThat(b.closeCount()).isEqualTo(1);
        assertThat(published).isEmpty();
    }

    @Test
    void reconnectDuringSlowCloseLeavesUserAnnouncedOnline() throws Exception {
        CountDownLatch closing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ConnectionHandle first = manager.open("alice", blockingCloseChannel(closing, release));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> closed = executor.submit(() -> manager.close(first, "network drop"));
            assertThat(closing.await(5, TimeUnit.SECONDS)).isTrue();

            manager.open("alice", new RecordingChannel());
            release.countDown();

            assertThat(closed.get(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.isOnline("alice")).isTrue();
        assertThat(presenceStates()).isNotEmpty().last().isEqualTo(true);
        assertAlternating(presenceStates());
    }

    @Test
    void disconnectTriggeredWhileAnnouncingOnlineIsAnnouncedAfterIt() {
        manager = new ConnectionLifecycleManager(registry, event -> {
            published.add(event);
            if (((PresenceChangedEvent) event).isOnline()) {
                registry.handlesFor("alice").forEach(handle -> manager.close(handle, "kicked while announcing"));
            }
        });

        manager.open("alice", new RecordingChannel());

        assertThat(registry.isOnline("alice")).isFalse();
        assertThat(presenceStates()).containsExactly(true, false);
    }

    @Test
    void concurrentConnectsAndDisconnectsEndWithAnnouncedStateMatchingRegistry() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    for (int round = 0; round < 200; round++) {
                        ConnectionHandle handle = manager.open("alice", new RecordingChannel());
                        manager.close(handle, "churn");
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.isOnline("alice")).isFalse();
        List<Boolean> states = presenceStates();
        assertThat(states).isNotEmpty().last().isEqualTo(false);
        assertAlternating(states);
    }

    private List<Boolean> presenceStates() {
        return published.stream().map(event -> ((PresenceChangedEvent) event).isOnline()).toList();
    }

    private static void assertAlternating(List<Boolean> states) {
        for (int i = 1; i < states.size(); i++) {
            assertThat(states.get(i)).as("presence event %d repeats the previous state", i).isNotEqualTo(states.get(i - 1));
        }
    }

    private static ConnectionChannel blockingCloseChannel(CountDownLatch closing, CountDownLatch release) {
        return new ConnectionChannel() {
            @Override
            public Mono<Void> send(String frame) {
                return Mono.empty();
            }

            @Override
            public void close(String reason) {
                closing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public boolean isOpen() {
                return true;
            }
        };
    }
}
