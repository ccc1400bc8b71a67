package com.example.chat.realtime.service.typing;

import com.example.chat.shared.config.AppProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Last time each user was seen typing in each room. Entries older than the TTL read as
 * "not typing" even before the sweeper removes them.
 */
@Component
public class TypingTracker {

    private final Map<TypingKey, Instant> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration ttl;

    public TypingTracker(Clock clock, AppProperties appProperties) {
        this.clock = clock;
        this.ttl = appProperties.getTyping().getTtl();
    }

    public void markTyping(String roomId, String userId) {
        entries.put(new TypingKey(roomId, userId), clock.instant());
    }

    /**
     * @return true if an entry was removed
     */
    public boolean clearTyping(String roomId, String userId) {
        return entries.remove(new TypingKey(roomId, userId)) != null;
    }

    public boolean isTyping(String roomId, String userId) {
        Instant lastTyped = entries.get(new TypingKey(roomId, userId));
        return lastTyped != null && !isExpired(lastTyped, clock.instant());
    }

    public Set<String> typingUsers(String roomId) {
        Instant now = clock.instant();
        return entries.entrySet().stream()
                .filter(entry -> entry.getKey().roomId().equals(roomId))
                .filter(entry -> !isExpired(entry.getValue(), now))
                .map(entry -> entry.getKey().userId())
                .collect(Collectors.toSet());
    }

    /**
     * Removes every entry older than the TTL. An entry refreshed between the scan and the
     * removal is kept.
     *
     * @return the keys that were removed
     */
    public List<TypingKey> sweepExpired() {
        Instant now = clock.instant();
        List<TypingKey> expired = new ArrayList<>();
        for (Map.Entry<TypingKey, Instant> entry : entries.entrySet()) {
            if (isExpired(entry.getValue(), now) && entries.remove(entry.getKey(), entry.getValue())) {
                expired.add(entry.getKey());
            }
        }
        return expired;
    }

    /**
     * Drops all of a user's entries, expired or not.
     *
     * @return the keys that were removed
     */
    public List<TypingKey> clearUser(String userId) {
        List<TypingKey> removed = new ArrayList<>();
        for (TypingKey key : entries.keySet()) {
            if (key.userId().equals(userId) && entries.remove(key) != null) {
                removed.add(key);
            }
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(Instant lastTyped, Instant now) {
        return Duration.between(lastTyped, now).compareTo(ttl) > 0;
    }
}
