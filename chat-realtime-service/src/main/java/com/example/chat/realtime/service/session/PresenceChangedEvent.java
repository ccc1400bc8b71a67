package com.example.chat.realtime.service.session;

import lombok.Value;

import java.time.Instant;

/**
 * Published when a user's first connection opens or their last connection closes.
 */
@Value
public class PresenceChangedEvent {
    String userId;
    boolean online;
    Instant lastSeen;

    public static PresenceChangedEvent online(String userId, Instant at) {
        return new PresenceChangedEvent(userId, true, at);
    }

    public static PresenceChangedEvent offline(String userId, Instant lastSeen) {
        return new PresenceChangedEvent(userId, false, lastSeen);
    }
}
