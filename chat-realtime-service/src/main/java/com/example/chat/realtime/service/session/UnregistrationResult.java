package com.example.chat.realtime.service.session;

import lombok.Value;

import java.time.Instant;

@Value
public class UnregistrationResult {

    private static final UnregistrationResult NOT_REGISTERED = new UnregistrationResult(null, false, null);

    /** The removed handle, or null when the connection was not registered. */
    ConnectionHandle handle;
    /** True when the user's last connection was removed. */
    boolean becameOffline;
    /** Set only when {@link #becameOffline} is true. */
    Instant lastSeen;

    public static UnregistrationResult notRegistered() {
        return NOT_REGISTERED;
    }

    public boolean isRemoved() {
        return handle != null;
    }
}
