package com.example.chat.realtime.service.session;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

/**
 * Server-side representative of one open connection. Created and owned by {@link SessionRegistry}.
 */
@Value
public class ConnectionHandle {
    String connectionId;
    String userId;
    Instant createdAt;
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    ConnectionChannel channel;
}
