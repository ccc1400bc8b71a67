package com.example.chat.realtime.service.location;

import com.example.chat.realtime.service.dispatch.OutboundEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A user's consent to stream their location, either to one user or, when {@code targetUserId}
 * is null, to everyone who shares a room with them.
 */
@Value
@Builder
public class LocationShare {
    String shareId;
    String ownerId;
    String targetUserId;
    Instant startedAt;
    Instant expiresAt;

    public boolean isPublic() {
        return targetUserId == null;
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public Map<String, Object> toEventData() {
        return OutboundEvent.fields(
                "share_id", shareId,
                "user_id", ownerId,
                "target_user_id", targetUserId,
                "started_at", startedAt.toString(),
                "expires_at", expiresAt.toString());
    }
}
