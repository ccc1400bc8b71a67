package com.example.chat.realtime.service.location;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
@Slf4j
public class LocationShareRegistry {

    private final Map<String, LocationShare> shares = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocationShareRegistry(Clock clock) {
        this.clock = clock;
    }

    public LocationShare start(String ownerId, String targetUserId, Duration duration) {
        Instant now = clock.instant();
        LocationShare share = LocationShare.builder()
                .shareId(UUID.randomUUID().toString())
                .ownerId(ownerId)
                .targetUserId(targetUserId)
                .startedAt(now)
                .expiresAt(now.plus(duration))
                .build();
        shares.put(share.getShareId(), share);
        log.info("User {} started location share {} with {} until {}", ownerId, share.getShareId(),
                share.isPublic() ? "room peers" : "user " + targetUserId, share.getExpiresAt());
        return share;
    }

    /**
     * Stops a share. Only its owner may stop it.
     *
     * @return the stopped share, or empty if no such share belongs to the user
     */
    public Optional<LocationShare> stop(String shareId, String ownerId) {
        LocationShare share = shares.get(shareId);
        if (share == null || !share.getOwnerId().equals(ownerId) || !shares.remove(shareId, share)) {
            return Optional.empty();
        }
        log.info("User {} stopped location share {}", ownerId, shareId);
        return Optional.of(share);
    }

    public List<LocationShare> activeSharesOf(String ownerId) {
        Instant now = clock.instant();
        List<LocationShare> active = new ArrayList<>();
        for (LocationShare share : shares.values()) {
            if (share.getOwnerId().equals(ownerId) && !share.isExpired(now)) {
                active.add(share);
            }
        }
        return active;
    }

    /**
     * Removes and returns every share whose expiry has passed.
     */
    public List<LocationShare> removeExpired() {
        Instant now = clock.instant();
        List<LocationShare> expired = new ArrayList<>();
        for (LocationShare share : shares.values()) {
            if (share.isExpired(now) && shares.remove(share.getShareId(), share)) {
                expired.add(share);
            }
        }
        return expired;
    }

    public int activeShareCount() {
        return shares.size();
    }
}
