package com.example.chat.realtime.service.location;

import com.example.chat.realtime.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LocationShareRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final LocationShareRegistry registry = new LocationShareRegistry(clock);

    @Test
    void shareExpiresAfterItsDuration() {
        LocationShare share = registry.start("alice", "bob", Duration.ofMinutes(10));

        assertThat(share.getExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(10)));
        assertThat(registry.activeSharesOf("alice")).containsExactly(share);

        clock.advance(Duration.ofMinutes(10));

        assertThat(registry.activeSharesOf("alice")).isEmpty();
        assertThat(registry.removeExpired()).containsExactly(share);
        assertThat(registry.removeExpired()).isEmpty();
        assertThat(registry.activeShareCount()).isZero();
    }

    @Test
    void stopRequiresOwnership() {
        LocationShare share = registry.start("alice", null, Duration.ofMinutes(10));

        assertThat(share.isPublic()).isTrue();
        assertThat(registry.stop(share.getShareId(), "bob")).isEmpty();
        assertThat(registry.stop(share.getShareId(), "alice")).contains(share);
        assertThat(registry.stop(share.getShareId(), "alice")).isEmpty();
    }
}
