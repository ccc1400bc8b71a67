package com.example.chat.realtime.service.typing;

import com.example.chat.realtime.support.MutableClock;
import com.example.chat.shared.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TypingTrackerTest {

    private MutableClock clock;
    private TypingTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        AppProperties properties = new AppProperties();
        properties.getTyping().setTtl(Duration.ofSeconds(10));
        tracker = new TypingTracker(clock, properties);
    }

    @Test
    void staleEntryReadsAsNotTypingBeforeSweep() {
        tracker.markTyping("r1", "alice");
        assertThat(tracker.isTyping("r1", "alice")).isTrue();

        clock.advance(Duration.ofSeconds(11));

        assertThat(tracker.isTyping("r1", "alice")).isFalse();
        assertThat(tracker.typingUsers("r1")).isEmpty();
        assertThat(tracker.size()).isEqualTo(1);
    }

    @Test
    void sweepRemovesOnlyExpiredEntries() {
        tracker.markTyping("r1", "alice");
        clock.advance(Duration.ofSeconds(8));
        tracker.markTyping("r1", "bob");
        clock.advance(Duration.ofSeconds(3));

        assertThat(tracker.sweepExpired()).containsExactly(new TypingKey("r1", "alice"));
        assertThat(tracker.isTyping("r1", "bob")).isTrue();
        assertThat(tracker.sweepExpired()).isEmpty();
    }

    @Test
    void refreshingAnEntryKeepsItAlive() {
        tracker.markTyping("r1", "alice");
        clock.advance(Duration.ofSeconds(9));
        tracker.markTyping("r1", "alice");
        clock.advance(Duration.ofSeconds(9));

        assertThat(tracker.sweepExpired()).isEmpty();
        assertThat(tracker.isTyping("r1", "alice")).isTrue();
    }

    @Test
    void clearUserRemovesEveryRoomOfThatUser() {
        tracker.markTyping("r1", "alice");
        tracker.markTyping("r2", "alice");
        tracker.markTyping("r1", "bob");

        assertThat(tracker.clearUser("alice"))
                .containsExactlyInAnyOrder(new TypingKey("r1", "alice"), new TypingKey("r2", "alice"));
        assertThat(tracker.typingUsers("r1")).containsExactly("bob");
    }

    @Test
    void clearTypingReportsWhetherThereWasAnEntry() {
        tracker.markTyping("r1", "alice");

        assertThat(tracker.clearTyping("r1", "alice")).isTrue();
        assertThat(tracker.clearTyping("r1", "alice")).isFalse();
    }
}
