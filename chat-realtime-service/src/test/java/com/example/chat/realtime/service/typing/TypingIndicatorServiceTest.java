package com.example.chat.realtime.service.typing;

import com.example.chat.realtime.support.RealtimeTestContext;
import com.example.chat.realtime.support.TestConnection;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TypingIndicatorServiceTest {

    private RealtimeTestContext context;
    private TestConnection alice;
    private TestConnection bob;

    @BeforeEach
    void setUp() {
        context = new RealtimeTestContext();
        alice = context.connect("alice");
        bob = context.connect("bob");
        context.roomIndex.join("r1", "alice");
        context.roomIndex.join("r1", "bob");
    }

    @Test
    void typingIsBroadcastToTheRoomExceptTheTypist() {
        Integer delivered = context.typingService.setTyping("r1", "alice", true).block();

        assertThat(delivered).isEqualTo(1);
        List<JsonNode> received = bob.eventsOfType("typing_indicator");
        assertThat(received).hasSize(1);
        assertThat(received.get(0).path("data").path("user_id").asText()).isEqualTo("alice");
        assertThat(received.get(0).path("data").path("chat_id").asText()).isEqualTo("r1");
        assertThat(received.get(0).path("data").path("is_typing").asBoolean()).isTrue();
        assertThat(alice.eventsOfType("typing_indicator")).isEmpty();
    }

    @Test
    void sweepAnnouncesStopWithoutClientInput() {
        context.typingService.setTyping("r1", "alice", true).block();
        context.clock.advance(Duration.ofSeconds(11));

        context.typingService.expireStale().block();

        List<JsonNode> received = bob.eventsOfType("typing_indicator");
        assertThat(received).hasSize(2);
        assertThat(received.get(1).path("data").path("is_typing").asBoolean()).isFalse();
        assertThat(context.typingTracker.size()).isZero();
    }

    @Test
    void explicitStopBeforeExpiryYieldsExactlyOneStop() {
        context.typingService.setTyping("r1", "alice", true).block();
        context.clock.advance(Duration.ofSeconds(2));
        context.typingService.setTyping("r1", "alice", false).block();
        context.clock.advance(Duration.ofSeconds(20));
        context.typingService.expireStale().block();

        long stops = bob.eventsOfType("typing_indicator").stream()
                .filter(event -> !event.path("data").path("is_typing").asBoolean())
                .count();
        assertThat(stops).isEqualTo(1);
    }

    @Test
    void stopTypingInAnnouncesOnlyWhenThereWasAnEntry() {
        assertThat(context.typingService.stopTypingIn("r1", "alice").block()).isZero();

        context.typingService.setTyping("r1", "alice", true).block();
        assertThat(context.typingService.stopTypingIn("r1", "alice").block()).isEqualTo(1);
    }
}
