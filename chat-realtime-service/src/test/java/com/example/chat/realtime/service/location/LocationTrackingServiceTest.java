package com.example.chat.realtime.service.location;

import com.example.chat.realtime.support.RealtimeTestContext;
import com.example.chat.realtime.support.TestConnection;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LocationTrackingServiceTest {

    private RealtimeTestContext context;
    private TestConnection alice;
    private TestConnection bob;
    private TestConnection carol;

    @BeforeEach
    void setUp() {
        context = new RealtimeTestContext();
        alice = context.connect("alice");
        bob = context.connect("bob");
        carol = context.connect("carol");
    }

    private void sendLocation(TestConnection connection, double latitude, double longitude) {
        context.send(connection, "{\"type\":\"location_update\",\"data\":{\"latitude\":" + latitude
                + ",\"longitude\":" + longitude + ",\"accuracy\":5.0}}");
    }

    private String startShare(TestConnection owner, String target, int minutes) {
        String targetField = target == null ? "" : "\"target_user_id\":\"" + target + "\",";
        context.send(owner, "{\"type\":\"location_share_start\",\"data\":{" + targetField + "\"duration_minutes\":" + minutes + "}}");
        return owner.eventsOfType("location_share_started").get(0).path("data").path("share_id").asText();
    }

    @Test
    void updateIsStoredAndAcknowledged() {
        sendLocation(alice, 51.5, -0.12);

        JsonNode ack = alice.lastEvent();
        assertThat(ack.path("type").asText()).isEqualTo("location_updated");
        assertThat(ack.path("data").path("latitude").asDouble()).isEqualTo(51.5);
        assertThat(context.locationService.latestLocation("alice")).hasValueSatisfying(location -> {
            assertThat(location.getLongitude()).isEqualTo(-0.12);
            assertThat(location.getAccuracy()).isEqualTo(5.0);
        });
        assertThat(bob.eventsOfType("shared_location_update")).isEmpty();
    }

    @Test
    void targetedShareForwardsUpdatesToTheTargetOnly() {
        sendLocation(alice, 51.5, -0.12);
        startShare(alice, "bob", 30);

        assertThat(bob.eventsOfType("location_share_started")).hasSize(1);
        assertThat(bob.eventsOfType("shared_location_update")).hasSize(1);

        sendLocation(alice, 51.6, -0.13);

        List<JsonNode> updates = bob.eventsOfType("shared_location_update");
        assertThat(updates).hasSize(2);
        assertThat(updates.get(1).path("data").path("user_id").asText()).isEqualTo("alice");
        assertThat(updates.get(1).path("data").path("latitude").asDouble()).isEqualTo(51.6);
        assertThat(carol.eventsOfType("shared_location_update")).isEmpty();
    }

    @Test
    void publicShareGoesToRoomPeers() {
        context.roomIndex.join("r1", "alice");
        context.roomIndex.join("r1", "carol");
        startShare(alice, null, 30);

        sendLocation(alice, 10, 10);

        assertThat(carol.eventsOfType("shared_location_update")).hasSize(1);
        assertThat(bob.eventsOfType("shared_location_update")).isEmpty();
    }

    @Test
    void stoppedShareNoLongerForwards() {
        String shareId = startShare(alice, "bob", 30);

        context.send(alice, "{\"type\":\"location_share_stop\",\"data\":{\"share_id\":\"" + shareId + "\"}}");
        sendLocation(alice, 10, 10);

        assertThat(alice.eventsOfType("location_share_stopped")).hasSize(1);
        assertThat(bob.eventsOfType("location_share_stopped")).hasSize(1);
        assertThat(bob.eventsOfType("shared_location_update")).isEmpty();
    }

    @Test
    void onlyTheOwnerCanStopAShare() {
        String shareId = startShare(alice, "bob", 30);

        context.send(bob, "{\"type\":\"location_share_stop\",\"data\":{\"share_id\":\"" + shareId + "\"}}");

        assertThat(bob.lastEvent().path("type").asText()).isEqualTo("error");
        assertThat(context.locationService.activeShareCount()).isEqualTo(1);
    }

    @Test
    void expiredSharesAreSweptAndAnnounced() {
        startShare(alice, "bob", 5);
        context.clock.advance(Duration.ofMinutes(6));

        sendLocation(alice, 10, 10);
        assertThat(bob.eventsOfType("shared_location_update")).isEmpty();

        context.locationService.expireShares().block();

        JsonNode stopped = bob.eventsOfType("location_share_stopped").get(0);
        assertThat(stopped.path("data").path("reason").asText()).isEqualTo("expired");
        assertThat(alice.eventsOfType("location_share_stopped")).hasSize(1);
        assertThat(context.locationService.activeShareCount()).isZero();
    }

    @Test
    void shareWithSelfOrTooLongIsRejected() {
        context.send(alice, "{\"type\":\"location_share_start\",\"data\":{\"target_user_id\":\"alice\",\"duration_minutes\":10}}");
        assertThat(alice.lastEvent().path("data").path("message").asText()).isEqualTo("Cannot share location with yourself");

        context.send(alice, "{\"type\":\"location_share_start\",\"data\":{\"target_user_id\":\"bob\",\"duration_minutes\":100000}}");
        assertThat(alice.lastEvent().path("type").asText()).isEqualTo("error");
        assertThat(context.locationService.activeShareCount()).isZero();
    }

    @Test
    void geofenceEdgesAreReportedToTheOwner() {
        context.locationService.saveGeofence(Geofence.builder()
                .id("office")
                .userId("alice")
                .name("Office")
                .centerLatitude(40.0)
                .centerLongitude(-74.0)
                .radiusMeters(200)
                .triggerOnEnter(true)
                .triggerOnExit(true)
                .build());

        sendLocation(alice, 40.0, -74.0);
        sendLocation(alice, 40.0005, -74.0);
        sendLocation(alice, 40.05, -74.0);

        List<JsonNode> events = alice.eventsOfType("geofence_event");
        assertThat(events).hasSize(2);
        assertThat(events.get(0).path("data").path("event_type").asText()).isEqualTo("enter");
        assertThat(events.get(0).path("data").path("geofence_id").asText()).isEqualTo("office");
        assertThat(events.get(0).path("data").path("name").asText()).isEqualTo("Office");
        assertThat(events.get(1).path("data").path("event_type").asText()).isEqualTo("exit");
        assertThat(bob.eventsOfType("geofence_event")).isEmpty();
    }
}
