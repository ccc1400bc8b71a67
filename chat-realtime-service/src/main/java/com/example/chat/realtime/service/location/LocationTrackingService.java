package com.example.chat.realtime.service.location;

import com.example.chat.realtime.dto.inbound.LocationShareStartPayload;
import com.example.chat.realtime.dto.inbound.LocationShareStopPayload;
import com.example.chat.realtime.dto.inbound.LocationUpdatePayload;
import com.example.chat.realtime.service.dispatch.EventDispatcher;
import com.example.chat.realtime.service.dispatch.OutboundEvent;
import com.example.chat.realtime.service.dispatch.OutboundEventType;
import com.example.chat.realtime.service.room.RoomMembershipIndex;
import com.example.chat.realtime.service.session.ConnectionHandle;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.exception.ProtocolException;
import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live location: the latest fix per user, time-boxed shares of that fix with other users,
 * and geofence edge notifications.
 */
@Service
@Slf4j
public class LocationTrackingService {

    private final Cache<String, UserLocation> latestLocations;
    private final LocationShareRegistry shareRegistry;
    private final GeofenceStore geofenceStore;
    private final GeofenceTransitionDetector transitionDetector;
    private final RoomMembershipIndex roomMembershipIndex;
    private final EventDispatcher eventDispatcher;
    private final Clock clock;
    private final int maxShareDurationMinutes;

    public LocationTrackingService(Cache<String, UserLocation> latestLocationCache,
                                   LocationShareRegistry shareRegistry,
                                   GeofenceStore geofenceStore,
                                   GeofenceTransitionDetector transitionDetector,
                                   RoomMembershipIndex roomMembershipIndex,
                                   EventDispatcher eventDispatcher,
                                   Clock clock,
                                   AppProperties appProperties) {
        this.latestLocations = latestLocationCache;
        this.shareRegistry = shareRegistry;
        this.geofenceStore = geofenceStore;
        this.transitionDetector = transitionDetector;
        this.roomMembershipIndex = roomMembershipIndex;
        this.eventDispatcher = eventDispatcher;
        this.clock = clock;
        this.maxShareDurationMinutes = appProperties.getLocation().getMaxShareDurationMinutes();
    }

    /**
     * Stores the fix, acknowledges it on the sending connection, forwards it to the viewers of
     * the user's active shares and reports any geofence edges to the user.
     */
    public Mono<Void> updateLocation(ConnectionHandle connection, LocationUpdatePayload payload) {
        String userId = connection.getUserId();
        UserLocation location = UserLocation.builder()
                .userId(userId)
                .latitude(payload.getLatitude())
                .longitude(payload.getLongitude())
                .accuracy(payload.getAccuracy())
                .altitude(payload.getAltitude())
                .speed(payload.getSpeed())
                .heading(payload.getHeading())
                .timestamp(clock.instant())
                .build();
        latestLocations.put(userId, location);

        Map<String, Object> data = location.toEventData();
        Mono<Integer> ack = eventDispatcher.sendToConnection(connection,
                OutboundEvent.toConnection(connection, OutboundEventType.LOCATION_UPDATED, data));

        Set<String> viewers = viewersOf(userId);
        Mono<Integer> shared = viewers.isEmpty()
                ? Mono.just(0)
                : eventDispatcher.dispatch(OutboundEvent.toUsers(viewers, OutboundEventType.SHARED_LOCATION_UPDATE, data));

        List<GeofenceCrossing> crossings = transitionDetector.evaluate(userId, location.getLatitude(),
                location.getLongitude(), geofenceStore.findByUser(userId));
        Mono<Integer> geofenceEvents = Flux.fromIterable(crossings)
                .concatMap(crossing -> {
                    log.info("User {} {} geofence {} ({})", userId, crossing.getTransition().wireName(),
                            crossing.getGeofence().getId(), crossing.getGeofence().getName());
                    return eventDispatcher.dispatch(OutboundEvent.toUser(userId, OutboundEventType.GEOFENCE_EVENT,
                            OutboundEvent.fields(
                                    "geofence_id", crossing.getGeofence().getId(),
                                    "name", crossing.getGeofence().getName(),
                                    "event_type", crossing.getTransition().wireName(),
                                    "latitude", location.getLatitude(),
                                    "longitude", location.getLongitude(),
                                    "timestamp", location.getTimestamp().toString())));
                })
                .reduce(0, Integer::sum);

        return ack.then(shared).then(geofenceEvents).then();
    }

    public Mono<Void> startShare(ConnectionHandle connection, LocationShareStartPayload payload) {
        String ownerId = connection.getUserId();
        String target = payload.getTargetUserId() == null || payload.getTargetUserId().isBlank()
                ? null : payload.getTargetUserId();
        if (ownerId.equals(target)) {
            return Mono.error(new ProtocolException("Cannot share location with yourself"));
        }
        if (payload.getDurationMinutes() > maxShareDurationMinutes) {
            return Mono.error(new ProtocolException("Share duration cannot exceed " + maxShareDurationMinutes + " minutes"));
        }

        LocationShare share = shareRegistry.start(ownerId, target, Duration.ofMinutes(payload.getDurationMinutes()));
        Map<String, Object> data = share.toEventData();

        Mono<Integer> ack = eventDispatcher.sendToConnection(connection,
                OutboundEvent.toConnection(connection, OutboundEventType.LOCATION_SHARE_STARTED, data));
        Set<String> viewers = viewersOf(share);
        if (viewers.isEmpty()) {
            return ack.then();
        }

        Mono<Integer> notifyViewers = eventDispatcher.dispatch(
                OutboundEvent.toUsers(viewers, OutboundEventType.LOCATION_SHARE_STARTED, data));
        Mono<Integer> currentFix = latestLocation(ownerId)
                .map(location -> eventDispatcher.dispatch(
                        OutboundEvent.toUsers(viewers, OutboundEventType.SHARED_LOCATION_UPDATE, location.toEventData())))
                .orElseGet(() -> Mono.just(0));
        return ack.then(notifyViewers).then(currentFix).then();
    }

    public Mono<Void> stopShare(ConnectionHandle connection, LocationShareStopPayload payload) {
        Optional<LocationShare> stopped = shareRegistry.stop(payload.getShareId(), connection.getUserId());
        if (stopped.isEmpty()) {
            return Mono.error(new ProtocolException("Location share not found: " + payload.getShareId()));
        }
        LocationShare share = stopped.get();
        Map<String, Object> data = stoppedData(share, "stopped");

        Mono<Integer> ack = eventDispatcher.sendToConnection(connection,
                OutboundEvent.toConnection(connection, OutboundEventType.LOCATION_SHARE_STOPPED, data));
        Set<String> viewers = viewersOf(share);
        if (viewers.isEmpty()) {
            return ack.then();
        }
        return ack.then(eventDispatcher.dispatch(
                OutboundEvent.toUsers(viewers, OutboundEventType.LOCATION_SHARE_STOPPED, data))).then();
    }

    /**
     * Removes expired shares and tells their owners and viewers.
     *
     * @return the number of connections notified
     */
    public Mono<Integer> expireShares() {
        List<LocationShare> expired = shareRegistry.removeExpired();
        if (expired.isEmpty()) {
            return Mono.just(0);
        }
        log.debug("Expired {} location shares", expired.size());
        return Flux.fromIterable(expired)
                .flatMap(share -> {
                    Set<String> recipients = viewersOf(share);
                    recipients.add(share.getOwnerId());
                    return eventDispatcher.dispatch(OutboundEvent.toUsers(recipients,
                            OutboundEventType.LOCATION_SHARE_STOPPED, stoppedData(share, "expired")));
                })
                .reduce(0, Integer::sum);
    }

    public Optional<UserLocation> latestLocation(String userId) {
        return Optional.ofNullable(latestLocations.getIfPresent(userId));
    }

    public Geofence saveGeofence(Geofence geofence) {
        Geofence saved = geofenceStore.save(geofence);
        transitionDetector.forget(saved.getUserId(), saved.getId());
        return saved;
    }

    public List<Geofence> geofencesOf(String userId) {
        return geofenceStore.findByUser(userId);
    }

    public boolean deleteGeofence(String userId, String geofenceId) {
        transitionDetector.forget(userId, geofenceId);
        return geofenceStore.delete(userId, geofenceId);
    }

    public int activeShareCount() {
        return shareRegistry.activeShareCount();
    }

    private Set<String> viewersOf(String ownerId) {
        Set<String> viewers = new HashSet<>();
        for (LocationShare share : shareRegistry.activeSharesOf(ownerId)) {
            viewers.addAll(viewersOf(share));
        }
        return viewers;
    }

    private Set<String> viewersOf(LocationShare share) {
        Set<String> viewers = share.isPublic()
                ? roomMembershipIndex.peersOf(share.getOwnerId())
                : new HashSet<>(Set.of(share.getTargetUserId()));
        viewers.remove(share.getOwnerId());
        return viewers;
    }

    private static Map<String, Object> stoppedData(LocationShare share, String reason) {
        return OutboundEvent.fields(
                "share_id", share.getShareId(),
                "user_id", share.getOwnerId(),
                "reason", reason);
    }
}
