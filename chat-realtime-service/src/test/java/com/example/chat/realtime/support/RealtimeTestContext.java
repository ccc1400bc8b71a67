package com.example.chat.realtime.support;

import com.example.chat.realtime.service.call.CallSignalingService;
import com.example.chat.realtime.service.dispatch.EventDispatcher;
import com.example.chat.realtime.service.dispatch.OutboundEventFactory;
import com.example.chat.realtime.service.location.GeofenceTransitionDetector;
import com.example.chat.realtime.service.location.InMemoryGeofenceStore;
import com.example.chat.realtime.service.location.LocationShareRegistry;
import com.example.chat.realtime.service.location.LocationTrackingService;
import com.example.chat.realtime.service.location.UserLocation;
import com.example.chat.realtime.service.persistence.ChatPersistence;
import com.example.chat.realtime.service.presence.PresenceService;
import com.example.chat.realtime.service.room.RoomMembershipIndex;
import com.example.chat.realtime.service.session.ConnectionHandle;
import com.example.chat.realtime.service.session.ConnectionLifecycleManager;
import com.example.chat.realtime.service.session.PresenceChangedEvent;
import com.example.chat.realtime.service.session.SessionRegistry;
import com.example.chat.realtime.service.typing.TypingIndicatorService;
import com.example.chat.realtime.service.typing.TypingTracker;
import com.example.chat.realtime.websocket.InboundFrameDecoder;
import com.example.chat.realtime.websocket.InboundMessageRouter;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig.ChatMetricsCollector;
import com.example.chat.shared.util.Constants.MessageStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The real-time object graph wired by hand, with fake connections and a controllable clock.
 */
public class RealtimeTestContext {

    public static final Instant START = Instant.parse("2024-03-01T12:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final AppProperties properties = new AppProperties();
    public final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    public final ChatMetricsCollector metrics = new ChatMetricsCollector(new SimpleMeterRegistry());
    public final List<String> readReceipts = new CopyOnWriteArrayList<>();
    /** When set, every persistence call fails with it. */
    public volatile RuntimeException persistenceFailure;

    public final SessionRegistry sessionRegistry;
    public final RoomMembershipIndex roomIndex;
    public final ConnectionLifecycleManager lifecycleManager;
    public final EventDispatcher dispatcher;
    public final TypingTracker typingTracker;
    public final TypingIndicatorService typingService;
    public final PresenceService presenceService;
    public final CallSignalingService callService;
    public final LocationShareRegistry shareRegistry;
    public final InMemoryGeofenceStore geofenceStore;
    public final LocationTrackingService locationService;
    public final InboundMessageRouter router;

    private final List<PresenceChangedEvent> presenceEvents = new CopyOnWriteArrayList<>();
    private PresenceService presenceListener;

    public RealtimeTestContext() {
        this(Duration.ofMillis(200));
    }

    public RealtimeTestContext(Duration writeTimeout) {
        properties.getDispatch().setWriteTimeout(writeTimeout);
        properties.getAuth().setSecret("unused");

        this.sessionRegistry = new SessionRegistry(clock, Caffeine.newBuilder().build());
        this.roomIndex = new RoomMembershipIndex();
        this.lifecycleManager = new ConnectionLifecycleManager(sessionRegistry, event -> {
            if (event instanceof PresenceChangedEvent presenceChanged) {
                presenceEvents.add(presenceChanged);
                if (presenceListener != null) {
                    presenceListener.onPresenceChanged(presenceChanged);
                }
            }
        });
        this.dispatcher = new EventDispatcher(sessionRegistry, roomIndex, lifecycleManager,
                new OutboundEventFactory(objectMapper), metrics, properties);
        this.typingTracker = new TypingTracker(clock, properties);
        this.typingService = new TypingIndicatorService(typingTracker, dispatcher);
        this.presenceService = new PresenceService(sessionRegistry, roomIndex, dispatcher, typingService);
        this.presenceListener = presenceService;
        this.callService = new CallSignalingService(dispatcher);
        this.shareRegistry = new LocationShareRegistry(clock);
        this.geofenceStore = new InMemoryGeofenceStore();
        this.locationService = new LocationTrackingService(
                Caffeine.newBuilder().<String, UserLocation>build(),
                shareRegistry, geofenceStore, new GeofenceTransitionDetector(),
                roomIndex, dispatcher, clock, properties);

        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        ChatPersistence persistence = (messageId, chatId, userId, status) -> persistenceFailure != null
                ? Mono.error(persistenceFailure)
                : Mono.fromRunnable(() -> readReceipts.add(messageId + ":" + userId + ":" + status));
        this.router = new InboundMessageRouter(new InboundFrameDecoder(objectMapper, validator), dispatcher,
                roomIndex, typingService, persistence, callService, locationService, clock);
    }

    public TestConnection connect(String userId) {
        return connect(userId, new RecordingChannel());
    }

    public TestConnection connect(String userId, RecordingChannel channel) {
        ConnectionHandle handle = lifecycleManager.open(userId, channel);
        return new TestConnection(handle, channel);
    }

    public void disconnect(TestConnection connection) {
        lifecycleManager.close(connection.handle(), "test disconnect");
    }

    /**
     * Feeds one text frame through the router as if the connection had sent it.
     */
    public void send(TestConnection connection, String frame) {
        router.route(connection.handle(), frame).block(Duration.ofSeconds(5));
    }

    public void joinRoom(String roomId, TestConnection... connections) {
        for (TestConnection connection : connections) {
            send(connection, "{\"type\":\"join_chat\",\"data\":{\"chat_id\":\"" + roomId + "\"}}");
        }
    }

    public List<PresenceChangedEvent> presenceEvents() {
        return List.copyOf(presenceEvents);
    }

    public static String readReceipt(String messageId, String userId) {
        return messageId + ":" + userId + ":" + MessageStatus.READ;
    }
}
