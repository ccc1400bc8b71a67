package com.example.chat.realtime.config;

import com.example.chat.realtime.service.location.LocationShareRegistry;
import com.example.chat.realtime.service.room.RoomMembershipIndex;
import com.example.chat.realtime.service.session.SessionRegistry;
import com.example.chat.realtime.service.typing.TypingTracker;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RealtimeMetricsConfig {

    @Bean
    public MeterBinder realtimeStateMetrics(SessionRegistry sessionRegistry,
                                            RoomMembershipIndex roomMembershipIndex,
                                            TypingTracker typingTracker,
                                            LocationShareRegistry locationShareRegistry) {
        return registry -> {
            Gauge.builder("chat.connections.active", sessionRegistry, SessionRegistry::connectionCount)
                    .description("Open WebSocket connections")
                    .register(registry);
            Gauge.builder("chat.users.online", sessionRegistry, SessionRegistry::onlineUserCount)
                    .description("Users with at least one open connection")
                    .register(registry);
            Gauge.builder("chat.rooms.active", roomMembershipIndex, RoomMembershipIndex::roomCount)
                    .description("Rooms with at least one member")
                    .register(registry);
            Gauge.builder("chat.typing.entries", typingTracker, TypingTracker::size)
                    .register(registry);
            Gauge.builder("chat.location.shares.active", locationShareRegistry, LocationShareRegistry::activeShareCount)
                    .register(registry);
        };
    }
}
