package com.example.chat.realtime.health;

import com.example.chat.realtime.service.location.UserLocation;
import com.example.chat.realtime.service.room.RoomMembershipIndex;
import com.example.chat.realtime.service.session.SessionRegistry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports the size of the in-memory real-time state.
 */
@Component
public class RealtimeHealthIndicator implements HealthIndicator {

    private final SessionRegistry sessionRegistry;
    private final RoomMembershipIndex roomMembershipIndex;
    private final Cache<String, UserLocation> latestLocationCache;

    public RealtimeHealthIndicator(SessionRegistry sessionRegistry,
                                   RoomMembershipIndex roomMembershipIndex,
                                   Cache<String, UserLocation> latestLocationCache) {
        this.sessionRegistry = sessionRegistry;
        this.roomMembershipIndex = roomMembershipIndex;
        this.latestLocationCache = latestLocationCache;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        boolean sessionsHealthy = checkSessions(details);
        boolean cacheHealthy = checkLocationCache(details);

        Health.Builder healthBuilder = sessionsHealthy && cacheHealthy ? Health.up() : Health.down();
        return healthBuilder
                .withDetails(details)
                .build();
    }

    private boolean checkSessions(Map<String, Object> details) {
        try {
            details.put("connections", sessionRegistry.connectionCount());
            details.put("onlineUsers", sessionRegistry.onlineUserCount());
            details.put("activeRooms", roomMembershipIndex.roomCount());
            details.put("sessionStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("sessionStatus", "DOWN");
            details.put("sessionError", e.getMessage());
            return false;
        }
    }

    private boolean checkLocationCache(Map<String, Object> details) {
        try {
            CacheStats stats = latestLocationCache.stats();
            Map<String, Object> cacheStats = new HashMap<>();
            cacheStats.put("size", latestLocationCache.estimatedSize());
            cacheStats.put("hitRate", stats.hitRate());
            cacheStats.put("evictions", stats.evictionCount());
            details.put("locationCache", cacheStats);
            details.put("cacheStatus", "UP");
            return true;
        } catch (Exception e) {
            details.put("cacheStatus", "DOWN");
            details.put("cacheError", e.getMessage());
            return false;
        }
    }
}
