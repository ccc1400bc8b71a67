package com.example.chat.realtime.config;

import com.example.chat.realtime.service.location.UserLocation;
import com.example.chat.shared.config.AppProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;

@Configuration
public class CaffeineConfig {

    @Bean
    public Cache<String, UserLocation> latestLocationCache(AppProperties appProperties) {
        AppProperties.Location location = appProperties.getLocation();
        return Caffeine.newBuilder()
                .maximumSize(location.getLatestMaxSize())
                .expireAfterWrite(location.getLatestTtl())
                .recordStats()
                .build();
    }

    @Bean
    public Cache<String, Instant> lastSeenCache(AppProperties appProperties) {
        AppProperties.Presence presence = appProperties.getPresence();
        return Caffeine.newBuilder()
                .maximumSize(presence.getLastSeenMaxSize())
                .expireAfterWrite(presence.getLastSeenTtl())
                .build();
    }
}
