package com.example.chat.realtime.config;

import com.example.chat.realtime.service.auth.HmacTokenVerifier;
import com.example.chat.realtime.service.auth.TokenVerifier;
import com.example.chat.realtime.service.location.GeofenceStore;
import com.example.chat.realtime.service.location.InMemoryGeofenceStore;
import com.example.chat.realtime.service.notification.LoggingNotificationDispatcher;
import com.example.chat.realtime.service.notification.NotificationDispatcher;
import com.example.chat.realtime.service.persistence.ChatPersistence;
import com.example.chat.realtime.service.persistence.LoggingChatPersistence;
import com.example.chat.shared.config.AppProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default adapters for the services this one depends on. Declaring a bean of the same type
 * elsewhere replaces the default.
 */
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean(TokenVerifier.class)
    public TokenVerifier tokenVerifier(AppProperties appProperties, Clock clock) {
        AppProperties.Auth auth = appProperties.getAuth();
        return new HmacTokenVerifier(auth.getSecret(), clock, auth.getClockSkew());
    }

    @Bean
    @ConditionalOnMissingBean(ChatPersistence.class)
    public ChatPersistence chatPersistence() {
        return new LoggingChatPersistence();
    }

    @Bean
    @ConditionalOnMissingBean(NotificationDispatcher.class)
    public NotificationDispatcher notificationDispatcher() {
        return new LoggingNotificationDispatcher();
    }

    @Bean
    @ConditionalOnMissingBean(GeofenceStore.class)
    public GeofenceStore geofenceStore() {
        return new InMemoryGeofenceStore();
    }
}
