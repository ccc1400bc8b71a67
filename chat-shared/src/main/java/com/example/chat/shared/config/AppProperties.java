package com.example.chat.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "chat")
public class AppProperties {

    @Valid
    private final WebSocket websocket = new WebSocket();
    @Valid
    private final Dispatch dispatch = new Dispatch();
    @Valid
    private final Typing typing = new Typing();
    @Valid
    private final Presence presence = new Presence();
    @Valid
    private final Location location = new Location();
    @Valid
    private final Auth auth = new Auth();

    @Data
    public static class WebSocket {
        @NotBlank
        private String path = "/ws";
        /** Frames queued per connection before it is considered too slow and evicted. */
        @Positive
        private int outboundBufferSize = 256;
    }

    @Data
    public static class Dispatch {
        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Typing {
        @NotNull
        private Duration ttl = Duration.ofSeconds(10);
        @NotNull
        private Duration sweepInterval = Duration.ofSeconds(3);
    }

    @Data
    public static class Presence {
        /** How long an offline user's last-seen time is remembered. */
        @NotNull
        private Duration lastSeenTtl = Duration.ofDays(30);
        @Positive
        private int lastSeenMaxSize = 100000;
    }

    @Data
    public static class Location {
        @NotNull
        private Duration latestTtl = Duration.ofHours(1);
        @Positive
        private int latestMaxSize = 100000;
        @NotNull
        private Duration shareSweepInterval = Duration.ofSeconds(30);
        @Positive
        private int maxShareDurationMinutes = 1440;
    }

    @Data
    public static class Auth {
        /** HS256 signing secret; at least 32 bytes. */
        @NotBlank
        @Size(min = 32)
        private String secret;
        @NotNull
        private Duration clockSkew = Duration.ofSeconds(30);
    }
}
