package com.example.chat.realtime;

import com.example.chat.shared.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Real-time chat service.
 *
 * Tracks live WebSocket connections per user, which chat rooms each user is viewing,
 * typing indicators and presence, and fans events out to the connected clients that
 * should see them. All of that state is in memory and scoped to this process.
 */
@SpringBootApplication(scanBasePackages = "com.example.chat")
@EnableConfigurationProperties({
    AppProperties.class
})
public class ChatRealtimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatRealtimeApplication.class, args);
    }
}
