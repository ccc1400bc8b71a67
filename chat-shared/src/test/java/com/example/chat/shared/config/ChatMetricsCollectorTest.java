package com.example.chat.shared.config;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChatMetricsCollectorTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MonitoringConfig.ChatMetricsCollector collector = new MonitoringConfig.ChatMetricsCollector(registry);

    @Test
    void countersAreKeptPerTagSet() {
        collector.incrementCounter("chat.dispatch.delivered", "type", "pong");
        collector.incrementCounter("chat.dispatch.delivered", "type", "pong");
        collector.incrementCounter("chat.dispatch.delivered", "type", "new_message");

        assertThat(collector.getCounterValue("chat.dispatch.delivered", "type", "pong")).isEqualTo(2);
        assertThat(collector.getCounterValue("chat.dispatch.delivered", "type", "new_message")).isEqualTo(1);
        assertThat(collector.getCounterValue("chat.dispatch.delivered", "type", "error")).isZero();
        assertThat(registry.get("chat.dispatch.delivered").tag("type", "pong").counter().count()).isEqualTo(2.0);
    }

    @Test
    void timersRecordIntoTheRegistry() {
        collector.recordTimer("chat.publish.duration", 12, "operation", "publishNewMessage");
        collector.recordTimer("chat.publish.duration", 8, "operation", "publishNewMessage");

        Timer timer = registry.get("chat.publish.duration").tag("operation", "publishNewMessage").timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(20.0);
    }
}
