package com.example.chat.realtime.support;

import com.example.chat.realtime.service.session.ConnectionChannel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;

import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory connection that records every frame written to it. It can also be told to fail
 * every write, or to never complete one.
 */
public class RecordingChannel implements ConnectionChannel {

    public enum Mode { HEALTHY, FAILING, HANGING }

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger closeCount = new AtomicInteger();
    private volatile Mode mode;
    private volatile boolean open = true;
    private volatile String closeReason;

    public RecordingChannel() {
        this(Mode.HEALTHY);
    }

    public RecordingChannel(Mode mode) {
        this.mode = mode;
    }

    @Override
    public Mono<Void> send(String frame) {
        switch (mode) {
            case FAILING:
                return Mono.error(new IllegalStateException("broken pipe"));
            case HANGING:
                return Mono.never();
            default:
                frames.add(frame);
                return Mono.empty();
        }
    }

    @Override
    public void close(String reason) {
        closeCount.incrementAndGet();
        open = false;
        closeReason = reason;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public List<String> frames() {
        return List.copyOf(frames);
    }

    public List<JsonNode> events() {
        return frames.stream().map(RecordingChannel::parse).toList();
    }

    public List<JsonNode> eventsOfType(String type) {
        return events().stream().filter(event -> type.equals(event.path("type").asText())).toList();
    }

    public JsonNode lastEvent() {
        List<JsonNode> events = events();
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public void clear() {
        frames.clear();
    }

    public int closeCount() {
        return closeCount.get();
    }

    public String closeReason() {
        return closeReason;
    }

    private static JsonNode parse(String frame) {
        try {
            return MAPPER.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
