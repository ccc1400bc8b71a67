package com.example.chat.realtime.service.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class OutboundEventFactory {

    private final ObjectMapper objectMapper;

    /**
     * Serializes an event to its wire frame {@code {"type": ..., "data": {...}}}.
     *
     * @return the frame, or null if the data could not be serialized
     */
    public String serialize(OutboundEvent event) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", event.getType().wireName());
        frame.put("data", event.getData());
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            log.error("Error serializing payload for event type {}: {}", event.getType(), e.getMessage());
            return null;
        }
    }
}
