package com.example.chat.realtime.websocket;

import com.example.chat.shared.exception.PayloadValidationException;
import com.example.chat.shared.exception.ProtocolException;
import com.example.chat.shared.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Turns a text frame into a typed, validated payload.
 * <p>
 * Frames are JSON objects of the form {@code {"type": "...", "data": {...}}}. A missing
 * {@code data} member decodes as an empty object.
 */
@Component
@RequiredArgsConstructor
public class InboundFrameDecoder {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public DecodedFrame decode(String text) {
        JsonNode root = readEnvelope(text);

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new ProtocolException("Missing message type");
        }
        String wireName = typeNode.asText();
        InboundMessageType type = InboundMessageType.fromWireName(wireName)
                .orElseThrow(() -> new ProtocolException("Unknown message type: " + wireName));

        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            data = objectMapper.createObjectNode();
        }
        if (!data.isObject()) {
            throw new PayloadValidationException(wireName, List.of("data: must be an object"));
        }

        Object payload;
        try {
            payload = objectMapper.treeToValue(data, type.getPayloadType());
        } catch (JsonMappingException e) {
            throw new PayloadValidationException(wireName, List.of(JsonUtils.fieldPath(e) + ": invalid value"));
        } catch (JsonProcessingException e) {
            throw new PayloadValidationException(wireName, List.of("data: invalid value"));
        }

        Set<ConstraintViolation<Object>> violations = validator.validate(payload);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(violation -> JsonUtils.toSnakeCase(violation.getPropertyPath().toString()) + ": " + violation.getMessage())
                    .sorted()
                    .toList();
            throw new PayloadValidationException(wireName, messages);
        }
        return new DecodedFrame(type, payload);
    }

    private JsonNode readEnvelope(String text) {
        JsonNode root;
        try {
            root = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON format", e);
        }
        if (root == null || !root.isObject()) {
            throw new ProtocolException("Invalid JSON format");
        }
        return root;
    }
}
