package com.example.chat.realtime.dto.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Data of {@code ping}. The timestamp is required and echoed back untouched, whatever its JSON type.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PingPayload {
    @NotNull
    private JsonNode timestamp;
}
