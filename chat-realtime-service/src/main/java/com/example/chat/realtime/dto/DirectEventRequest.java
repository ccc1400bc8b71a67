package com.example.chat.realtime.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DirectEventRequest {
    /** Wire name of the event, e.g. {@code notification}. */
    @NotBlank(message = "Event type is required")
    private String type;

    @Builder.Default
    private Map<String, Object> data = Map.of();
}
