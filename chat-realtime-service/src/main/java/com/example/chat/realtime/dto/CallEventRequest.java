package com.example.chat.realtime.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallEventRequest {
    /** Wire name of a call event, e.g. {@code call_quality_update}. */
    @NotBlank(message = "Event type is required")
    private String type;

    @Builder.Default
    private Map<String, Object> data = Map.of();

    @NotEmpty(message = "Participants are required")
    private List<String> participants;
}
