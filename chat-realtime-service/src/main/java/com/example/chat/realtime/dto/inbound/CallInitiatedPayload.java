package com.example.chat.realtime.dto.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CallInitiatedPayload {
    @NotBlank
    private String callId;
    @NotBlank
    private String calleeId;
    /** audio or video; video when absent. */
    private String callType;
    @NotBlank
    private String channelName;
}
