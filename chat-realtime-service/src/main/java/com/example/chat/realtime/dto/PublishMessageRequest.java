package com.example.chat.realtime.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * A message that has just been stored and should now reach the room.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishMessageRequest {
    @NotBlank(message = "Sender ID is required")
    private String senderId;

    @NotNull(message = "Message is required")
    private Map<String, Object> message;

    /** Users to push-notify if they are not connected. */
    private List<String> recipientIds;
}
