package com.example.chat.realtime.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryResponse {
    private String event;
    /** Connections the event was written to. */
    private int deliveredConnections;
}
