package com.example.chat.realtime.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeStatsResponse {
    private int connections;
    private int onlineUsers;
    private int activeRooms;
    private int typingEntries;
    private int activeLocationShares;
}
