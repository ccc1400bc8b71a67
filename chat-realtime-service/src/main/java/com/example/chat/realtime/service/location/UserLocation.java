package com.example.chat.realtime.service.location;

import com.example.chat.realtime.service.dispatch.OutboundEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class UserLocation {
    String userId;
    double latitude;
    double longitude;
    Double accuracy;
    Double altitude;
    Double speed;
    Double heading;
    Instant timestamp;

    public Map<String, Object> toEventData() {
        return OutboundEvent.fields(
                "user_id", userId,
                "latitude", latitude,
                "longitude", longitude,
                "accuracy", accuracy,
                "altitude", altitude,
                "speed", speed,
                "heading", heading,
                "timestamp", timestamp.toString());
    }
}
