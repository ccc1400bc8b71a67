package com.example.chat.realtime.dto;

import com.example.chat.realtime.service.location.Geofence;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeofenceResponse {
    private String id;
    private String userId;
    private String name;
    private double centerLatitude;
    private double centerLongitude;
    private double radiusMeters;
    private boolean triggerOnEnter;
    private boolean triggerOnExit;

    public static GeofenceResponse from(Geofence geofence) {
        return GeofenceResponse.builder()
                .id(geofence.getId())
                .userId(geofence.getUserId())
                .name(geofence.getName())
                .centerLatitude(geofence.getCenterLatitude())
                .centerLongitude(geofence.getCenterLongitude())
                .radiusMeters(geofence.getRadiusMeters())
                .triggerOnEnter(geofence.isTriggerOnEnter())
                .triggerOnExit(geofence.isTriggerOnExit())
                .build();
    }
}
