package com.example.chat.realtime.service.location;

import com.example.chat.shared.util.GeoUtils;
import lombok.Builder;
import lombok.Value;

/**
 * A circular area that raises {@code geofence_event}s for its owner when they cross its edge.
 */
@Value
@Builder(toBuilder = true)
public class Geofence {
    String id;
    String userId;
    String name;
    double centerLatitude;
    double centerLongitude;
    double radiusMeters;
    boolean triggerOnEnter;
    boolean triggerOnExit;

    public boolean contains(double latitude, double longitude) {
        return GeoUtils.distanceMeters(centerLatitude, centerLongitude, latitude, longitude) <= radiusMeters;
    }
}
