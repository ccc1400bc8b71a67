package com.example.chat.realtime.service.location;

import com.example.chat.shared.util.Constants.GeofenceTransition;
import lombok.Value;

@Value
public class GeofenceCrossing {
    Geofence geofence;
    GeofenceTransition transition;
}
