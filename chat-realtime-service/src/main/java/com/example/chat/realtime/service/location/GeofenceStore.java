package com.example.chat.realtime.service.location;

import java.util.List;
import java.util.Optional;

public interface GeofenceStore {

    Geofence save(Geofence geofence);

    List<Geofence> findByUser(String userId);

    Optional<Geofence> find(String userId, String geofenceId);

    /**
     * @return true if the geofence existed
     */
    boolean delete(String userId, String geofenceId);
}
