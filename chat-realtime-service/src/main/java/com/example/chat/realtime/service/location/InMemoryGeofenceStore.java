package com.example.chat.realtime.service.location;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryGeofenceStore implements GeofenceStore {

    private final Map<String, Map<String, Geofence>> geofencesByUser = new ConcurrentHashMap<>();

    @Override
    public Geofence save(Geofence geofence) {
        geofencesByUser.computeIfAbsent(geofence.getUserId(), key -> new ConcurrentHashMap<>())
                .put(geofence.getId(), geofence);
        return geofence;
    }

    @Override
    public List<Geofence> findByUser(String userId) {
        Map<String, Geofence> geofences = geofencesByUser.get(userId);
        if (geofences == null) {
            return List.of();
        }
        List<Geofence> result = new ArrayList<>(geofences.values());
        result.sort(Comparator.comparing(Geofence::getName, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    @Override
    public Optional<Geofence> find(String userId, String geofenceId) {
        Map<String, Geofence> geofences = geofencesByUser.get(userId);
        return geofences == null ? Optional.empty() : Optional.ofNullable(geofences.get(geofenceId));
    }

    @Override
    public boolean delete(String userId, String geofenceId) {
        Map<String, Geofence> geofences = geofencesByUser.get(userId);
        return geofences != null && geofences.remove(geofenceId) != null;
    }
}
