package com.example.chat.realtime.service.location;

import com.example.chat.shared.util.Constants.GeofenceTransition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Remembers whether each user was last seen inside or outside each of their geofences and
 * reports only the edges. The first observation inside a geofence counts as entering it; the
 * first observation outside reports nothing.
 */
@Component
public class GeofenceTransitionDetector {

    private final Map<String, Map<String, Boolean>> insideByUser = new ConcurrentHashMap<>();

    public List<GeofenceCrossing> evaluate(String userId, double latitude, double longitude, Collection<Geofence> geofences) {
        Map<String, Boolean> inside = insideByUser.computeIfAbsent(userId, key -> new ConcurrentHashMap<>());
        List<GeofenceCrossing> crossings = new ArrayList<>();

        synchronized (inside) {
            Set<String> current = geofences.stream().map(Geofence::getId).collect(Collectors.toSet());
            inside.keySet().retainAll(current);

            for (Geofence geofence : geofences) {
                boolean nowInside = geofence.contains(latitude, longitude);
                Boolean wasInside = inside.put(geofence.getId(), nowInside);
                boolean previouslyInside = wasInside != null && wasInside;

                if (nowInside && !previouslyInside) {
                    if (geofence.isTriggerOnEnter()) {
                        crossings.add(new GeofenceCrossing(geofence, GeofenceTransition.ENTER));
                    }
                } else if (!nowInside && previouslyInside && geofence.isTriggerOnExit()) {
                    crossings.add(new GeofenceCrossing(geofence, GeofenceTransition.EXIT));
                }
            }
        }
        return crossings;
    }

    public void forget(String userId, String geofenceId) {
        Map<String, Boolean> inside = insideByUser.get(userId);
        if (inside != null) {
            inside.remove(geofenceId);
        }
    }
}
