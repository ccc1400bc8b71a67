package com.example.chat.realtime.controller;

import com.example.chat.realtime.dto.GeofenceRequest;
import com.example.chat.realtime.dto.GeofenceResponse;
import com.example.chat.realtime.service.location.Geofence;
import com.example.chat.realtime.service.location.LocationTrackingService;
import com.example.chat.shared.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/realtime/users/{userId}/geofences")
@RequiredArgsConstructor
@Slf4j
public class GeofenceController {

    private final LocationTrackingService locationTrackingService;

    @GetMapping
    public ResponseEntity<List<GeofenceResponse>> getGeofences(@PathVariable String userId) {
        List<GeofenceResponse> geofences = locationTrackingService.geofencesOf(userId).stream()
                .map(GeofenceResponse::from)
                .toList();
        return ResponseEntity.ok(geofences);
    }

    @PostMapping
    public ResponseEntity<GeofenceResponse> createGeofence(@PathVariable String userId,
                                                           @Valid @RequestBody GeofenceRequest request) {
        Geofence geofence = Geofence.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .name(request.getName())
                .centerLatitude(request.getCenterLatitude())
                .centerLongitude(request.getCenterLongitude())
                .radiusMeters(request.getRadiusMeters())
                .triggerOnEnter(request.isTriggerOnEnter())
                .triggerOnExit(request.isTriggerOnExit())
                .build();
        Geofence saved = locationTrackingService.saveGeofence(geofence);
        log.info("Created geofence {} '{}' for user {}", saved.getId(), saved.getName(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(GeofenceResponse.from(saved));
    }

    @DeleteMapping("/{geofenceId}")
    public ResponseEntity<Void> deleteGeofence(@PathVariable String userId, @PathVariable String geofenceId) {
        if (!locationTrackingService.deleteGeofence(userId, geofenceId)) {
            throw new ResourceNotFoundException("Geofence not found: " + geofenceId);
        }
        log.info("Deleted geofence {} of user {}", geofenceId, userId);
        return ResponseEntity.noContent().build();
    }
}
