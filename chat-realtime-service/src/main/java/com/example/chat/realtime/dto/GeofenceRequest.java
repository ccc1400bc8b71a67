package com.example.chat.realtime.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeofenceRequest {
    @NotBlank(message = "Name is required")
    private String name;

    @NotNull
    @DecimalMin("-90")
    @DecimalMax("90")
    private Double centerLatitude;

    @NotNull
    @DecimalMin("-180")
    @DecimalMax("180")
    private Double centerLongitude;

    @NotNull
    @Positive
    @DecimalMax(value = "10000", message = "must be at most 10000 meters")
    private Double radiusMeters;

    @Builder.Default
    private boolean triggerOnEnter = true;

    @Builder.Default
    private boolean triggerOnExit = true;
}
