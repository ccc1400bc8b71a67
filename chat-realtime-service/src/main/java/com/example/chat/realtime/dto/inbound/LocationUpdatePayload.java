package com.example.chat.realtime.dto.inbound;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LocationUpdatePayload {
    @NotNull
    @DecimalMin("-90")
    @DecimalMax("90")
    private Double latitude;
    @NotNull
    @DecimalMin("-180")
    @DecimalMax("180")
    private Double longitude;
    /** Meters. */
    @PositiveOrZero
    private Double accuracy;
    private Double altitude;
    /** Meters per second. */
    @PositiveOrZero
    private Double speed;
    /** Degrees clockwise from north. */
    @DecimalMin("0")
    @DecimalMax(value = "360", inclusive = false)
    private Double heading;
}
