package com.transferhub.pricing.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteRequest {

    @NotBlank
    private String pickupLocation;

    @NotBlank
    private String dropoffLocation;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLng;

    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double dropoffLat;

    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double dropoffLng;

    @NotNull
    @PositiveOrZero
    private Double distanceKm;

    @Min(1)
    @Builder.Default
    private int passengers = 1;

    @Min(0)
    private int luggage;

    private boolean meetGreet;

    private boolean airportPickup;

    /** Local time at pickup; drives night and weekend surcharges when present. */
    private LocalDateTime pickupDateTime;

    @Min(0)
    private int childSeats;

    public boolean hasCoordinates() {
        return pickupLat != null && pickupLng != null && dropoffLat != null && dropoffLng != null;
    }

    public GeoPoint pickupPoint() {
        return new GeoPoint(pickupLat, pickupLng);
    }

    public GeoPoint dropoffPoint() {
        return new GeoPoint(dropoffLat, dropoffLng);
    }
}
