package com.transferhub.pricing.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteResponse {

    /** Ascending by price. */
    private List<Quote> quotes;
    private double distanceKm;
    private int durationMinutes;
    private String pickupLocation;
    private String dropoffLocation;
    private boolean fixedRoute;
    private String fixedRouteName;
}
