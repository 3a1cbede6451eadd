package com.transferhub.pricing.model;

import com.transferhub.pricing.entity.VehicleClass;

/**
 * Everything one strategy needs to price one vehicle class for one request.
 */
public record PricingContext(QuoteRequest request,
                             VehicleClass vehicleClass,
                             PricingFlags flags,
                             PricingReferenceData reference) {

    public String vehicleClassId() {
        return vehicleClass.getId();
    }

    public double distanceKm() {
        return request.getDistanceKm() != null ? request.getDistanceKm() : 0.0;
    }
}
