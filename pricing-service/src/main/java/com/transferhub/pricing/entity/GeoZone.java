package com.transferhub.pricing.entity;

import com.transferhub.pricing.model.GeoPoint;
import com.transferhub.shared.util.GeoUtil;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Circular geofence: centre plus radius in miles.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoZone {

    @Column(name = "lat", nullable = false)
    private double lat;

    @Column(name = "lng", nullable = false)
    private double lng;

    @Column(name = "radius_miles", nullable = false)
    private double radiusMiles;

    /** Boundary inclusive. */
    public boolean contains(GeoPoint point) {
        return GeoUtil.distanceMiles(lat, lng, point.lat(), point.lng()) <= radiusMiles;
    }
}
