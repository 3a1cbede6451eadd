package com.transferhub.pricing.model;

public record GeoPoint(double lat, double lng) {
}
