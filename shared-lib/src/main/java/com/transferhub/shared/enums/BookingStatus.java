package com.transferhub.shared.enums;

public enum BookingStatus {
    PENDING,
    CONFIRMED,
    ASSIGNED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED
}
