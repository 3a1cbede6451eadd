package com.transferhub.booking.entity;

public enum CommissionType {
    /** commissionValue is a percentage of the payout subtotal. */
    PERCENTAGE,
    /** commissionValue is charged once per booking. */
    FLAT
}
