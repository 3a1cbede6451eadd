package com.transferhub.shared.enums;

public enum InvoiceStatus {
    DRAFT,
    APPROVED,
    ISSUED,
    PAID,
    SUPERSEDED
}
