package com.transferhub.shared.enums;

public enum InvoiceType {
    CUSTOMER,
    FLEET,
    DRIVER,
    CUSTOM;

    /**
     * Payout invoices are computed from driver prices and carry commission.
     */
    public boolean isPayout() {
        return this == FLEET || this == DRIVER;
    }
}
