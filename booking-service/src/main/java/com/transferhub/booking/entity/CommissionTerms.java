package com.transferhub.booking.entity;

import java.math.BigDecimal;

/**
 * Billing details shared by the payee entities.
 */
public interface CommissionTerms {

    String getId();

    String getName();

    String getEmail();

    CommissionType getCommissionType();

    BigDecimal getCommissionValue();

    String getPaymentTerms();
}
