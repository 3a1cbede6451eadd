package com.transferhub.booking.model;

import com.transferhub.booking.entity.CommissionTerms;
import com.transferhub.booking.entity.CommissionType;

import java.math.BigDecimal;

/**
 * Who an invoice is addressed to, with the commission terms in force when it was generated.
 */
public record BillingParty(String id,
                           String name,
                           String email,
                           CommissionType commissionType,
                           BigDecimal commissionValue,
                           String paymentTerms) {

    public static BillingParty of(CommissionTerms terms) {
        return new BillingParty(terms.getId(), terms.getName(), terms.getEmail(),
                terms.getCommissionType(), terms.getCommissionValue(), terms.getPaymentTerms());
    }

    public static BillingParty customer(String email, String name) {
        return new BillingParty(email, name, email, null, null, null);
    }
}
