package com.transferhub.booking.model;

import com.transferhub.shared.enums.InvoiceType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateInvoiceRequest {

    @NotNull
    private InvoiceType invoiceType;

    /** Fleet or driver id; the customer's email for customer invoices. */
    @NotBlank
    private String entityId;

    @NotNull
    private List<UUID> bookingIds;

    @PositiveOrZero
    @DecimalMax("100")
    @Builder.Default
    private BigDecimal taxRatePercent = BigDecimal.ZERO;

    /** Overrides the payee's own terms, e.g. "Net 30". */
    private String paymentTerms;

    private String notes;
}
