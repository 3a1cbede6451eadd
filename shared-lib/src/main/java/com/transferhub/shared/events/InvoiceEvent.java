package com.transferhub.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.transferhub.shared.enums.InvoiceStatus;
import com.transferhub.shared.enums.InvoiceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceEvent {

    private String invoiceId;
    private String invoiceNumber;
    private InvoiceType invoiceType;
    private InvoiceStatus status;
    private String entityId;
    private String entityName;
    private String entityEmail;
    private BigDecimal total;
    private int lineItemCount;
    private String supersedesInvoiceId;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private LocalDate dueDate;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant eventTime;
}
