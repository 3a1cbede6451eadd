package com.transferhub.booking.entity;

import com.transferhub.shared.enums.InvoiceStatus;
import com.transferhub.shared.enums.InvoiceType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "invoices",
        indexes = {
                @Index(name = "idx_invoice_number", columnList = "invoice_number", unique = true),
                @Index(name = "idx_invoice_entity", columnList = "invoice_type, entity_id"),
                @Index(name = "idx_invoice_status", columnList = "status")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(name = "invoice_number", nullable = false, length = 32)
    private String invoiceNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "invoice_type", nullable = false, length = 16)
    private InvoiceType invoiceType;

    @Column(name = "entity_id")
    private String entityId;

    @Column(name = "entity_name")
    private String entityName;

    @Column(name = "entity_email")
    private String entityEmail;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private InvoiceStatus status = InvoiceStatus.DRAFT;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "invoice_line_items", joinColumns = @JoinColumn(name = "invoice_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<InvoiceLineItem> lineItems = new ArrayList<>();

    @Column(name = "subtotal", precision = 12, scale = 2)
    private BigDecimal subtotal;

    @Enumerated(EnumType.STRING)
    @Column(name = "commission_type", length = 16)
    private CommissionType commissionType;

    @Column(name = "commission_value", precision = 10, scale = 2)
    private BigDecimal commissionValue;

    @Column(name = "commission", precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal commission = BigDecimal.ZERO;

    @Column(name = "tax_rate_percent", precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal taxRatePercent = BigDecimal.ZERO;

    @Column(name = "tax", precision = 12, scale = 2)
    private BigDecimal tax;

    @Column(name = "total", precision = 12, scale = 2)
    private BigDecimal total;

    @Column(name = "profit_total", precision = 12, scale = 2)
    private BigDecimal profitTotal;

    @Column(name = "currency", length = 3)
    @Builder.Default
    private String currency = "GBP";

    @Column(name = "payment_terms", length = 32)
    private String paymentTerms;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "notes", length = 2000)
    private String notes;

    @Column(name = "supersedes_invoice_id")
    private UUID supersedesInvoiceId;

    @Column(name = "superseded_by_invoice_id")
    private UUID supersededByInvoiceId;

    @Column(name = "amendment_reason", length = 1000)
    private String amendmentReason;

    @Column(name = "issued_at")
    private Instant issuedAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
