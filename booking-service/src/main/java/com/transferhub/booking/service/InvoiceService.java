package com.transferhub.booking.service;

import com.transferhub.booking.entity.Booking;
import com.transferhub.booking.entity.Invoice;
import com.transferhub.booking.exception.InvoiceException;
import com.transferhub.booking.metrics.BillingMetrics;
import com.transferhub.booking.model.AmendInvoiceRequest;
import com.transferhub.booking.model.BillingParty;
import com.transferhub.booking.model.CustomInvoiceRequest;
import com.transferhub.booking.model.GenerateInvoiceRequest;
import com.transferhub.booking.repository.BookingRepository;
import com.transferhub.booking.repository.DriverRepository;
import com.transferhub.booking.repository.FleetRepository;
import com.transferhub.booking.repository.InvoiceRepository;
import com.transferhub.shared.enums.BookingStatus;
import com.transferhub.shared.enums.InvoiceStatus;
import com.transferhub.shared.enums.InvoiceType;
import com.transferhub.shared.events.InvoiceEvent;
import com.transferhub.shared.util.KafkaTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Invoice lifecycle: generate, approve, issue, pay, amend, custom.
 *
 * Status moves DRAFT -> APPROVED -> ISSUED -> PAID (DRAFT may be issued directly).
 * Amending creates a new DRAFT invoice and marks the original SUPERSEDED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceService {

    private final InvoiceRepository invoiceRepository;
    private final BookingRepository bookingRepository;
    private final FleetRepository fleetRepository;
    private final DriverRepository driverRepository;
    private final InvoiceCalculator calculator;
    private final InvoiceNumberGenerator numberGenerator;
    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final BillingMetrics metrics;
    private final Clock clock;

    @Transactional
    public Invoice generate(GenerateInvoiceRequest req) {
        InvoiceType type = req.getInvoiceType();
        if (type == InvoiceType.CUSTOM) {
            throw new InvoiceException("INVALID_INVOICE_TYPE", "Use the custom invoice endpoint for CUSTOM invoices");
        }
        if (req.getBookingIds() == null || req.getBookingIds().isEmpty()) {
            throw new InvoiceException("EMPTY_INVOICE", "An invoice needs at least one booking");
        }

        List<Booking> bookings = loadBookings(req.getBookingIds());
        BillingParty party = resolveParty(type, req.getEntityId(), bookings);

        for (Booking booking : bookings) {
            if (booking.getStatus() != BookingStatus.COMPLETED) {
                throw new InvoiceException("BOOKING_NOT_COMPLETED",
                        "Booking " + booking.getBookingRef() + " is " + booking.getStatus());
            }
            if (!belongsTo(type, req.getEntityId(), booking)) {
                throw new InvoiceException("BOOKING_ENTITY_MISMATCH",
                        "Booking " + booking.getBookingRef() + " does not belong to " + type + " " + req.getEntityId());
            }
            if (booking.invoiceIdFor(type) != null) {
                throw new InvoiceException("ALREADY_INVOICED",
                        "Booking " + booking.getBookingRef() + " is already on " + type + " invoice " + booking.invoiceIdFor(type));
            }
        }

        Invoice invoice = calculator.generate(type, party, bookings, req.getTaxRatePercent());
        String terms = firstNonBlank(req.getPaymentTerms(), party.paymentTerms(), PaymentTerms.DEFAULT_TERMS);
        invoice.setPaymentTerms(terms);
        invoice.setDueDate(today().plusDays(PaymentTerms.dueInDays(terms)));
        invoice.setNotes(req.getNotes());
        invoice.setInvoiceNumber(numberGenerator.next(YearMonth.now(clock)));

        invoice = invoiceRepository.save(invoice);
        for (Booking booking : bookings) {
            booking.stampInvoice(type, invoice.getId());
        }
        bookingRepository.saveAll(bookings);

        metrics.recordInvoiceGenerated(type);
        publish(KafkaTopics.INVOICE_GENERATED, invoice);
        log.info("Invoice {} generated: type={} entity={} bookings={} subtotal={} commission={} tax={} total={}",
                invoice.getInvoiceNumber(), type, invoice.getEntityId(), bookings.size(),
                invoice.getSubtotal(), invoice.getCommission(), invoice.getTax(), invoice.getTotal());
        return invoice;
    }

    @Transactional
    public Invoice approve(UUID invoiceId) {
        Invoice invoice = getInvoice(invoiceId);
        requireStatus(invoice, "approve", InvoiceStatus.DRAFT);

        invoice.setStatus(InvoiceStatus.APPROVED);
        log.info("Invoice {} approved", invoice.getInvoiceNumber());
        return invoiceRepository.save(invoice);
    }

    @Transactional
    public Invoice issue(UUID invoiceId) {
        Invoice invoice = getInvoice(invoiceId);
        requireStatus(invoice, "issue", InvoiceStatus.DRAFT, InvoiceStatus.APPROVED);

        invoice.setStatus(InvoiceStatus.ISSUED);
        invoice.setIssuedAt(Instant.now(clock));
        invoice = invoiceRepository.save(invoice);

        publish(KafkaTopics.INVOICE_ISSUED, invoice);
        log.info("Invoice {} issued to {} (due {})", invoice.getInvoiceNumber(), invoice.getEntityEmail(), invoice.getDueDate());
        return invoice;
    }

    @Transactional
    public Invoice markPaid(UUID invoiceId) {
        Invoice invoice = getInvoice(invoiceId);
        requireStatus(invoice, "mark paid", InvoiceStatus.ISSUED);

        invoice.setStatus(InvoiceStatus.PAID);
        invoice.setPaidAt(Instant.now(clock));
        invoice = invoiceRepository.save(invoice);

        publish(KafkaTopics.INVOICE_PAID, invoice);
        log.info("Invoice {} paid", invoice.getInvoiceNumber());
        return invoice;
    }

    @Transactional
    public Invoice amend(UUID invoiceId, AmendInvoiceRequest req) {
        Invoice original = getInvoice(invoiceId);
        requireStatus(original, "amend", InvoiceStatus.DRAFT, InvoiceStatus.APPROVED, InvoiceStatus.ISSUED);

        Invoice amended = calculator.amend(original, req.getLineItems(), req.getTaxRatePercent());
        amended.setAmendmentReason(req.getReason());
        amended.setNotes(req.getNotes() != null ? req.getNotes() : original.getNotes());
        amended.setDueDate(today().plusDays(PaymentTerms.dueInDays(amended.getPaymentTerms())));
        amended.setInvoiceNumber(numberGenerator.next(YearMonth.now(clock)));
        amended = invoiceRepository.save(amended);

        original.setStatus(InvoiceStatus.SUPERSEDED);
        original.setSupersededByInvoiceId(amended.getId());
        invoiceRepository.save(original);

        if (original.getInvoiceType() != InvoiceType.CUSTOM) {
            List<Booking> linked = bookingsOn(original);
            for (Booking booking : linked) {
                booking.stampInvoice(original.getInvoiceType(), amended.getId());
            }
            bookingRepository.saveAll(linked);
        }

        publish(KafkaTopics.INVOICE_AMENDED, amended);
        log.info("Invoice {} amended by {}: reason='{}' total {} -> {}",
                original.getInvoiceNumber(), amended.getInvoiceNumber(), req.getReason(),
                original.getTotal(), amended.getTotal());
        return amended;
    }

    @Transactional
    public Invoice createCustom(CustomInvoiceRequest req) {
        BillingParty billTo = BillingParty.customer(req.getBillToEmail(), req.getBillToName());
        Invoice invoice = calculator.custom(billTo, req.getLineItems(), req.getTaxRatePercent());

        int dueInDays = req.getDueInDays() != null ? req.getDueInDays() : PaymentTerms.DEFAULT_DAYS;
        invoice.setPaymentTerms("Net " + dueInDays);
        invoice.setDueDate(today().plusDays(dueInDays));
        invoice.setNotes(req.getNotes());
        invoice.setInvoiceNumber(numberGenerator.next(YearMonth.now(clock)));
        invoice = invoiceRepository.save(invoice);

        metrics.recordInvoiceGenerated(InvoiceType.CUSTOM);
        publish(KafkaTopics.INVOICE_GENERATED, invoice);
        log.info("Custom invoice {} created for '{}': total={}", invoice.getInvoiceNumber(), req.getBillToName(), invoice.getTotal());
        return invoice;
    }

    @Transactional(readOnly = true)
    public Invoice getInvoice(UUID invoiceId) {
        return invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new InvoiceException("INVOICE_NOT_FOUND", "Invoice " + invoiceId + " not found"));
    }

    @Transactional(readOnly = true)
    public List<Invoice> findForEntity(InvoiceType type, String entityId) {
        return invoiceRepository.findByInvoiceTypeAndEntityIdOrderByCreatedAtDesc(type, entityId);
    }

    /**
     * Completed bookings not yet on an invoice of {@code type}, optionally for one fleet,
     * driver or customer email.
     */
    @Transactional(readOnly = true)
    public List<Booking> findUninvoiced(InvoiceType type, String entityId) {
        List<Booking> candidates = switch (type) {
            case CUSTOMER -> bookingRepository.findByStatusAndCustomerInvoiceIdIsNullOrderByPickupDateAsc(BookingStatus.COMPLETED);
            case FLEET -> bookingRepository.findByStatusAndFleetInvoiceIdIsNullOrderByPickupDateAsc(BookingStatus.COMPLETED);
            case DRIVER -> bookingRepository.findByStatusAndDriverInvoiceIdIsNullOrderByPickupDateAsc(BookingStatus.COMPLETED);
            case CUSTOM -> throw new InvoiceException("INVALID_INVOICE_TYPE", "Custom invoices are not built from bookings");
        };
        if (entityId == null || entityId.isBlank()) {
            return candidates;
        }
        return candidates.stream()
                .filter(b -> belongsTo(type, entityId, b))
                .toList();
    }

    private List<Booking> loadBookings(List<UUID> bookingIds) {
        Set<UUID> requested = new LinkedHashSet<>(bookingIds);
        Map<UUID, Booking> found = bookingRepository.findAllById(requested).stream()
                .collect(Collectors.toMap(Booking::getId, Function.identity()));

        Set<UUID> missing = new HashSet<>(requested);
        missing.removeAll(found.keySet());
        if (!missing.isEmpty()) {
            throw new InvoiceException("BOOKING_NOT_FOUND", "Bookings not found: " + missing);
        }

        List<Booking> ordered = new ArrayList<>(requested.size());
        for (UUID id : requested) {
            ordered.add(found.get(id));
        }
        return ordered;
    }

    /**
     * Bookings whose invoice id for the invoice's type points at it. Replacement line items
     * carry no booking ids, so the bookings themselves are the source of truth.
     */
    private List<Booking> bookingsOn(Invoice invoice) {
        return switch (invoice.getInvoiceType()) {
            case CUSTOMER -> bookingRepository.findByCustomerInvoiceId(invoice.getId());
            case FLEET -> bookingRepository.findByFleetInvoiceId(invoice.getId());
            case DRIVER -> bookingRepository.findByDriverInvoiceId(invoice.getId());
            case CUSTOM -> List.of();
        };
    }

    private BillingParty resolveParty(InvoiceType type, String entityId, List<Booking> bookings) {
        return switch (type) {
            case FLEET -> fleetRepository.findById(entityId)
                    .map(BillingParty::of)
                    .orElseThrow(() -> new InvoiceException("ENTITY_NOT_FOUND", "Fleet " + entityId + " not found"));
            case DRIVER -> driverRepository.findById(entityId)
                    .map(BillingParty::of)
                    .orElseThrow(() -> new InvoiceException("ENTITY_NOT_FOUND", "Driver " + entityId + " not found"));
            case CUSTOMER -> BillingParty.customer(entityId, bookings.get(0).getCustomerName());
            case CUSTOM -> throw new InvoiceException("INVALID_INVOICE_TYPE", "Custom invoices have no booking party");
        };
    }

    private static boolean belongsTo(InvoiceType type, String entityId, Booking booking) {
        return switch (type) {
            case FLEET -> entityId.equals(booking.getFleetId());
            case DRIVER -> entityId.equals(booking.getDriverId());
            case CUSTOMER -> entityId.equalsIgnoreCase(booking.getCustomerEmail());
            case CUSTOM -> false;
        };
    }

    private static void requireStatus(Invoice invoice, String action, InvoiceStatus... allowed) {
        for (InvoiceStatus status : allowed) {
            if (invoice.getStatus() == status) {
                return;
            }
        }
        throw new InvoiceException("INVALID_STATUS_TRANSITION",
                "Cannot " + action + " invoice " + invoice.getInvoiceNumber() + " in status " + invoice.getStatus());
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private void publish(String topic, Invoice invoice) {
        kafkaTemplate.send(topic, invoice.getId().toString(), InvoiceEvent.builder()
                .invoiceId(invoice.getId().toString())
                .invoiceNumber(invoice.getInvoiceNumber())
                .invoiceType(invoice.getInvoiceType())
                .status(invoice.getStatus())
                .entityId(invoice.getEntityId())
                .entityName(invoice.getEntityName())
                .entityEmail(invoice.getEntityEmail())
                .total(invoice.getTotal())
                .lineItemCount(invoice.getLineItems().size())
                .supersedesInvoiceId(invoice.getSupersedesInvoiceId() != null ? invoice.getSupersedesInvoiceId().toString() : null)
                .dueDate(invoice.getDueDate())
                .eventTime(Instant.now(clock))
                .build());
    }
}
