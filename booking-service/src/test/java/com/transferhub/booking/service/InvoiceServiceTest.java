package com.transferhub.booking.service;

import com.transferhub.booking.entity.Booking;
import com.transferhub.booking.entity.CommissionType;
import com.transferhub.booking.entity.Fleet;
import com.transferhub.booking.entity.Invoice;
import com.transferhub.booking.exception.InvoiceException;
import com.transferhub.booking.metrics.BillingMetrics;
import com.transferhub.booking.model.AmendInvoiceRequest;
import com.transferhub.booking.model.BillingParty;
import com.transferhub.booking.model.CustomInvoiceRequest;
import com.transferhub.booking.model.GenerateInvoiceRequest;
import com.transferhub.booking.model.LineItemRequest;
import com.transferhub.booking.repository.BookingRepository;
import com.transferhub.booking.repository.DriverRepository;
import com.transferhub.booking.repository.FleetRepository;
import com.transferhub.booking.repository.InvoiceRepository;
import com.transferhub.shared.enums.BookingStatus;
import com.transferhub.shared.enums.InvoiceStatus;
import com.transferhub.shared.enums.InvoiceType;
import com.transferhub.shared.events.InvoiceEvent;
import com.transferhub.shared.util.KafkaTopics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Clock fixed at 2024-05-10 UTC; fleet "fleet-1" takes 15% commission on Net 30 terms.
 */
@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

    @Mock private InvoiceRepository invoiceRepository;
    @Mock private BookingRepository bookingRepository;
    @Mock private FleetRepository fleetRepository;
    @Mock private DriverRepository driverRepository;
    @Mock private InvoiceNumberGenerator numberGenerator;
    @Mock private KafkaTemplate<String, Object> kafkaTemplate;
    @Mock private BillingMetrics metrics;

    private InvoiceService service;
    private Fleet fleet;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-05-10T09:00:00Z"), ZoneOffset.UTC);
        service = new InvoiceService(invoiceRepository, bookingRepository, fleetRepository, driverRepository,
                new InvoiceCalculator(), numberGenerator, kafkaTemplate, metrics, clock);
        fleet = Fleet.builder().id("fleet-1").name("North Cars").email("ops@north.example")
                .commissionType(CommissionType.PERCENTAGE).commissionValue(new BigDecimal("15"))
                .paymentTerms("Net 30").build();
    }

    private static Booking completed(String customerPrice, String driverPrice) {
        Booking booking = Booking.builder()
                .id(UUID.randomUUID())
                .bookingRef("TH" + UUID.randomUUID().toString().substring(0, 6).toUpperCase())
                .customerName("Ada").customerEmail("ada@example.com")
                .pickupLocation("Heathrow T5").dropoffLocation("Soho")
                .pickupDate(LocalDate.of(2024, 5, 2))
                .status(BookingStatus.COMPLETED)
                .fleetId("fleet-1")
                .build();
        BigDecimal c = new BigDecimal(customerPrice);
        BigDecimal d = new BigDecimal(driverPrice);
        booking.applyPricing(c, d, List.of(), new DualPriceAssigner());
        return booking;
    }

    private void saveAssignsId() {
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> {
            Invoice i = inv.getArgument(0);
            if (i.getId() == null) {
                i.setId(UUID.randomUUID());
            }
            return i;
        });
    }

    @Test
    @DisplayName("Fleet invoice: 100 - 15% = 85, due 30 days out, bookings stamped")
    void generate_fleet() {
        Booking a = completed("70", "40");
        Booking b = completed("90", "60");
        when(bookingRepository.findAllById(any())).thenReturn(List.of(a, b));
        when(fleetRepository.findById("fleet-1")).thenReturn(Optional.of(fleet));
        when(numberGenerator.next(YearMonth.of(2024, 5))).thenReturn("INV-202405-0001");
        saveAssignsId();

        Invoice invoice = service.generate(GenerateInvoiceRequest.builder()
                .invoiceType(InvoiceType.FLEET).entityId("fleet-1")
                .bookingIds(List.of(a.getId(), b.getId()))
                .build());

        assertThat(invoice.getInvoiceNumber()).isEqualTo("INV-202405-0001");
        assertThat(invoice.getTotal()).isEqualByComparingTo("85.00");
        assertThat(invoice.getPaymentTerms()).isEqualTo("Net 30");
        assertThat(invoice.getDueDate()).isEqualTo(LocalDate.of(2024, 6, 9));
        assertThat(a.getFleetInvoiceId()).isEqualTo(invoice.getId());
        assertThat(b.getFleetInvoiceId()).isEqualTo(invoice.getId());
        assertThat(a.getCustomerInvoiceId()).isNull();
        verify(bookingRepository).saveAll(anyIterable());
        verify(metrics).recordInvoiceGenerated(InvoiceType.FLEET);
        verify(kafkaTemplate).send(eq(KafkaTopics.INVOICE_GENERATED), anyString(), any(InvoiceEvent.class));
    }

    @Test
    @DisplayName("Unknown fleet raises ENTITY_NOT_FOUND")
    void generate_unknownEntity() {
        Booking a = completed("70", "40");
        when(bookingRepository.findAllById(any())).thenReturn(List.of(a));
        when(fleetRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.generate(GenerateInvoiceRequest.builder()
                .invoiceType(InvoiceType.FLEET).entityId("nope").bookingIds(List.of(a.getId())).build()))
                .isInstanceOf(InvoiceException.class)
                .extracting("code").isEqualTo("ENTITY_NOT_FOUND");
    }

    @Test
    @DisplayName("Bookings already on a fleet invoice are rejected")
    void generate_alreadyInvoiced() {
        Booking a = completed("70", "40");
        a.setFleetInvoiceId(UUID.randomUUID());
        when(bookingRepository.findAllById(any())).thenReturn(List.of(a));
        when(fleetRepository.findById("fleet-1")).thenReturn(Optional.of(fleet));

        assertThatThrownBy(() -> service.generate(GenerateInvoiceRequest.builder()
                .invoiceType(InvoiceType.FLEET).entityId("fleet-1").bookingIds(List.of(a.getId())).build()))
                .isInstanceOf(InvoiceException.class)
                .extracting("code").isEqualTo("ALREADY_INVOICED");
        verify(invoiceRepository, never()).save(any());
    }

    @Test
    @DisplayName("Bookings that are not completed cannot be invoiced")
    void generate_notCompleted() {
        Booking a = completed("70", "40");
        a.setStatus(BookingStatus.ASSIGNED);
        when(bookingRepository.findAllById(any())).thenReturn(List.of(a));

        assertThatThrownBy(() -> service.generate(GenerateInvoiceRequest.builder()
                .invoiceType(InvoiceType.CUSTOMER).entityId("ada@example.com").bookingIds(List.of(a.getId())).build()))
                .isInstanceOf(InvoiceException.class)
                .extracting("code").isEqualTo("BOOKING_NOT_COMPLETED");
    }

    @Test
    @DisplayName("Empty booking list is EMPTY_INVOICE")
    void generate_empty() {
        assertThatThrownBy(() -> service.generate(GenerateInvoiceRequest.builder()
                .invoiceType(InvoiceType.FLEET).entityId("fleet-1").bookingIds(List.of()).build()))
                .isInstanceOf(InvoiceException.class)
                .extracting("code").isEqualTo("EMPTY_INVOICE");
    }

    @Test
    @DisplayName("Lifecycle: DRAFT -> APPROVED -> ISSUED -> PAID, with timestamps")
    void lifecycle() {
        Invoice invoice = Invoice.builder().id(UUID.randomUUID()).invoiceNumber("INV-202405-0002")
                .invoiceType(InvoiceType.CUSTOMER).status(InvoiceStatus.DRAFT).build();
        when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));
        when(invoiceRepository.save(invoice)).thenReturn(invoice);

        service.approve(invoice.getId());
        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.APPROVED);

        service.issue(invoice.getId());
        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.ISSUED);
        assertThat(invoice.getIssuedAt()).isEqualTo(Instant.parse("2024-05-10T09:00:00Z"));

        service.markPaid(invoice.getId());
        assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.PAID);
        assertThat(invoice.getPaidAt()).isNotNull();
    }

    @Test
    @DisplayName("A paid invoice cannot be issued or amended")
    void invalidTransitions() {
        Invoice paid = Invoice.builder().id(UUID.randomUUID()).invoiceNumber("INV-202405-0003")
                .invoiceType(InvoiceType.FLEET).status(InvoiceStatus.PAID).build();
        when(invoiceRepository.findById(paid.getId())).thenReturn(Optional.of(paid));

        assertThatThrownBy(() -> service.issue(paid.getId()))
                .isInstanceOf(InvoiceException.class)
                .extracting("code").isEqualTo("INVALID_STATUS_TRANSITION");
        assertThatThrownBy(() -> service.amend(paid.getId(), AmendInvoiceRequest.builder().reason("typo").build()))
                .isInstanceOf(InvoiceException.class)
                .extracting("code").isEqualTo("INVALID_STATUS_TRANSITION");
    }

    @Test
    @DisplayName("Amend supersedes the original and re-points its bookings to the new invoice")
    void amend() {
        Booking a = completed("70", "40");
        Booking b = completed("90", "60");
        Invoice original = new InvoiceCalculator().generate(InvoiceType.FLEET,
                BillingParty.of(fleet), List.of(a, b), BigDecimal.ZERO);
        original.setId(UUID.randomUUID());
        original.setInvoiceNumber("INV-202405-0001");
        original.setStatus(InvoiceStatus.ISSUED);
        original.setPaymentTerms("Net 30");
        a.setFleetInvoiceId(original.getId());
        b.setFleetInvoiceId(original.getId());

        when(invoiceRepository.findById(original.getId())).thenReturn(Optional.of(original));
        when(numberGenerator.next(YearMonth.of(2024, 5))).thenReturn("INV-202405-0007");
        when(bookingRepository.findByFleetInvoiceId(original.getId())).thenReturn(List.of(a, b));
        saveAssignsId();

        Invoice amended = service.amend(original.getId(), AmendInvoiceRequest.builder()
                .reason("VAT registered").taxRatePercent(new BigDecimal("20")).build());

        // 100 - 15 + 20 = 105
        assertThat(amended.getTotal()).isEqualByComparingTo("105.00");
        assertThat(amended.getInvoiceNumber()).isEqualTo("INV-202405-0007");
        assertThat(amended.getSupersedesInvoiceId()).isEqualTo(original.getId());
        assertThat(amended.getAmendmentReason()).isEqualTo("VAT registered");
        assertThat(original.getStatus()).isEqualTo(InvoiceStatus.SUPERSEDED);
        assertThat(original.getSupersededByInvoiceId()).isEqualTo(amended.getId());
        assertThat(a.getFleetInvoiceId()).isEqualTo(amended.getId());
        assertThat(b.getFleetInvoiceId()).isEqualTo(amended.getId());
        verify(kafkaTemplate).send(eq(KafkaTopics.INVOICE_AMENDED), anyString(), any(InvoiceEvent.class));
    }

    @Test
    @DisplayName("Chained amendments with replacement lines keep the bookings on the newest invoice: 120 - 15 = 105, then + 10% tax = 117")
    void amendTwiceWithReplacementLines() {
        Booking a = completed("70", "40");
        Booking b = completed("90", "60");
        List<Booking> bookings = List.of(a, b);
        Map<UUID, Invoice> stored = new HashMap<>();

        Invoice first = new InvoiceCalculator().generate(InvoiceType.FLEET,
                BillingParty.of(fleet), bookings, BigDecimal.ZERO);
        first.setId(UUID.randomUUID());
        first.setInvoiceNumber("INV-202405-0001");
        first.setStatus(InvoiceStatus.ISSUED);
        first.setPaymentTerms("Net 30");
        stored.put(first.getId(), first);
        a.setFleetInvoiceId(first.getId());
        b.setFleetInvoiceId(first.getId());

        when(invoiceRepository.findById(any())).thenAnswer(inv -> Optional.ofNullable(stored.get(inv.<UUID>getArgument(0))));
        when(invoiceRepository.save(any(Invoice.class))).thenAnswer(inv -> {
            Invoice i = inv.getArgument(0);
            if (i.getId() == null) {
                i.setId(UUID.randomUUID());
            }
            stored.put(i.getId(), i);
            return i;
        });
        when(bookingRepository.findByFleetInvoiceId(any())).thenAnswer(inv -> bookings.stream()
                .filter(bk -> inv.getArgument(0).equals(bk.getFleetInvoiceId()))
                .toList());
        when(numberGenerator.next(YearMonth.of(2024, 5))).thenReturn("INV-202405-0007", "INV-202405-0008");

        Invoice second = service.amend(first.getId(), AmendInvoiceRequest.builder()
                .reason("Combined into one line")
                .lineItems(List.of(LineItemRequest.builder().description("Airport transfers, May")
                        .unitPrice(new BigDecimal("120")).build()))
                .build());

        assertThat(second.getTotal()).isEqualByComparingTo("105.00");
        assertThat(a.getFleetInvoiceId()).isEqualTo(second.getId());
        assertThat(b.getFleetInvoiceId()).isEqualTo(second.getId());

        Invoice third = service.amend(second.getId(), AmendInvoiceRequest.builder()
                .reason("VAT registered").taxRatePercent(new BigDecimal("10")).build());

        assertThat(third.getSubtotal()).isEqualByComparingTo("120.00");
        assertThat(third.getCommission()).isEqualByComparingTo("15.00");
        assertThat(third.getTotal()).isEqualByComparingTo("117.00");
        assertThat(second.getStatus()).isEqualTo(InvoiceStatus.SUPERSEDED);
        assertThat(first.getStatus()).isEqualTo(InvoiceStatus.SUPERSEDED);
        assertThat(a.getFleetInvoiceId()).isEqualTo(third.getId());
        assertThat(b.getFleetInvoiceId()).isEqualTo(third.getId());
        assertThat(stored.get(a.getFleetInvoiceId()).getStatus()).isEqualTo(InvoiceStatus.DRAFT);
    }

    @Test
    @DisplayName("Customer amend with a replacement line keeps driver cost: 150 - (40 + 60) = 50 profit")
    void amendCustomerWithReplacementLines() {
        Booking a = completed("70", "40");
        Booking b = completed("90", "60");
        Invoice original = new InvoiceCalculator().generate(InvoiceType.CUSTOMER,
                BillingParty.customer("ada@example.com", "Ada"), List.of(a, b), BigDecimal.ZERO);
        original.setId(UUID.randomUUID());
        original.setInvoiceNumber("INV-202405-0002");
        a.setCustomerInvoiceId(original.getId());
        b.setCustomerInvoiceId(original.getId());

        when(invoiceRepository.findById(original.getId())).thenReturn(Optional.of(original));
        when(numberGenerator.next(YearMonth.of(2024, 5))).thenReturn("INV-202405-0009");
        when(bookingRepository.findByCustomerInvoiceId(original.getId())).thenReturn(List.of(a, b));
        saveAssignsId();

        Invoice amended = service.amend(original.getId(), AmendInvoiceRequest.builder()
                .reason("Loyalty discount")
                .lineItems(List.of(LineItemRequest.builder().description("Transfers, discounted")
                        .unitPrice(new BigDecimal("150")).build()))
                .build());

        assertThat(original.getProfitTotal()).isEqualByComparingTo("60.00");
        assertThat(amended.getSubtotal()).isEqualByComparingTo("150.00");
        assertThat(amended.getProfitTotal()).isEqualByComparingTo("50.00");
        assertThat(a.getCustomerInvoiceId()).isEqualTo(amended.getId());
        assertThat(b.getCustomerInvoiceId()).isEqualTo(amended.getId());
    }

    @Test
    @DisplayName("Custom invoice uses dueInDays for terms and due date")
    void createCustom() {
        when(numberGenerator.next(YearMonth.of(2024, 5))).thenReturn("INV-202405-0004");
        saveAssignsId();

        Invoice invoice = service.createCustom(CustomInvoiceRequest.builder()
                .billToName("Acme Events").billToEmail("accounts@acme.example")
                .lineItems(List.of(LineItemRequest.builder().description("Shuttle day").quantity(new BigDecimal("3"))
                        .unitPrice(new BigDecimal("250")).build()))
                .dueInDays(7)
                .build());

        assertThat(invoice.getInvoiceType()).isEqualTo(InvoiceType.CUSTOM);
        assertThat(invoice.getTotal()).isEqualByComparingTo("750.00");
        assertThat(invoice.getPaymentTerms()).isEqualTo("Net 7");
        assertThat(invoice.getDueDate()).isEqualTo(LocalDate.of(2024, 5, 17));
        verify(metrics).recordInvoiceGenerated(InvoiceType.CUSTOM);
    }

    @Test
    @DisplayName("Uninvoiced fleet bookings are filtered by fleet id")
    void findUninvoiced() {
        Booking mine = completed("70", "40");
        Booking other = completed("80", "50");
        other.setFleetId("fleet-2");
        when(bookingRepository.findByStatusAndFleetInvoiceIdIsNullOrderByPickupDateAsc(BookingStatus.COMPLETED))
                .thenReturn(List.of(mine, other));

        assertThat(service.findUninvoiced(InvoiceType.FLEET, "fleet-1")).containsExactly(mine);
        assertThat(service.findUninvoiced(InvoiceType.FLEET, null)).containsExactly(mine, other);
    }
}
