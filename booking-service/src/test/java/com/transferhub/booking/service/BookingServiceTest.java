package com.transferhub.booking.service;

import com.transferhub.booking.entity.Booking;
import com.transferhub.booking.entity.BookingExtra;
import com.transferhub.booking.exception.BookingException;
import com.transferhub.booking.metrics.BillingMetrics;
import com.transferhub.booking.model.CreateBookingRequest;
import com.transferhub.booking.model.ReassignRequest;
import com.transferhub.booking.model.UpdatePricingRequest;
import com.transferhub.booking.repository.BookingRepository;
import com.transferhub.shared.enums.BookingStatus;
import com.transferhub.shared.events.BookingEvent;
import com.transferhub.shared.util.KafkaTopics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest {

    @Mock private BookingRepository bookingRepository;
    @Mock private BookingRefGenerator refGenerator;
    @Mock private KafkaTemplate<String, Object> kafkaTemplate;
    @Mock private BillingMetrics metrics;

    private BookingService service;

    @BeforeEach
    void setUp() {
        service = new BookingService(bookingRepository, new DualPriceAssigner(), refGenerator, kafkaTemplate, metrics);
    }

    private void saveReturnsArgument() {
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> {
            Booking b = inv.getArgument(0);
            if (b.getId() == null) {
                b.setId(UUID.randomUUID());
            }
            return b;
        });
    }

    private static Booking existing(String customerPrice, String driverPrice) {
        Booking booking = Booking.builder()
                .id(UUID.randomUUID())
                .version(3L)
                .bookingRef("THK2P9QX")
                .customerName("Ada")
                .pickupLocation("Heathrow T5")
                .dropoffLocation("Soho")
                .pickupDate(LocalDate.of(2024, 6, 1))
                .status(BookingStatus.ASSIGNED)
                .driverId("drv-1")
                .build();
        BigDecimal c = new BigDecimal(customerPrice);
        BigDecimal d = new BigDecimal(driverPrice);
        booking.applyPricing(c, d, List.of(), new DualPriceAssigner());
        return booking;
    }

    @Test
    @DisplayName("create stores profit (85 + 10) - 50 = 45 and publishes booking.created")
    void create() {
        when(refGenerator.next()).thenReturn("THABC123");
        when(bookingRepository.existsByBookingRef("THABC123")).thenReturn(false);
        saveReturnsArgument();

        Booking booking = service.create(CreateBookingRequest.builder()
                .customerName("Ada").customerEmail("ada@example.com")
                .pickupLocation("Heathrow T5").dropoffLocation("Soho")
                .pickupDate(LocalDate.of(2024, 6, 1))
                .customerPrice(new BigDecimal("85")).driverPrice(new BigDecimal("50"))
                .extras(List.of(BookingExtra.builder().name("Child seat").price(new BigDecimal("10")).build()))
                .build());

        assertThat(booking.getBookingRef()).isEqualTo("THABC123");
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(booking.getExtrasTotal()).isEqualByComparingTo("10.00");
        assertThat(booking.getProfit()).isEqualByComparingTo("45.00");
        assertThat(booking.getCurrency()).isEqualTo("GBP");
        verify(kafkaTemplate).send(eq(KafkaTopics.BOOKING_CREATED), eq(booking.getId().toString()), any(BookingEvent.class));
    }

    @Test
    @DisplayName("create retries when the generated ref already exists")
    void create_refCollision() {
        when(refGenerator.next()).thenReturn("THTAKEN1", "THFRESH1");
        when(bookingRepository.existsByBookingRef("THTAKEN1")).thenReturn(true);
        when(bookingRepository.existsByBookingRef("THFRESH1")).thenReturn(false);
        saveReturnsArgument();

        Booking booking = service.create(CreateBookingRequest.builder()
                .customerName("Ada").pickupLocation("A").dropoffLocation("B")
                .pickupDate(LocalDate.of(2024, 6, 1)).customerPrice(new BigDecimal("40")).driverId("drv-9")
                .build());

        assertThat(booking.getBookingRef()).isEqualTo("THFRESH1");
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.ASSIGNED);
    }

    @Test
    @DisplayName("Reassigning driverPrice 50 -> 45 at customerPrice 85 stores profit 40")
    void reassign_updatesProfit() {
        Booking booking = existing("85", "50");
        when(bookingRepository.findById(booking.getId())).thenReturn(Optional.of(booking));
        saveReturnsArgument();

        Booking result = service.reassign(booking.getId(), ReassignRequest.builder()
                .driverId("drv-2").driverPrice(new BigDecimal("45")).build());

        assertThat(result.getProfit()).isEqualByComparingTo("40.00");
        assertThat(result.getDriverId()).isEqualTo("drv-2");

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(KafkaTopics.BOOKING_REASSIGNED), anyString(), event.capture());
        BookingEvent published = (BookingEvent) event.getValue();
        assertThat(published.getPreviousDriverId()).isEqualTo("drv-1");
        assertThat(published.getProfit()).isEqualByComparingTo("40.00");
        verify(metrics).recordBookingRepriced();
    }

    @Test
    @DisplayName("Reassignment is refused once a payout invoice references the booking")
    void reassign_afterPayoutInvoice() {
        Booking booking = existing("85", "50");
        booking.setDriverInvoiceId(UUID.randomUUID());
        when(bookingRepository.findById(booking.getId())).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.reassign(booking.getId(), ReassignRequest.builder()
                .driverId("drv-2").driverPrice(new BigDecimal("45")).build()))
                .isInstanceOf(BookingException.class)
                .extracting("code").isEqualTo("ALREADY_INVOICED");
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("A stale expectedVersion is rejected as a concurrent modification")
    void updatePricing_staleVersion() {
        Booking booking = existing("85", "50");
        when(bookingRepository.findById(booking.getId())).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.updatePricing(booking.getId(), UpdatePricingRequest.builder()
                .customerPrice(new BigDecimal("90")).expectedVersion(2L).build()))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);
        assertThat(booking.getProfit()).isEqualByComparingTo("35.00");
    }

    @Test
    @DisplayName("Editing only extras keeps prices: (85 + 12) - (50 + 12) = 35")
    void updatePricing_extrasOnly() {
        Booking booking = existing("85", "50");
        when(bookingRepository.findById(booking.getId())).thenReturn(Optional.of(booking));
        saveReturnsArgument();

        Booking result = service.updatePricing(booking.getId(), UpdatePricingRequest.builder()
                .extras(List.of(BookingExtra.builder().name("Waiting").price(new BigDecimal("12")).affectsDriverCost(true).build()))
                .expectedVersion(3L)
                .build());

        assertThat(result.getCustomerPrice()).isEqualByComparingTo("85");
        assertThat(result.getExtrasTotal()).isEqualByComparingTo("12.00");
        assertThat(result.getProfit()).isEqualByComparingTo("35.00");
        verify(kafkaTemplate).send(eq(KafkaTopics.BOOKING_PRICE_CHANGED), anyString(), any(BookingEvent.class));
    }

    @Test
    @DisplayName("Completed or cancelled bookings cannot be completed again")
    void complete_invalidStatus() {
        Booking booking = existing("85", "50");
        booking.setStatus(BookingStatus.CANCELLED);
        when(bookingRepository.findById(booking.getId())).thenReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.complete(booking.getId()))
                .isInstanceOf(BookingException.class)
                .extracting("code").isEqualTo("INVALID_STATUS");
    }

    @Test
    @DisplayName("Unknown booking id raises BOOKING_NOT_FOUND")
    void notFound() {
        UUID id = UUID.randomUUID();
        when(bookingRepository.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getBooking(id))
                .isInstanceOf(BookingException.class)
                .extracting("code").isEqualTo("BOOKING_NOT_FOUND");
    }
}
