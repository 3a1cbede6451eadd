package com.transferhub.booking.controller;

import com.transferhub.booking.entity.Booking;
import com.transferhub.booking.exception.BookingException;
import com.transferhub.booking.metrics.BillingMetrics;
import com.transferhub.booking.model.CreateBookingRequest;
import com.transferhub.booking.model.ReassignRequest;
import com.transferhub.booking.model.UpdatePricingRequest;
import com.transferhub.booking.service.BookingService;
import com.transferhub.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;
    private final BillingMetrics metrics;

    @PostMapping
    public ResponseEntity<ApiResponse<Booking>> create(@Valid @RequestBody CreateBookingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(bookingService.create(request)));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<ApiResponse<Booking>> get(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(ApiResponse.ok(bookingService.getBooking(bookingId)));
    }

    @PutMapping("/{bookingId}/pricing")
    public ResponseEntity<ApiResponse<Booking>> updatePricing(
            @PathVariable("bookingId") UUID bookingId,
            @Valid @RequestBody UpdatePricingRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(bookingService.updatePricing(bookingId, request)));
    }

    @PostMapping("/{bookingId}/reassign")
    public ResponseEntity<ApiResponse<Booking>> reassign(
            @PathVariable("bookingId") UUID bookingId,
            @Valid @RequestBody ReassignRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(bookingService.reassign(bookingId, request)));
    }

    @PostMapping("/{bookingId}/complete")
    public ResponseEntity<ApiResponse<Booking>> complete(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(ApiResponse.ok(bookingService.complete(bookingId)));
    }

    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<ApiResponse<Booking>> cancel(@PathVariable("bookingId") UUID bookingId) {
        return ResponseEntity.ok(ApiResponse.ok(bookingService.cancel(bookingId)));
    }

    @ExceptionHandler(BookingException.class)
    public ResponseEntity<ApiResponse<Void>> handleBookingError(BookingException ex) {
        HttpStatus status = ex.getCode().endsWith("_NOT_FOUND") ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ObjectOptimisticLockingFailureException ex) {
        metrics.recordConcurrentModification();
        log.warn("Concurrent booking update rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.error("CONCURRENT_MODIFICATION",
                "The booking was changed by another request; reload and retry"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getAllErrors().stream()
                .map(e -> e.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_FAILED", message));
    }
}
