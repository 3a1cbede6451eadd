package com.transferhub.booking.controller;

import com.transferhub.booking.entity.Booking;
import com.transferhub.booking.entity.Invoice;
import com.transferhub.booking.exception.InvoiceException;
import com.transferhub.booking.metrics.BillingMetrics;
import com.transferhub.booking.model.AmendInvoiceRequest;
import com.transferhub.booking.model.CustomInvoiceRequest;
import com.transferhub.booking.model.GenerateInvoiceRequest;
import com.transferhub.booking.service.InvoiceService;
import com.transferhub.shared.dto.ApiResponse;
import com.transferhub.shared.enums.InvoiceType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/invoices")
@RequiredArgsConstructor
public class InvoiceController {

    private final InvoiceService invoiceService;
    private final BillingMetrics metrics;

    @PostMapping("/generate")
    public ResponseEntity<ApiResponse<Invoice>> generate(@Valid @RequestBody GenerateInvoiceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(invoiceService.generate(request)));
    }

    @PostMapping("/custom")
    public ResponseEntity<ApiResponse<Invoice>> createCustom(@Valid @RequestBody CustomInvoiceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(invoiceService.createCustom(request)));
    }

    @GetMapping("/{invoiceId}")
    public ResponseEntity<ApiResponse<Invoice>> get(@PathVariable("invoiceId") UUID invoiceId) {
        return ResponseEntity.ok(ApiResponse.ok(invoiceService.getInvoice(invoiceId)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<Invoice>>> findForEntity(
            @RequestParam("type") InvoiceType type,
            @RequestParam("entityId") String entityId) {

        return ResponseEntity.ok(ApiResponse.ok(invoiceService.findForEntity(type, entityId)));
    }

    @GetMapping("/uninvoiced-bookings")
    public ResponseEntity<ApiResponse<List<Booking>>> uninvoiced(
            @RequestParam("type") InvoiceType type,
            @RequestParam(value = "entityId", required = false) String entityId) {

        return ResponseEntity.ok(ApiResponse.ok(invoiceService.findUninvoiced(type, entityId)));
    }

    @PostMapping("/{invoiceId}/approve")
    public ResponseEntity<ApiResponse<Invoice>> approve(@PathVariable("invoiceId") UUID invoiceId) {
        return ResponseEntity.ok(ApiResponse.ok(invoiceService.approve(invoiceId)));
    }

    @PostMapping("/{invoiceId}/issue")
    public ResponseEntity<ApiResponse<Invoice>> issue(@PathVariable("invoiceId") UUID invoiceId) {
        return ResponseEntity.ok(ApiResponse.ok(invoiceService.issue(invoiceId)));
    }

    @PostMapping("/{invoiceId}/mark-paid")
    public ResponseEntity<ApiResponse<Invoice>> markPaid(@PathVariable("invoiceId") UUID invoiceId) {
        return ResponseEntity.ok(ApiResponse.ok(invoiceService.markPaid(invoiceId)));
    }

    @PostMapping("/{invoiceId}/amend")
    public ResponseEntity<ApiResponse<Invoice>> amend(
            @PathVariable("invoiceId") UUID invoiceId,
            @Valid @RequestBody AmendInvoiceRequest request) {

        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(invoiceService.amend(invoiceId, request)));
    }

    @ExceptionHandler(InvoiceException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvoiceError(InvoiceException ex) {
        HttpStatus status = ex.getCode().endsWith("_NOT_FOUND") ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        if (status == HttpStatus.BAD_REQUEST) {
            log.warn("Invoice request rejected: {} {}", ex.getCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ObjectOptimisticLockingFailureException ex) {
        metrics.recordConcurrentModification();
        log.warn("Concurrent invoice update rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.error("CONCURRENT_MODIFICATION",
                "A booking or invoice was changed by another request; reload and retry"));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_FAILED", message));
    }
}
