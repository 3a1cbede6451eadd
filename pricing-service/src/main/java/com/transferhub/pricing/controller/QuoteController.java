package com.transferhub.pricing.controller;

import com.transferhub.pricing.exception.PricingException;
import com.transferhub.pricing.model.PricingTier;
import com.transferhub.pricing.model.Quote;
import com.transferhub.pricing.model.QuoteRequest;
import com.transferhub.pricing.model.QuoteResponse;
import com.transferhub.pricing.service.QuoteOrchestrator;
import com.transferhub.shared.dto.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/quotes")
@RequiredArgsConstructor
public class QuoteController {

    private final QuoteOrchestrator quoteOrchestrator;

    @PostMapping
    public ResponseEntity<ApiResponse<QuoteResponse>> quote(@Valid @RequestBody QuoteRequest request) {
        return ResponseEntity.ok(ApiResponse.ok(quoteOrchestrator.quote(request)));
    }

    @PostMapping("/{vehicleClassId}")
    public ResponseEntity<ApiResponse<Quote>> quoteForClass(
            @PathVariable("vehicleClassId") String vehicleClassId,
            @Valid @RequestBody QuoteRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(quoteOrchestrator.quoteForClass(request, vehicleClassId)));
    }

    /**
     * Evaluation order of the pricing tiers, for admin tooling.
     */
    @GetMapping("/tiers")
    public ResponseEntity<ApiResponse<List<PricingTier>>> tiers() {
        return ResponseEntity.ok(ApiResponse.ok(quoteOrchestrator.tierOrder()));
    }

    @ExceptionHandler(PricingException.class)
    public ResponseEntity<ApiResponse<Void>> handlePricingError(PricingException ex) {
        HttpStatus status = ex.getCode().endsWith("_NOT_FOUND") ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getCode(), ex.getMessage()));
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
