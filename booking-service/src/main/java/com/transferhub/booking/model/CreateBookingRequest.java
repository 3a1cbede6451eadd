package com.transferhub.booking.model;

import com.transferhub.booking.entity.BookingExtra;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateBookingRequest {

    @NotBlank
    private String customerName;

    @Email
    private String customerEmail;

    private String customerPhone;

    @NotBlank
    private String pickupLocation;

    @NotBlank
    private String dropoffLocation;

    @NotNull
    private LocalDate pickupDate;

    private LocalTime pickupTime;

    @Min(1)
    @Builder.Default
    private int passengers = 1;

    private String vehicleClassId;

    private String fleetId;

    private String driverId;

    @NotNull
    @PositiveOrZero
    private BigDecimal customerPrice;

    @PositiveOrZero
    private BigDecimal driverPrice;

    @Valid
    private List<BookingExtra> extras;

    private String currency;
}
