package com.transferhub.booking.model;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReassignRequest {

    private String fleetId;

    private String driverId;

    @NotNull
    @PositiveOrZero
    private BigDecimal driverPrice;

    private Long expectedVersion;

    @AssertTrue(message = "fleetId or driverId is required")
    public boolean isAssigneePresent() {
        return (fleetId != null && !fleetId.isBlank()) || (driverId != null && !driverId.isBlank());
    }
}
