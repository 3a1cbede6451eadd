package com.transferhub.pricing.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Quote {

    private String vehicleClassId;
    private String vehicleName;
    private BigDecimal price;
    private String currency;
    private PricingTier sourceTier;
    /** Geo or text route that set the price, if any. */
    private String routeName;
    private int maxPassengers;
    private int maxLuggage;
}
