package com.transferhub.pricing.service;

import com.transferhub.pricing.entity.MileageBracket;
import com.transferhub.pricing.entity.PricingScheme;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for BracketPricer.
 *
 * Reference scheme: [{0-5mi, fixedPrice=20}, {5-15mi, perMileRate=2}], minimumFare=25
 */
class BracketPricerTest {

    private BracketPricer pricer;

    @BeforeEach
    void setUp() {
        pricer = new BracketPricer();
    }

    private static PricingScheme scheme(String minimumFare, MileageBracket... brackets) {
        return PricingScheme.builder()
                .vehicleClassId("saloon")
                .minimumFare(new BigDecimal(minimumFare))
                .brackets(new ArrayList<>(List.of(brackets)))
                .build();
    }

    private static PricingScheme referenceScheme() {
        return scheme("25",
                MileageBracket.builder().minMiles(0).maxMiles(5.0).fixedPrice(new BigDecimal("20")).order(1).build(),
                MileageBracket.builder().minMiles(5).maxMiles(15.0).perMileRate(new BigDecimal("2")).order(2).build());
    }

    @Test
    @DisplayName("10 mi: 20 flat + (10-5) * 2 = 30, above the 25 minimum")
    void tenMiles() {
        assertThat(pricer.price(10.0, referenceScheme())).hasValueSatisfying(
                p -> assertThat(p).isEqualByComparingTo("30.00"));
    }

    @Test
    @DisplayName("3 mi: flat 20 is below minimumFare 25, so 25")
    void threeMiles_minimumFareFloor() {
        assertThat(pricer.price(3.0, referenceScheme())).hasValueSatisfying(
                p -> assertThat(p).isEqualByComparingTo("25.00"));
    }

    @Test
    @DisplayName("Distance beyond the last bounded bracket is not charged: 20 mi = 20 + 10 * 2 = 40")
    void beyondLastBracket() {
        assertThat(pricer.price(20.0, referenceScheme())).hasValueSatisfying(
                p -> assertThat(p).isEqualByComparingTo("40.00"));
    }

    @Test
    @DisplayName("Brackets are applied by order, not by list position")
    void bracketsSortedByOrder() {
        PricingScheme reversed = scheme("0",
                MileageBracket.builder().minMiles(5).maxMiles(15.0).perMileRate(new BigDecimal("2")).order(2).build(),
                MileageBracket.builder().minMiles(0).maxMiles(5.0).fixedPrice(new BigDecimal("20")).order(1).build());

        // if the fixed first bracket ran last it would replace the total with 20
        assertThat(pricer.price(10.0, reversed)).hasValueSatisfying(
                p -> assertThat(p).isEqualByComparingTo("30.00"));
    }

    @Test
    @DisplayName("Base fare seeds the total for per-mile-only schemes: 5 + 8 * 1.5 = 17")
    void baseFarePlusPerMile() {
        PricingScheme perMile = scheme("0",
                MileageBracket.builder().minMiles(0).perMileRate(new BigDecimal("1.5")).order(1).build());
        perMile.setBaseFare(new BigDecimal("5"));

        assertThat(pricer.price(8.0, perMile)).hasValueSatisfying(
                p -> assertThat(p).isEqualByComparingTo("17.00"));
    }

    @Test
    @DisplayName("A later bracket with only fixedPrice adds it flat: 20 + 12 = 32")
    void laterFixedPriceAddsFlat() {
        PricingScheme flatSteps = scheme("0",
                MileageBracket.builder().minMiles(0).maxMiles(5.0).fixedPrice(new BigDecimal("20")).order(1).build(),
                MileageBracket.builder().minMiles(5).maxMiles(10.0).fixedPrice(new BigDecimal("12")).order(2).build());

        assertThat(pricer.price(7.0, flatSteps)).hasValueSatisfying(
                p -> assertThat(p).isEqualByComparingTo("32.00"));
    }

    @Test
    @DisplayName("A bracket with no price fields contributes nothing")
    void unpricedBracketContributesZero() {
        PricingScheme misconfigured = scheme("0",
                MileageBracket.builder().minMiles(0).maxMiles(5.0).fixedPrice(new BigDecimal("20")).order(1).build(),
                MileageBracket.builder().minMiles(5).order(2).build());

        assertThat(pricer.price(9.0, misconfigured)).hasValueSatisfying(
                p -> assertThat(p).isEqualByComparingTo("20.00"));
    }

    @Test
    @DisplayName("Scheme without brackets yields no price")
    void noBrackets_empty() {
        assertThat(pricer.price(10.0, scheme("25"))).isEmpty();
        assertThat(pricer.price(10.0, null)).isEmpty();
    }

    @Test
    @DisplayName("Result never drops below minimumFare and always has scale 2")
    void minimumFareFloorForAnyDistance() {
        for (double miles = 0.0; miles <= 30.0; miles += 0.7) {
            BigDecimal price = pricer.price(miles, referenceScheme()).orElseThrow();
            assertThat(price).isGreaterThanOrEqualTo(new BigDecimal("25"));
            assertThat(price.scale()).isEqualTo(2);
        }
    }
}
