package com.transferhub.pricing.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class PickupTimeClassifierTest {

    private final PickupTimeClassifier classifier = new PickupTimeClassifier();

    @Test
    @DisplayName("Night window is 22:00 inclusive to 06:00 exclusive")
    void nightWindow() {
        assertThat(classifier.isNight(LocalDateTime.of(2024, 3, 6, 22, 0))).isTrue();
        assertThat(classifier.isNight(LocalDateTime.of(2024, 3, 6, 5, 59))).isTrue();
        assertThat(classifier.isNight(LocalDateTime.of(2024, 3, 6, 6, 0))).isFalse();
        assertThat(classifier.isNight(LocalDateTime.of(2024, 3, 6, 21, 59))).isFalse();
    }

    @Test
    @DisplayName("Saturday and Sunday are weekend (2024-03-09 is a Saturday)")
    void weekend() {
        assertThat(classifier.isWeekend(LocalDateTime.of(2024, 3, 9, 12, 0))).isTrue();
        assertThat(classifier.isWeekend(LocalDateTime.of(2024, 3, 10, 12, 0))).isTrue();
        assertThat(classifier.isWeekend(LocalDateTime.of(2024, 3, 11, 12, 0))).isFalse();
    }

    @Test
    @DisplayName("Unknown pickup time is neither night nor weekend")
    void nullTime() {
        assertThat(classifier.isNight(null)).isFalse();
        assertThat(classifier.isWeekend(null)).isFalse();
    }
}
