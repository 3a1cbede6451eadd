package com.transferhub.booking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    /** Business dates (invoice month, due date) are UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
