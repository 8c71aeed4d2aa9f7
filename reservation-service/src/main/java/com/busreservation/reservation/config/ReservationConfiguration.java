package com.busreservation.reservation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ReservationConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
