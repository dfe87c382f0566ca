package com.stakeledger.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
