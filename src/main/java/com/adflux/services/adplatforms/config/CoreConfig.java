package com.adflux.services.adplatforms.config;

import com.adflux.services.adplatforms.dto.response.ApiResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        Clock clock = Clock.systemUTC();
        ApiResponse.useClock(clock);
        return clock;
    }
}
