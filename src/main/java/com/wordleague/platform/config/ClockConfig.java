package com.wordleague.platform.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    /**
     * Clock in the zone where the daily puzzle rolls over.
     */
    @Bean
    public Clock puzzleClock(@Value("${wordleague.timezone:UTC}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }
}
