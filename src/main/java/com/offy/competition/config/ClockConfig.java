package com.offy.competition.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Every "today" in the engine comes from this clock, so challenge windows and the monthly
 * leaderboard roll over in one configured zone.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${competition.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
