package com.example.shifttrade.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
@Data
public class TradeConfig {

    /** Operative timezone: every instant is normalized into it before comparison. */
    @Value("${trade.zone:America/New_York}")
    ZoneId zone = ZoneId.of("America/New_York");

    @Value("${trade.weekly-cap-hours:60}")
    double weeklyCapHours = 60;

    @Value("${trade.off-run.threshold-days:5}")
    int offRunThresholdDays = 5;

    @Value("${trade.off-run.lookback-guard:12}")
    int offRunLookbackGuard = 12;

    @Value("${trade.off-run.lookahead-guard:24}")
    int offRunLookaheadGuard = 24;

    @Value("${trade.cache.ttl:PT2M}")
    Duration cacheTtl = Duration.ofMinutes(2);

    @Bean
    public Clock clock() {
        return Clock.system(zone);
    }
}
