package com.example.shifttrade.service;

import com.example.shifttrade.config.TradeConfig;
import com.example.shifttrade.service.exception.MalformedEventException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;

/**
 * Brings every calendar timestamp into the operative timezone at minute precision.
 * All instants compared downstream must come through here.
 */
@Component
@RequiredArgsConstructor
public class InstantNormalizer {

    private final TradeConfig config;
    private final Clock clock;

    public ZonedDateTime normalize(Temporal raw) {
        if (raw == null) {
            throw new MalformedEventException("Missing timestamp");
        }
        ZoneId zone = config.getZone();
        ZonedDateTime zoned;
        if (raw instanceof ZonedDateTime zonedDateTime) {
            zoned = zonedDateTime.withZoneSameInstant(zone);
        } else if (raw instanceof OffsetDateTime offsetDateTime) {
            zoned = offsetDateTime.atZoneSameInstant(zone);
        } else if (raw instanceof Instant instant) {
            zoned = instant.atZone(zone);
        } else if (raw instanceof LocalDateTime localDateTime) {
            // floating time is read as already being in the operative zone
            zoned = localDateTime.atZone(zone);
        } else if (raw instanceof LocalDate date) {
            zoned = date.atStartOfDay(zone);
        } else {
            throw new MalformedEventException("Unsupported timestamp type " + raw.getClass().getSimpleName());
        }
        return zoned.truncatedTo(ChronoUnit.MINUTES);
    }

    /** Start of tomorrow in the operative zone; shifts starting earlier are not tradable. */
    public ZonedDateTime futureCutoff() {
        ZoneId zone = config.getZone();
        return LocalDate.now(clock.withZone(zone))
                .plusDays(1)
                .atStartOfDay(zone);
    }
}
