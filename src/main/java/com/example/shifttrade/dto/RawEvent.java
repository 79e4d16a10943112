package com.example.shifttrade.dto;

import java.time.temporal.Temporal;
import java.time.temporal.TemporalAmount;

/**
 * One calendar event as the feed supplied it, before normalization.
 * {@code start} is a {@code LocalDate}, {@code LocalDateTime}, {@code ZonedDateTime},
 * {@code OffsetDateTime} or {@code Instant}; {@code end} and {@code duration} are optional.
 */
public record RawEvent(Temporal start, Temporal end, TemporalAmount duration, String title) {
}
