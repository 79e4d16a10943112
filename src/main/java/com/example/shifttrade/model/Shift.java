package com.example.shifttrade.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.time.Duration;
import java.time.ZonedDateTime;

@Value
@Builder(toBuilder = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Shift {

    @EqualsAndHashCode.Include
    ShiftId id;

    String owner;

    String title;

    /** Minute precision, operative timezone. */
    ZonedDateTime start;

    ZonedDateTime end;

    boolean eligible;

    public static Shift of(String owner, String title, ZonedDateTime start, ZonedDateTime end, boolean eligible) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Shift must end after it starts: " + start + " - " + end);
        }
        return Shift.builder()
                .id(ShiftId.of(owner, start.toInstant(), end.toInstant(), title))
                .owner(owner)
                .title(title)
                .start(start)
                .end(end)
                .eligible(eligible)
                .build();
    }

    /** Virtual copy held by another person, used only while simulating a swap. */
    public Shift reownedTo(String newOwner) {
        return toBuilder()
                .owner(newOwner)
                .id(ShiftId.of(newOwner, start.toInstant(), end.toInstant(), title))
                .build();
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean isOwnedBy(String person) {
        return owner.equals(person);
    }
}
