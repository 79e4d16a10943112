package com.example.shifttrade.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of one normalization pass. Immutable; a new snapshot replaces the old one.
 *
 * @param people    configured roster, sorted and deduplicated, including people without shifts
 * @param shifts    every retained shift, ordered by start then owner
 * @param schedules owner to that owner's shifts ordered by start
 * @param builtAt   when the pass finished
 */
public record ScheduleSnapshot(List<String> people, List<Shift> shifts, Map<String, List<Shift>> schedules, Instant builtAt) {

    public ScheduleSnapshot {
        people = List.copyOf(people);
        shifts = List.copyOf(shifts);
        schedules = Map.copyOf(schedules);
    }

    public static ScheduleSnapshot empty(Instant builtAt) {
        return new ScheduleSnapshot(List.of(), List.of(), Map.of(), builtAt);
    }

    public List<Shift> scheduleOf(String person) {
        return schedules.getOrDefault(person, List.of());
    }

    public Optional<Shift> findShift(String shiftId) {
        return shifts.stream()
                .filter(shift -> shift.getId().value().equals(shiftId))
                .findFirst();
    }
}
