package com.example.shifttrade.service;

import com.example.shifttrade.dto.RawEvent;
import com.example.shifttrade.model.ScheduleSnapshot;
import com.example.shifttrade.model.Shift;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Turns raw per-person calendar events into a snapshot of future shifts.
 * One bad event never aborts the pass; it is logged and skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleBuilder {

    static final Duration DEFAULT_SHIFT_LENGTH = Duration.ofHours(1);

    static final Comparator<Shift> BY_START = Comparator
            .comparing((Shift shift) -> shift.getStart().toInstant())
            .thenComparing(shift -> shift.getEnd().toInstant())
            .thenComparing(shift -> shift.getId().value());

    private static final Comparator<Shift> BY_START_THEN_OWNER = Comparator
            .comparing((Shift shift) -> shift.getStart().toInstant())
            .thenComparing(Shift::getOwner)
            .thenComparing(BY_START);

    private final InstantNormalizer normalizer;
    private final EligibilityClassifier classifier;
    private final Clock clock;

    public ScheduleSnapshot build(Collection<String> people,
                                  Map<String, List<RawEvent>> rawEventsByPerson,
                                  ZonedDateTime cutoff) {
        List<Shift> shifts = new ArrayList<>();

        rawEventsByPerson.forEach((person, events) -> {
            int skipped = 0;
            for (RawEvent event : events) {
                try {
                    toShift(person, event, cutoff).ifPresent(shifts::add);
                } catch (RuntimeException e) {
                    skipped++;
                    log.warn("Skipping event '{}' of {}: {}", event.title(), person, e.getMessage());
                }
            }
            if (skipped > 0) {
                log.info("{} malformed event(s) skipped for {}", skipped, person);
            }
        });

        Map<String, List<Shift>> grouped = new HashMap<>();
        for (Shift shift : shifts) {
            grouped.computeIfAbsent(shift.getOwner(), owner -> new ArrayList<>()).add(shift);
        }
        Map<String, List<Shift>> schedules = new HashMap<>();
        grouped.forEach((owner, list) -> {
            list.sort(BY_START);
            schedules.put(owner, List.copyOf(list));
        });

        shifts.sort(BY_START_THEN_OWNER);
        List<String> roster = List.copyOf(new TreeSet<>(people));

        log.info("Schedule built: {} people, {} future shifts (cutoff {})", roster.size(), shifts.size(), cutoff);
        return new ScheduleSnapshot(roster, shifts, schedules, clock.instant());
    }

    /** Empty when the event is dropped by rule: no start, empty interval, or before the cutoff. */
    Optional<Shift> toShift(String person, RawEvent event, ZonedDateTime cutoff) {
        if (event.start() == null) {
            log.debug("Dropping event '{}' of {} without a start", event.title(), person);
            return Optional.empty();
        }

        ZonedDateTime start = normalizer.normalize(event.start());
        ZonedDateTime end;
        if (event.end() != null) {
            end = normalizer.normalize(event.end());
        } else if (event.duration() != null) {
            end = normalizer.normalize(start.plus(event.duration()));
        } else {
            end = normalizer.normalize(start.plus(DEFAULT_SHIFT_LENGTH));
        }

        if (!end.isAfter(start)) {
            log.debug("Dropping empty event '{}' of {} at {}", event.title(), person, start);
            return Optional.empty();
        }
        if (start.isBefore(cutoff)) {
            return Optional.empty();
        }

        String title = event.title() == null ? "" : event.title();
        return Optional.of(Shift.of(person, title, start, end, classifier.classify(title)));
    }
}
