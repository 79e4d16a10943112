package com.example.shifttrade.service.util;

import com.example.shifttrade.model.Shift;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Advisory only: an off-run is a stretch of consecutive days on which the person starts no shift.
 */
public final class OffRunDetector {

    public static final int DEFAULT_THRESHOLD = 5;
    public static final int DEFAULT_LOOKBACK_GUARD = 12;
    public static final int DEFAULT_LOOKAHEAD_GUARD = 24;

    private OffRunDetector() {
    }

    public static boolean isInLongOffRun(List<Shift> schedule, LocalDate dateToCheck) {
        return isInLongOffRun(schedule, dateToCheck, DEFAULT_THRESHOLD, DEFAULT_LOOKBACK_GUARD, DEFAULT_LOOKAHEAD_GUARD);
    }

    public static boolean isInLongOffRun(List<Shift> schedule,
                                         LocalDate dateToCheck,
                                         int threshold,
                                         int lookbackGuard,
                                         int lookaheadGuard) {
        Set<LocalDate> startDates = startDates(schedule);
        if (startDates.contains(dateToCheck)) {
            return false;
        }
        return offRunLength(startDates, dateToCheck, lookbackGuard, lookaheadGuard) >= threshold;
    }

    /**
     * Length of the off-run around {@code date}. The guards cap the running total,
     * so the backward walk can use at most {@code lookbackGuard} days and the whole run
     * never exceeds {@code lookaheadGuard}.
     */
    static int offRunLength(Set<LocalDate> startDates, LocalDate date, int lookbackGuard, int lookaheadGuard) {
        int runLength = 1;

        LocalDate day = date;
        while (runLength < lookbackGuard) {
            day = day.minusDays(1);
            if (startDates.contains(day)) {
                break;
            }
            runLength++;
        }

        day = date;
        while (runLength < lookaheadGuard) {
            day = day.plusDays(1);
            if (startDates.contains(day)) {
                break;
            }
            runLength++;
        }

        return runLength;
    }

    /** Calendar dates, in each shift's own zone, on which a shift starts. */
    public static Set<LocalDate> startDates(List<Shift> schedule) {
        return schedule.stream()
                .map(shift -> shift.getStart().toLocalDate())
                .collect(Collectors.toSet());
    }
}
