package com.example.shifttrade.service.util;

import com.example.shifttrade.model.Shift;

import java.time.DayOfWeek;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

public final class WeeklyCapEvaluator {

    private static final double SECONDS_PER_HOUR = 3600.0;

    private WeeklyCapEvaluator() {
    }

    /** Monday 00:00 at or before the given instant, in the instant's own zone. */
    public static ZonedDateTime weekStart(ZonedDateTime instant) {
        return instant.toLocalDate()
                .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                .atStartOfDay(instant.getZone());
    }

    /**
     * Hours of every shift starting inside the Monday-to-Monday week that contains
     * {@code inserted}. A shift is counted in full in the week it starts in.
     */
    public static double weeklyHours(List<Shift> schedule, Shift inserted) {
        ZonedDateTime weekStart = weekStart(inserted.getStart());
        ZonedDateTime weekEnd = weekStart.plusWeeks(1);

        return schedule.stream()
                .filter(shift -> !shift.getStart().isBefore(weekStart) && shift.getStart().isBefore(weekEnd))
                .mapToDouble(shift -> shift.duration().getSeconds() / SECONDS_PER_HOUR)
                .sum();
    }

    public static boolean weeklyCapOk(List<Shift> postSwapSchedule, Shift inserted, double capHours) {
        return weeklyHours(postSwapSchedule, inserted) <= capHours;
    }
}
