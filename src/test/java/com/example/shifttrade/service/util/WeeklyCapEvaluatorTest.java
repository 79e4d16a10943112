package com.example.shifttrade.service.util;

import com.example.shifttrade.model.Shift;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.shifttrade.ShiftFixtures.at;
import static com.example.shifttrade.ShiftFixtures.shift;
import static org.assertj.core.api.Assertions.assertThat;

class WeeklyCapEvaluatorTest {

    @Test
    void weekStartsOnMondayMidnight() {
        assertThat(WeeklyCapEvaluator.weekStart(at("2030-01-13T23:00"))).isEqualTo(at("2030-01-07T00:00"));
        assertThat(WeeklyCapEvaluator.weekStart(at("2030-01-14T00:00"))).isEqualTo(at("2030-01-14T00:00"));
        assertThat(WeeklyCapEvaluator.weekStart(at("2030-01-09T12:30"))).isEqualTo(at("2030-01-07T00:00"));
    }

    @Test
    void exceedingCapFails() {
        Shift saturday = shift("Alice", "Day 1", "2030-01-12T07:00", 12);
        List<Shift> schedule = List.of(
                shift("Alice", "Day 1", "2030-01-07T07:00", 12),
                shift("Alice", "Day 1", "2030-01-08T07:00", 12),
                shift("Alice", "Day 1", "2030-01-09T07:00", 12),
                shift("Alice", "Day 1", "2030-01-10T07:00", 12),
                shift("Alice", "Day 1", "2030-01-11T07:00", 7),
                saturday);

        assertThat(WeeklyCapEvaluator.weeklyHours(schedule, saturday)).isEqualTo(67.0);
        assertThat(WeeklyCapEvaluator.weeklyCapOk(schedule, saturday, 60)).isFalse();
    }

    @Test
    void reachingCapExactlyPasses() {
        Shift inserted = shift("Alice", "Day 1", "2030-01-11T07:00", 12);
        List<Shift> schedule = List.of(
                shift("Alice", "Day 1", "2030-01-07T07:00", 12),
                shift("Alice", "Day 1", "2030-01-08T07:00", 12),
                shift("Alice", "Day 1", "2030-01-09T07:00", 12),
                shift("Alice", "Day 1", "2030-01-10T07:00", 12),
                inserted);

        assertThat(WeeklyCapEvaluator.weeklyCapOk(schedule, inserted, 60)).isTrue();
    }

    @Test
    void shiftCountsFullyInTheWeekItStarts() {
        Shift sundayNight = shift("Alice", "Night 1", "2030-01-13T19:00", 12);
        Shift monday = shift("Alice", "Night 1", "2030-01-14T19:00", 12);
        List<Shift> schedule = List.of(sundayNight, monday);

        assertThat(WeeklyCapEvaluator.weeklyHours(schedule, sundayNight)).isEqualTo(12.0);
        assertThat(WeeklyCapEvaluator.weeklyHours(schedule, monday)).isEqualTo(12.0);
    }

    @Test
    void otherWeeksAreIgnored() {
        Shift inserted = shift("Alice", "Day 1", "2030-01-16T07:00", 12);
        List<Shift> schedule = List.of(
                shift("Alice", "Day 1", "2030-01-13T07:00", 12),
                inserted,
                shift("Alice", "Day 1", "2030-01-21T00:00", 12));

        assertThat(WeeklyCapEvaluator.weeklyHours(schedule, inserted)).isEqualTo(12.0);
    }
}
