package com.example.shifttrade.service.util;

import com.example.shifttrade.model.Shift;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.shifttrade.ShiftFixtures.shift;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RestRuleEvaluatorTest {

    @Test
    void singleShiftAlwaysPasses() {
        assertThat(RestRuleEvaluator.localRestOk(List.of(shift("Alice", "Day 1", "2030-01-07T07:00", 12)), 0)).isTrue();
    }

    @Test
    void gapAfterPreviousShorterThanPreviousFails() {
        List<Shift> schedule = List.of(
                shift("Alice", "Night 1", "2030-01-08T19:00", 12),
                shift("Alice", "Day 1", "2030-01-09T12:00", 8));

        assertThat(RestRuleEvaluator.localRestOk(schedule, 1)).isFalse();
    }

    @Test
    void gapEqualToPreviousDurationPasses() {
        List<Shift> schedule = List.of(
                shift("Alice", "Night 1", "2030-01-08T19:00", 12),
                shift("Alice", "Night 1", "2030-01-09T19:00", 12));

        assertThat(RestRuleEvaluator.localRestOk(schedule, 1)).isTrue();
    }

    @Test
    void gapBeforeNextShorterThanCurrentFails() {
        List<Shift> schedule = List.of(
                shift("Alice", "Day 1", "2030-01-08T07:00", 12),
                shift("Alice", "Night 1", "2030-01-09T01:00", 6));

        assertThat(RestRuleEvaluator.localRestOk(schedule, 0)).isFalse();
    }

    @Test
    void onlyImmediateNeighboursAreChecked() {
        // first two are back to back, but the shift under test is the third
        List<Shift> schedule = List.of(
                shift("Alice", "Day 1", "2030-01-07T07:00", 12),
                shift("Alice", "Night 1", "2030-01-07T19:00", 12),
                shift("Alice", "Day 2", "2030-01-09T07:00", 12));

        assertThat(RestRuleEvaluator.localRestOk(schedule, 2)).isTrue();
        assertThat(RestRuleEvaluator.localRestOk(schedule, 1)).isFalse();
    }

    @Test
    void rejectsIndexOutsideSchedule() {
        List<Shift> schedule = List.of(shift("Alice", "Day 1", "2030-01-07T07:00", 12));

        assertThatThrownBy(() -> RestRuleEvaluator.localRestOk(schedule, 1))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> RestRuleEvaluator.localRestOk(schedule, -1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
