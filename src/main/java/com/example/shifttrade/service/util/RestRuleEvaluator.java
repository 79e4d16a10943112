package com.example.shifttrade.service.util;

import com.example.shifttrade.model.Shift;

import java.time.Duration;
import java.util.List;

/**
 * Rest rule around one shift: the gap after a shift must be at least as long as that shift.
 * Only the immediate neighbours of the inserted shift are looked at.
 */
public final class RestRuleEvaluator {

    private RestRuleEvaluator() {
    }

    public static boolean localRestOk(List<Shift> sortedSchedule, int index) {
        if (index < 0 || index >= sortedSchedule.size()) {
            throw new IndexOutOfBoundsException("No shift at index " + index + " in schedule of " + sortedSchedule.size());
        }
        Shift current = sortedSchedule.get(index);

        if (index > 0) {
            Shift previous = sortedSchedule.get(index - 1);
            Duration gap = Duration.between(previous.getEnd(), current.getStart());
            if (gap.compareTo(previous.duration()) < 0) {
                return false;
            }
        }

        if (index + 1 < sortedSchedule.size()) {
            Shift next = sortedSchedule.get(index + 1);
            Duration gap = Duration.between(current.getEnd(), next.getStart());
            if (gap.compareTo(current.duration()) < 0) {
                return false;
            }
        }

        return true;
    }
}
