package com.example.shifttrade.service.util;

import com.example.shifttrade.model.Shift;
import com.example.shifttrade.model.ShiftId;

import java.time.ZonedDateTime;
import java.util.List;

public final class AvailabilityChecker {

    private AvailabilityChecker() {
    }

    /** Half-open intervals: touching end-to-start does not count as overlap. */
    public static boolean overlaps(ZonedDateTime aStart, ZonedDateTime aEnd, ZonedDateTime bStart, ZonedDateTime bEnd) {
        return aStart.isBefore(bEnd) && bStart.isBefore(aEnd);
    }

    /**
     * @param excludeId shift to ignore, typically the one the person is giving away; may be null
     */
    public static boolean isFree(List<Shift> schedule, ZonedDateTime start, ZonedDateTime end, ShiftId excludeId) {
        for (Shift shift : schedule) {
            if (excludeId != null && excludeId.equals(shift.getId())) {
                continue;
            }
            if (overlaps(shift.getStart(), shift.getEnd(), start, end)) {
                return false;
            }
        }
        return true;
    }
}
