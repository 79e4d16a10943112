package com.example.shifttrade.model;

import java.util.List;

/**
 * Hypothetical schedules after exchanging two shifts. Side A gave up its shift and
 * holds {@code receivedByA}; side B likewise. Lists are sorted by start and unmodifiable.
 */
public record SwapOutcome(List<Shift> scheduleA, List<Shift> scheduleB, Shift receivedByA, Shift receivedByB) {

    public SwapOutcome {
        scheduleA = List.copyOf(scheduleA);
        scheduleB = List.copyOf(scheduleB);
    }

    public int indexOfReceivedByA() {
        return scheduleA.indexOf(receivedByA);
    }

    public int indexOfReceivedByB() {
        return scheduleB.indexOf(receivedByB);
    }
}
