package com.example.shifttrade.service;

import com.example.shifttrade.config.TradeConfig;
import com.example.shifttrade.model.ReasonCode;
import com.example.shifttrade.model.Shift;
import com.example.shifttrade.model.SwapOutcome;
import com.example.shifttrade.model.SwapVerdict;
import com.example.shifttrade.service.util.AvailabilityChecker;
import com.example.shifttrade.service.util.RestRuleEvaluator;
import com.example.shifttrade.service.util.WeeklyCapEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decides whether two people may exchange two shifts. Checks run in a fixed order and stop
 * at the first failure. The schedules passed in are never modified.
 */
@Component
@RequiredArgsConstructor
public class SwapSimulator {

    private final TradeConfig config;

    /**
     * @param schedules owner to start-ordered shifts
     * @param shiftA    shift held by person A
     * @param shiftB    shift held by person B
     */
    public SwapVerdict simulate(Map<String, List<Shift>> schedules, Shift shiftA, Shift shiftB) {
        if (!shiftA.isEligible() || !shiftB.isEligible()) {
            return SwapVerdict.rejected(ReasonCode.INELIGIBLE_TITLE);
        }

        String personA = shiftA.getOwner();
        String personB = shiftB.getOwner();
        if (personA.equals(personB)) {
            return SwapVerdict.rejected(ReasonCode.SAME_PERSON);
        }

        List<Shift> scheduleA = schedules.getOrDefault(personA, List.of());
        List<Shift> scheduleB = schedules.getOrDefault(personB, List.of());

        if (!AvailabilityChecker.isFree(scheduleB, shiftA.getStart(), shiftA.getEnd(), shiftB.getId())) {
            return SwapVerdict.rejected(ReasonCode.B_NOT_FREE_FOR_A);
        }
        if (!AvailabilityChecker.isFree(scheduleA, shiftB.getStart(), shiftB.getEnd(), shiftA.getId())) {
            return SwapVerdict.rejected(ReasonCode.A_NOT_FREE_FOR_B);
        }

        SwapOutcome outcome = swap(schedules, shiftA, shiftB);

        if (!RestRuleEvaluator.localRestOk(outcome.scheduleA(), outcome.indexOfReceivedByA())) {
            return SwapVerdict.rejected(ReasonCode.A_BREAK_RULE);
        }
        if (!RestRuleEvaluator.localRestOk(outcome.scheduleB(), outcome.indexOfReceivedByB())) {
            return SwapVerdict.rejected(ReasonCode.B_BREAK_RULE);
        }

        double cap = config.getWeeklyCapHours();
        if (!WeeklyCapEvaluator.weeklyCapOk(outcome.scheduleA(), outcome.receivedByA(), cap)) {
            return SwapVerdict.rejected(ReasonCode.A_WEEKLY_CAP);
        }
        if (!WeeklyCapEvaluator.weeklyCapOk(outcome.scheduleB(), outcome.receivedByB(), cap)) {
            return SwapVerdict.rejected(ReasonCode.B_WEEKLY_CAP);
        }

        return SwapVerdict.accepted();
    }

    /**
     * Both schedules as they would look after the exchange: each side loses its own shift and
     * holds a re-owned copy of the other's.
     */
    public SwapOutcome swap(Map<String, List<Shift>> schedules, Shift shiftA, Shift shiftB) {
        String personA = shiftA.getOwner();
        String personB = shiftB.getOwner();

        Shift receivedByA = shiftB.reownedTo(personA);
        Shift receivedByB = shiftA.reownedTo(personB);

        List<Shift> scheduleA = replace(schedules.getOrDefault(personA, List.of()), shiftA, receivedByA);
        List<Shift> scheduleB = replace(schedules.getOrDefault(personB, List.of()), shiftB, receivedByB);

        return new SwapOutcome(scheduleA, scheduleB, receivedByA, receivedByB);
    }

    private static List<Shift> replace(List<Shift> schedule, Shift givenAway, Shift received) {
        List<Shift> result = new ArrayList<>(schedule.size());
        for (Shift shift : schedule) {
            if (!shift.getId().equals(givenAway.getId())) {
                result.add(shift);
            }
        }
        result.add(received);
        result.sort(ScheduleBuilder.BY_START);
        return result;
    }
}
