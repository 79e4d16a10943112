package com.example.shifttrade.service;

import com.example.shifttrade.config.TradeConfig;
import com.example.shifttrade.model.OffRunAdvisory;
import com.example.shifttrade.model.Shift;
import com.example.shifttrade.model.SwapOutcome;
import com.example.shifttrade.model.SwapVerdict;
import com.example.shifttrade.model.TradeCandidate;
import com.example.shifttrade.service.util.OffRunDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateSearch {

    /** Earliest counter-shift first, then by counter-party, then by id for full determinism. */
    static final Comparator<TradeCandidate> CANDIDATE_ORDER = Comparator
            .comparing((TradeCandidate candidate) -> candidate.counterpartyShift().getStart().toInstant())
            .thenComparing(TradeCandidate::counterpartyOwner)
            .thenComparing(candidate -> candidate.counterpartyShift().getId().value());

    private final SwapSimulator simulator;
    private final TradeConfig config;

    public List<TradeCandidate> findCandidates(List<Shift> allFutureShifts,
                                               Map<String, List<Shift>> schedules,
                                               Shift traderShift) {
        List<TradeCandidate> candidates = new ArrayList<>();
        int rejected = 0;

        for (Shift candidate : allFutureShifts) {
            if (candidate.isOwnedBy(traderShift.getOwner())) {
                continue;
            }
            SwapVerdict verdict = simulator.simulate(schedules, traderShift, candidate);
            if (!verdict.ok()) {
                rejected++;
                log.debug("Swap {} <-> {} rejected: {}", traderShift.getId(), candidate.getId(), verdict.reason().code());
                continue;
            }
            candidates.add(new TradeCandidate(candidate.getOwner(), candidate, verdict.reason(),
                    advisory(schedules, traderShift, candidate)));
        }

        candidates.sort(CANDIDATE_ORDER);
        log.info("Shift {} of {}: {} candidate(s), {} rejected", traderShift.getId(), traderShift.getOwner(),
                candidates.size(), rejected);
        return candidates;
    }

    /**
     * Off-run flags for one accepted swap, each checked on the date the received shift starts.
     * The received shift itself is left out of its new owner's schedule, otherwise its own start
     * date would always break the run.
     */
    OffRunAdvisory advisory(Map<String, List<Shift>> schedules, Shift traderShift, Shift counterShift) {
        SwapOutcome outcome = simulator.swap(schedules, traderShift, counterShift);

        boolean giverOnOffRun = receivesOnOffRun(outcome.scheduleA(), outcome.receivedByA());
        boolean recipientOnOffRun = receivesOnOffRun(outcome.scheduleB(), outcome.receivedByB());

        return new OffRunAdvisory(recipientOnOffRun, giverOnOffRun);
    }

    private boolean receivesOnOffRun(List<Shift> postSwapSchedule, Shift received) {
        List<Shift> otherShifts = postSwapSchedule.stream()
                .filter(shift -> !shift.getId().equals(received.getId()))
                .toList();
        return OffRunDetector.isInLongOffRun(
                otherShifts,
                received.getStart().toLocalDate(),
                config.getOffRunThresholdDays(),
                config.getOffRunLookbackGuard(),
                config.getOffRunLookaheadGuard());
    }
}
