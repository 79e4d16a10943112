package com.example.shifttrade.service.impl;

import com.example.shifttrade.dto.CandidateView;
import com.example.shifttrade.dto.ShiftListResponse;
import com.example.shifttrade.dto.ShiftView;
import com.example.shifttrade.dto.TradeOptionsResponse;
import com.example.shifttrade.model.ScheduleSnapshot;
import com.example.shifttrade.model.Shift;
import com.example.shifttrade.model.SwapVerdict;
import com.example.shifttrade.model.TradeCandidate;
import com.example.shifttrade.service.CandidateSearch;
import com.example.shifttrade.service.ScheduleSnapshotCache;
import com.example.shifttrade.service.ShiftDatasetLoader;
import com.example.shifttrade.service.ShiftTradeService;
import com.example.shifttrade.service.SwapSimulator;
import com.example.shifttrade.service.exception.InvalidTradeRequestException;
import com.example.shifttrade.service.exception.ShiftNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ShiftTradeServiceImpl implements ShiftTradeService {

    private final ScheduleSnapshotCache cache;
    private final ShiftDatasetLoader loader;
    private final SwapSimulator simulator;
    private final CandidateSearch candidateSearch;

    @Override
    public ShiftListResponse listFutureShifts() {
        try {
            ScheduleSnapshot snapshot = snapshot();
            List<ShiftView> shifts = snapshot.shifts().stream()
                    .map(ShiftView::from)
                    .toList();
            return new ShiftListResponse(snapshot.people(), shifts);
        } catch (RuntimeException e) {
            log.error("Failed to list future shifts: {}", e.getMessage(), e);
            return ShiftListResponse.empty();
        }
    }

    @Override
    public TradeOptionsResponse findTradeCandidates(String traderOwner, String traderShiftId) {
        if (isBlank(traderOwner) || isBlank(traderShiftId)) {
            throw new InvalidTradeRequestException("missing traderOwner or traderShiftId");
        }

        ScheduleSnapshot snapshot = snapshot();
        Shift traderShift = snapshot.findShift(traderShiftId)
                .filter(shift -> shift.isOwnedBy(traderOwner))
                .orElseThrow(() -> new ShiftNotFoundException(traderShiftId));

        if (!traderShift.isEligible()) {
            throw new InvalidTradeRequestException("shift '" + traderShift.getTitle() + "' is not tradable");
        }

        log.info("Searching trade candidates for {} shift {} ({})", traderOwner, traderShiftId, traderShift.getTitle());
        List<TradeCandidate> candidates = candidateSearch.findCandidates(
                snapshot.shifts(), snapshot.schedules(), traderShift);

        return new TradeOptionsResponse(
                ShiftView.from(traderShift),
                candidates.stream().map(CandidateView::from).toList()
        );
    }

    @Override
    public SwapVerdict recheckSwap(String shiftIdA, String shiftIdB) {
        if (isBlank(shiftIdA) || isBlank(shiftIdB)) {
            throw new InvalidTradeRequestException("missing shift ids");
        }

        ScheduleSnapshot snapshot = snapshot();
        Shift shiftA = snapshot.findShift(shiftIdA).orElseThrow(() -> new ShiftNotFoundException(shiftIdA));
        Shift shiftB = snapshot.findShift(shiftIdB).orElseThrow(() -> new ShiftNotFoundException(shiftIdB));

        SwapVerdict verdict = simulator.simulate(snapshot.schedules(), shiftA, shiftB);
        log.info("Recheck {} <-> {}: {}", shiftIdA, shiftIdB, verdict.reason().code());
        return verdict;
    }

    private ScheduleSnapshot snapshot() {
        return cache.get(loader::load);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
