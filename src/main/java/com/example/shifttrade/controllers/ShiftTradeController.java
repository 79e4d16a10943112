package com.example.shifttrade.controllers;

import com.example.shifttrade.dto.RecheckRequest;
import com.example.shifttrade.dto.ShiftListResponse;
import com.example.shifttrade.dto.TradeOptionsRequest;
import com.example.shifttrade.dto.TradeOptionsResponse;
import com.example.shifttrade.model.SwapVerdict;
import com.example.shifttrade.service.ShiftTradeService;
import com.example.shifttrade.service.exception.ShiftNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
public class ShiftTradeController {

    private final ShiftTradeService tradeService;

    /** Future shifts of the whole roster. */
    @GetMapping("/shifts.json")
    public ShiftListResponse shifts() {
        return tradeService.listFutureShifts();
    }

    /** Legal counter-shifts for the trader's shift, earliest first. */
    @PostMapping("/trade-options")
    public TradeOptionsResponse tradeOptions(@RequestBody TradeOptionsRequest request) {
        return tradeService.findTradeCandidates(request.traderOwner(), request.traderShiftId());
    }

    /** Final check before a trade is offered; the data may have changed since the search. */
    @PostMapping("/trade-recheck")
    public ResponseEntity<?> tradeRecheck(@RequestBody RecheckRequest request) {
        try {
            SwapVerdict verdict = tradeService.recheckSwap(request.shiftIdA(), request.shiftIdB());
            return ResponseEntity.ok(verdict);
        } catch (ShiftNotFoundException e) {
            log.info("Recheck on vanished shift {}", e.getShiftId());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("ok", false, "reason", "not-found"));
        }
    }
}
