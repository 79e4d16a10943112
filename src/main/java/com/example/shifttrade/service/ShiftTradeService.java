package com.example.shifttrade.service;

import com.example.shifttrade.dto.ShiftListResponse;
import com.example.shifttrade.dto.TradeOptionsResponse;
import com.example.shifttrade.model.SwapVerdict;

public interface ShiftTradeService {

    /** Every future shift and the full roster. Never fails; an unusable dataset yields an empty result. */
    ShiftListResponse listFutureShifts();

    /**
     * Legal counter-shifts for one of the trader's own future shifts.
     *
     * @throws com.example.shifttrade.service.exception.ShiftNotFoundException       no such future shift owned by the trader
     * @throws com.example.shifttrade.service.exception.InvalidTradeRequestException missing ids or an untradable trader shift
     */
    TradeOptionsResponse findTradeCandidates(String traderOwner, String traderShiftId);

    /**
     * Re-runs the swap checks against current data, typically right before a trade is offered.
     *
     * @throws com.example.shifttrade.service.exception.ShiftNotFoundException either id no longer resolves
     */
    SwapVerdict recheckSwap(String shiftIdA, String shiftIdB);
}
