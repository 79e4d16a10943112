package com.example.shifttrade.dto;

import com.example.shifttrade.model.OffRunAdvisory;
import com.example.shifttrade.model.ReasonCode;
import com.example.shifttrade.model.TradeCandidate;

public record CandidateView(String counterpartyOwner,
                            ShiftView counterpartyShift,
                            ReasonCode reason,
                            OffRunAdvisory advisory,
                            boolean vacationHint) {

    public static CandidateView from(TradeCandidate candidate) {
        return new CandidateView(
                candidate.counterpartyOwner(),
                ShiftView.from(candidate.counterpartyShift()),
                candidate.reason(),
                candidate.advisory(),
                candidate.advisory().any()
        );
    }
}
