package com.example.shifttrade.dto;

import java.util.List;

public record TradeOptionsResponse(ShiftView traderShift, List<CandidateView> candidates) {
}
