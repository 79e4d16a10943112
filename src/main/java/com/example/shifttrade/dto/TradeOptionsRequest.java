package com.example.shifttrade.dto;

public record TradeOptionsRequest(String traderOwner, String traderShiftId) {
}
