package com.example.shifttrade.model;

public record TradeCandidate(String counterpartyOwner, Shift counterpartyShift, ReasonCode reason, OffRunAdvisory advisory) {
}
