package com.example.shifttrade.dto;

public record RecheckRequest(String shiftIdA, String shiftIdB) {
}
