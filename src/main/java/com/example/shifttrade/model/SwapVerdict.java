package com.example.shifttrade.model;

public record SwapVerdict(boolean ok, ReasonCode reason) {

    private static final SwapVerdict ACCEPTED = new SwapVerdict(true, ReasonCode.OK);

    public static SwapVerdict accepted() {
        return ACCEPTED;
    }

    public static SwapVerdict rejected(ReasonCode reason) {
        if (reason == ReasonCode.OK) {
            throw new IllegalArgumentException("A rejection needs a failing reason code");
        }
        return new SwapVerdict(false, reason);
    }
}
