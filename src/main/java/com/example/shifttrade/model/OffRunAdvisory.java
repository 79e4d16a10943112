package com.example.shifttrade.model;

/**
 * Non-blocking hints attached to an accepted swap.
 *
 * @param recipientOnOffRun the counter-party receives the trader's shift on a day inside a long off-run
 * @param giverOnOffRun     the trader receives the counter-shift on a day inside a long off-run
 */
public record OffRunAdvisory(boolean recipientOnOffRun, boolean giverOnOffRun) {

    public boolean any() {
        return recipientOnOffRun || giverOnOffRun;
    }
}
