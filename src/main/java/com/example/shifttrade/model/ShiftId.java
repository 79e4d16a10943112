package com.example.shifttrade.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Structured shift key: owner, start, end and a hash of the title.
 * Two shifts with the same owner, interval and title always get the same id,
 * and re-owning a shift always changes it.
 */
public record ShiftId(String owner, Instant start, Instant end, String titleHash) {

    private static final int TITLE_HASH_BYTES = 8;

    public ShiftId {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(titleHash, "titleHash");
    }

    public static ShiftId of(String owner, Instant start, Instant end, String title) {
        return new ShiftId(owner, start, end, hashTitle(title == null ? "" : title));
    }

    /** Wire form: {@code base64url(owner).startEpochMinute.endEpochMinute.titleHash}. */
    public String value() {
        String encodedOwner = Base64.getUrlEncoder()
                .withoutPadding()
                .encodeToString(owner.getBytes(StandardCharsets.UTF_8));
        return encodedOwner + "." + start.getEpochSecond() / 60 + "." + end.getEpochSecond() / 60 + "." + titleHash;
    }

    @Override
    public String toString() {
        return value();
    }

    private static String hashTitle(String title) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(title.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, TITLE_HASH_BYTES);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
