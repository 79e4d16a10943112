package com.example.shifttrade.dto;

import com.example.shifttrade.model.Shift;

import java.time.format.DateTimeFormatter;

public record ShiftView(String id, String owner, String title, String start, String end, boolean eligible) {

    /** ISO-8601 with explicit offset, seconds always present. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");

    public static ShiftView from(Shift shift) {
        return new ShiftView(
                shift.getId().value(),
                shift.getOwner(),
                shift.getTitle(),
                TIMESTAMP_FORMAT.format(shift.getStart()),
                TIMESTAMP_FORMAT.format(shift.getEnd()),
                shift.isEligible()
        );
    }
}
