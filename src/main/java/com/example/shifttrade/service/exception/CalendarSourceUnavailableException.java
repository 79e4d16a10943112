package com.example.shifttrade.service.exception;

public class CalendarSourceUnavailableException extends RuntimeException {

    private final String sourceName;

    public CalendarSourceUnavailableException(String sourceName, String message, Throwable cause) {
        super("Calendar " + sourceName + " unavailable: " + message, cause);
        this.sourceName = sourceName;
    }

    public String getSourceName() {
        return sourceName;
    }
}
