package com.example.shifttrade.service.exception;

public class ShiftNotFoundException extends RuntimeException {

    private final String shiftId;

    public ShiftNotFoundException(String shiftId) {
        super("Shift not found: " + shiftId);
        this.shiftId = shiftId;
    }

    public String getShiftId() {
        return shiftId;
    }
}
