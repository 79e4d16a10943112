package com.example.shifttrade.dto;

import java.util.List;

public record ShiftListResponse(List<String> people, List<ShiftView> shifts) {

    public static ShiftListResponse empty() {
        return new ShiftListResponse(List.of(), List.of());
    }
}
