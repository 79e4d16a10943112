package com.example.shifttrade.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a swap simulation. Every code except {@link #OK} is a rejection.
 * The A/B prefix names the side that failed; {@link #category()} drops it.
 */
public enum ReasonCode {

    OK("ok", Category.OK),
    INELIGIBLE_TITLE("ineligible-title", Category.ELIGIBILITY),
    SAME_PERSON("same-person", Category.SAME_PERSON),
    B_NOT_FREE_FOR_A("B-not-free-for-A", Category.AVAILABILITY),
    A_NOT_FREE_FOR_B("A-not-free-for-B", Category.AVAILABILITY),
    A_BREAK_RULE("A-break-rule", Category.REST),
    B_BREAK_RULE("B-break-rule", Category.REST),
    A_WEEKLY_CAP("A-weekly-cap", Category.WEEKLY_CAP),
    B_WEEKLY_CAP("B-weekly-cap", Category.WEEKLY_CAP);

    private final String code;
    private final Category category;

    ReasonCode(String code, Category category) {
        this.code = code;
        this.category = category;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public Category category() {
        return category;
    }

    public enum Category { OK, ELIGIBILITY, SAME_PERSON, AVAILABILITY, REST, WEEKLY_CAP }
}
