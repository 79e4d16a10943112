package com.example.shifttrade.model;

import org.junit.jupiter.api.Test;

import static com.example.shifttrade.ShiftFixtures.at;
import static com.example.shifttrade.ShiftFixtures.shift;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShiftIdTest {

    @Test
    void identicalShiftsShareTheSameId() {
        Shift first = shift("Alice", "Day 1", "2030-01-07T07:00", 12);
        Shift second = shift("Alice", "Day 1", "2030-01-07T07:00", 12);

        assertThat(first.getId()).isEqualTo(second.getId());
        assertThat(first.getId().value()).isEqualTo(second.getId().value());
        assertThat(first).isEqualTo(second);
    }

    @Test
    void titleOwnerAndIntervalAllChangeTheId() {
        Shift base = shift("Alice", "Day 1", "2030-01-07T07:00", 12);

        assertThat(shift("Alice", "Day 2", "2030-01-07T07:00", 12).getId()).isNotEqualTo(base.getId());
        assertThat(shift("Bob", "Day 1", "2030-01-07T07:00", 12).getId()).isNotEqualTo(base.getId());
        assertThat(shift("Alice", "Day 1", "2030-01-07T08:00", 12).getId()).isNotEqualTo(base.getId());
        assertThat(shift("Alice", "Day 1", "2030-01-07T07:00", 11).getId()).isNotEqualTo(base.getId());
    }

    @Test
    void reownedCopyGetsNewIdAndKeepsOriginalUntouched() {
        Shift original = shift("Alice", "Day 1", "2030-01-07T07:00", 12);
        String originalId = original.getId().value();

        Shift copy = original.reownedTo("Bob");

        assertThat(copy.getOwner()).isEqualTo("Bob");
        assertThat(copy.getId()).isNotEqualTo(original.getId());
        assertThat(copy.getId()).isEqualTo(shift("Bob", "Day 1", "2030-01-07T07:00", 12).getId());
        assertThat(copy.getStart()).isEqualTo(original.getStart());
        assertThat(original.getOwner()).isEqualTo("Alice");
        assertThat(original.getId().value()).isEqualTo(originalId);
    }

    @Test
    void valueIsUrlSafeEvenForUnusualOwnersAndTitles() {
        Shift shift = shift("Dr. O'Neil / ER", "Pod A-1 | side", "2030-01-07T07:00", 12);

        assertThat(shift.getId().value()).matches("[A-Za-z0-9_\\-]+\\.\\d+\\.\\d+\\.[0-9a-f]{16}");
    }

    @Test
    void emptyOrInvertedIntervalsAreRejected() {
        assertThatThrownBy(() -> Shift.of("Alice", "Day 1", at("2030-01-07T07:00"), at("2030-01-07T07:00"), true))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Shift.of("Alice", "Day 1", at("2030-01-07T07:00"), at("2030-01-07T06:00"), true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
