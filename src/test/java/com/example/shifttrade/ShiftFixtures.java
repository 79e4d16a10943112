package com.example.shifttrade;

import com.example.shifttrade.config.TradeConfig;
import com.example.shifttrade.model.Shift;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class ShiftFixtures {

    public static final ZoneId ZONE = ZoneId.of("America/New_York");

    private ShiftFixtures() {
    }

    public static ZonedDateTime at(String localDateTime) {
        return LocalDateTime.parse(localDateTime).atZone(ZONE);
    }

    public static Shift shift(String owner, String title, String start, long hours) {
        ZonedDateTime begin = at(start);
        return Shift.of(owner, title, begin, begin.plusHours(hours), true);
    }

    public static Shift ineligible(String owner, String title, String start, long hours) {
        ZonedDateTime begin = at(start);
        return Shift.of(owner, title, begin, begin.plusHours(hours), false);
    }

    public static Map<String, List<Shift>> schedules(Shift... shifts) {
        Map<String, List<Shift>> grouped = new HashMap<>();
        for (Shift shift : shifts) {
            grouped.computeIfAbsent(shift.getOwner(), owner -> new ArrayList<>()).add(shift);
        }
        grouped.values().forEach(list -> list.sort(Comparator.comparing(s -> s.getStart().toInstant())));
        return grouped;
    }

    public static TradeConfig config() {
        TradeConfig config = new TradeConfig();
        config.setZone(ZONE);
        return config;
    }

    public static Clock fixedClock(String localDateTime) {
        return Clock.fixed(at(localDateTime).toInstant(), ZONE);
    }
}
