package com.example.shifttrade.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "roster")
public class RosterProperties {

    /** One calendar feed per roster member. */
    private List<CalendarSource> calendars = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CalendarSource {
        private String name;
        private String url;
    }
}
