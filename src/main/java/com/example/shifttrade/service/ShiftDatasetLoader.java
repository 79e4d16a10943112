package com.example.shifttrade.service;

import com.example.shifttrade.config.RosterProperties;
import com.example.shifttrade.config.RosterProperties.CalendarSource;
import com.example.shifttrade.controllers.CalendarFeedClient;
import com.example.shifttrade.dto.RawEvent;
import com.example.shifttrade.model.ScheduleSnapshot;
import com.example.shifttrade.service.exception.CalendarSourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches every roster calendar and builds a fresh snapshot. A calendar that cannot be
 * fetched or parsed is skipped; its owner stays on the roster with no shifts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShiftDatasetLoader {

    private final RosterProperties roster;
    private final CalendarFeedClient feedClient;
    private final ScheduleBuilder scheduleBuilder;
    private final InstantNormalizer normalizer;

    public ScheduleSnapshot load() {
        List<String> people = new ArrayList<>();
        Map<String, List<RawEvent>> rawEventsByPerson = new LinkedHashMap<>();

        for (CalendarSource source : roster.getCalendars()) {
            people.add(source.getName());
            try {
                List<RawEvent> events = feedClient.fetchEvents(source);
                rawEventsByPerson.computeIfAbsent(source.getName(), name -> new ArrayList<>()).addAll(events);
                log.debug("Calendar {} supplied {} event(s)", source.getName(), events.size());
            } catch (CalendarSourceUnavailableException e) {
                log.warn("Skipping calendar {}: {}", source.getName(), e.getMessage());
            }
        }

        return scheduleBuilder.build(people, rawEventsByPerson, normalizer.futureCutoff());
    }
}
