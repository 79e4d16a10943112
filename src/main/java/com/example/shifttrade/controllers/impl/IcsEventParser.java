package com.example.shifttrade.controllers.impl;

import com.example.shifttrade.dto.RawEvent;
import com.example.shifttrade.service.exception.CalendarSourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Component;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.model.property.DateProperty;
import net.fortuna.ical4j.model.property.Duration;
import net.fortuna.ical4j.util.CompatibilityHints;
import net.fortuna.ical4j.util.MapTimeZoneCache;

import java.io.IOException;
import java.io.StringReader;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAmount;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps the VEVENTs of an iCalendar document to raw events. Recurrences are not expanded:
 * each VEVENT yields exactly one event.
 */
@Slf4j
public final class IcsEventParser {

    static {
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_PARSING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_UNFOLDING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_VALIDATION, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_OUTLOOK_COMPATIBILITY, true);

        System.setProperty("net.fortuna.ical4j.timezone.cache.impl", MapTimeZoneCache.class.getName());
    }

    private IcsEventParser() {
    }

    public static List<RawEvent> parse(String sourceName, String icsContent) {
        Calendar calendar;
        try {
            calendar = new CalendarBuilder().build(new StringReader(icsContent));
        } catch (IOException | ParserException e) {
            throw new CalendarSourceUnavailableException(sourceName, "unparseable calendar: " + e.getMessage(), e);
        }

        List<VEvent> vEvents = calendar.getComponents(Component.VEVENT);
        List<RawEvent> events = new ArrayList<>(vEvents.size());
        for (VEvent vEvent : vEvents) {
            try {
                events.add(toRawEvent(vEvent));
            } catch (RuntimeException e) {
                log.warn("Skipping unreadable event in {}: {}", sourceName, e.getMessage());
            }
        }
        return events;
    }

    static RawEvent toRawEvent(VEvent vEvent) {
        Temporal start = dateOf(vEvent, Property.DTSTART).orElse(null);
        Temporal end = dateOf(vEvent, Property.DTEND).orElse(null);
        TemporalAmount duration = vEvent.<Duration>getProperty(Property.DURATION)
                .map(Duration::getDuration)
                .orElse(null);
        String title = vEvent.<Property>getProperty(Property.SUMMARY)
                .map(Property::getValue)
                .orElse("");
        return new RawEvent(start, end, duration, title);
    }

    private static Optional<Temporal> dateOf(VEvent vEvent, String propertyName) {
        return vEvent.<DateProperty<?>>getProperty(propertyName)
                .map(property -> (Temporal) property.getDate());
    }
}
