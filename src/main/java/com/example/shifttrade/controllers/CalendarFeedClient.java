package com.example.shifttrade.controllers;

import com.example.shifttrade.config.RosterProperties.CalendarSource;
import com.example.shifttrade.dto.RawEvent;

import java.util.List;

public interface CalendarFeedClient {

    /**
     * All events of one roster member's calendar, unfiltered.
     *
     * @throws com.example.shifttrade.service.exception.CalendarSourceUnavailableException the feed could not be fetched or parsed
     */
    List<RawEvent> fetchEvents(CalendarSource source);
}
