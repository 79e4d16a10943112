package com.example.shifttrade.controllers.impl;

import com.example.shifttrade.config.RosterProperties.CalendarSource;
import com.example.shifttrade.controllers.CalendarFeedClient;
import com.example.shifttrade.dto.RawEvent;
import com.example.shifttrade.service.exception.CalendarSourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class IcsCalendarFeedClient implements CalendarFeedClient {

    private final RestTemplate restTemplate;

    @Override
    public List<RawEvent> fetchEvents(CalendarSource source) {
        String url = source.getUrl();
        if (url == null || url.isBlank()) {
            throw new CalendarSourceUnavailableException(source.getName(), "no url configured", null);
        }

        byte[] body;
        try {
            // iCalendar is always UTF-8, whatever charset the response declares
            body = restTemplate.getForObject(url, byte[].class);
        } catch (RestClientException e) {
            log.error("Failed to fetch calendar {}: {}", source.getName(), e.getMessage());
            throw new CalendarSourceUnavailableException(source.getName(), "fetch failed", e);
        }
        String ics = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        if (ics.isBlank()) {
            throw new CalendarSourceUnavailableException(source.getName(), "empty response", null);
        }

        return IcsEventParser.parse(source.getName(), ics);
    }
}
