package me.forma.organizer.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActivityDetailsParserTest {

    @Test
    void shouldExtractDestinationAfterFirstMarker() {
        assertEquals("Documents/Finance", ActivityDetailsParser.extractDestination("Moved to Documents/Finance"));
        assertEquals("~/Pictures/Screenshots",
                ActivityDetailsParser.extractDestination("Organized to ~/Pictures/Screenshots"));
        assertEquals("Archive", ActivityDetailsParser.extractDestination("Copied file to Archive"));
    }

    @Test
    void shouldMatchMarkersCaseInsensitivelyAndTrim() {
        assertEquals("Documents", ActivityDetailsParser.extractDestination("MOVED TO   Documents  "));
    }

    @Test
    void shouldReturnEmptyWhenNoMarkerPresent() {
        assertEquals("", ActivityDetailsParser.extractDestination("Deleted"));
        assertEquals("", ActivityDetailsParser.extractDestination(""));
        assertEquals("", ActivityDetailsParser.extractDestination(null));
    }

    @Test
    void shouldExtractRejectedDestination() {
        assertEquals("Desktop/Temp",
                ActivityDetailsParser.extractRejectedDestination("Skipped suggestion for Desktop/Temp"));
        assertEquals("Documents", ActivityDetailsParser.extractRejectedDestination("rejected Documents"));
        assertEquals("Music", ActivityDetailsParser.extractRejectedDestination("Skipped: Music"));
        assertEquals("", ActivityDetailsParser.extractRejectedDestination("Moved to Music"));
    }
}
