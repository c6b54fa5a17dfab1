package com.facttracker.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FactTimestamps Unit Tests")
class FactTimestampsTest {

    @Test
    @DisplayName("parse accepts the wire form, fractional seconds, offsets and zone-less values")
    void testParse_AcceptedForms() {
        // Act & Assert
        assertEquals(Instant.parse("2026-03-10T12:00:00Z"), FactTimestamps.parse("2026-03-10T12:00:00Z").orElseThrow());
        assertEquals(Instant.parse("2024-01-15T10:30:00.123456Z"),
                FactTimestamps.parse("2024-01-15T10:30:00.123456").orElseThrow());
        assertEquals(Instant.parse("2026-03-10T10:00:00Z"),
                FactTimestamps.parse("2026-03-10T12:00:00+02:00").orElseThrow());
    }

    @Test
    @DisplayName("parse rejects impossible calendar dates instead of adjusting them")
    void testParse_ImpossibleDate() {
        // Act & Assert
        assertEquals(Optional.empty(), FactTimestamps.parse("2024-02-30T10:00:00Z"));
        assertEquals(Optional.empty(), FactTimestamps.parse("2025-02-29T10:00:00"));
        assertTrue(FactTimestamps.parse("2024-02-29T10:00:00Z").isPresent());
    }

    @Test
    @DisplayName("parse rejects instants outside years 0001-9999")
    void testParse_OutOfRangeYears() {
        // Act & Assert
        assertEquals(Optional.empty(), FactTimestamps.parse("+999999999-12-31T23:59:59-18:00"));
        assertEquals(Optional.empty(), FactTimestamps.parse("-999999999-01-01T00:00:00+18:00"));
        assertEquals(Optional.empty(), FactTimestamps.parse("+10000-01-01T00:00:00Z"));
        assertTrue(FactTimestamps.parse("9999-12-31T23:59:59Z").isPresent());
    }

    @Test
    @DisplayName("every parsed value can be formatted back to the wire form")
    void testFormat_AfterParse() {
        // Act & Assert
        assertEquals("9999-12-31T23:59:59Z",
                FactTimestamps.format(FactTimestamps.parse("9999-12-31T23:59:59Z").orElseThrow()));
        assertEquals("0001-01-01T00:00:00Z",
                FactTimestamps.format(FactTimestamps.parse("0001-01-01T00:00:00").orElseThrow()));
    }

    @Test
    @DisplayName("parseDate reads yyyy-MM-dd and rejects anything else")
    void testParseDate() {
        // Act & Assert
        assertEquals(LocalDate.of(2026, 3, 10), FactTimestamps.parseDate("2026-03-10").orElseThrow());
        assertEquals(Optional.empty(), FactTimestamps.parseDate("2026-02-30"));
        assertEquals(Optional.empty(), FactTimestamps.parseDate(null));
    }
}
