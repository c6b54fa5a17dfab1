package com.facttracker.service;

import com.facttracker.entity.FactEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FactLedgerCodec Unit Tests")
class FactLedgerCodecTest {

    private FactLedgerCodec codec;

    @BeforeEach
    void setUp() {
        codec = new FactLedgerCodec(new ObjectMapper());
    }

    @Test
    @DisplayName("decode reads null, blank and garbage as an empty ledger")
    void testDecode_MalformedInputs() {
        // Act & Assert
        assertTrue(codec.decode(null).isEmpty());
        assertTrue(codec.decode("").isEmpty());
        assertTrue(codec.decode("   ").isEmpty());
        assertTrue(codec.decode("{not json").isEmpty());
        assertTrue(codec.decode("{\"content\":\"x\"}").isEmpty());
        assertTrue(codec.decode("42").isEmpty());
        assertTrue(codec.decode("null").isEmpty());
        assertTrue(codec.decode("{}").isEmpty());
        assertTrue(codec.decode("[1,2]").isEmpty());
    }

    @Test
    @DisplayName("decode skips elements that are not objects")
    void testDecode_SkipsNonObjects() {
        // Arrange
        String raw = "[\"stray\", 7, null, {\"content\":\"kept\",\"learned_at\":\"2026-03-01T10:00:00Z\"}]";

        // Act
        List<FactEntry> entries = codec.decode(raw);

        // Assert
        assertEquals(1, entries.size());
        assertEquals("kept", entries.get(0).getContent());
    }

    @Test
    @DisplayName("decode fills missing fields with null and unknown fields are ignored")
    void testDecode_MissingAndUnknownFields() {
        // Arrange
        String raw = "[{\"content\":\"x\",\"mood\":\"happy\"}, {\"category\":\"sleep\"}]";

        // Act
        List<FactEntry> entries = codec.decode(raw);

        // Assert
        assertEquals(2, entries.size());
        assertNull(entries.get(0).getCategory());
        assertNull(entries.get(0).getSourceUrl());
        assertNull(entries.get(0).getLearnedAt());
        assertEquals("", entries.get(1).getContent());
        assertEquals("sleep", entries.get(1).getCategory());
    }

    @Test
    @DisplayName("decode keeps legacy timestamps with fractional seconds readable")
    void testDecode_FractionalTimestamp() {
        // Arrange
        String raw = "[{\"content\":\"x\",\"learned_at\":\"2024-01-15T10:30:00.123456\"}]";

        // Act
        List<FactEntry> entries = codec.decode(raw);

        // Assert
        assertEquals(Instant.parse("2024-01-15T10:30:00.123456Z"),
                FactTimestamps.parse(entries.get(0).getLearnedAt()).orElseThrow());
    }

    @Test
    @DisplayName("encode writes snake_case keys and keeps absent optionals as null")
    void testEncode_WireKeys() {
        // Arrange
        FactEntry entry = FactEntry.builder()
                .content("Water boils at lower temperatures at altitude")
                .learnedAt("2026-03-10T12:00:00Z")
                .build();

        // Act
        String encoded = codec.encode(List.of(entry));

        // Assert
        assertTrue(encoded.startsWith("["));
        assertTrue(encoded.contains("\"source_url\":null"));
        assertTrue(encoded.contains("\"category\":null"));
        assertTrue(encoded.contains("\"learned_at\":\"2026-03-10T12:00:00Z\""));
        assertEquals(List.of(entry), codec.decode(encoded));
    }

    @Test
    @DisplayName("re-encoding a mixed legacy ledger keeps every well-formed entry in stored order")
    void testEncode_PreservesMixedLegacyLedger() {
        // Arrange
        String raw = "["
                + "{\"content\":\"newest\",\"category\":\"diet\",\"learned_at\":\"2026-03-09T08:00:00Z\"},"
                + "{\"content\":\"legacy\",\"source_url\":\"https://example.org/a\",\"learned_at\":\"2024-01-15T10:30:00.123456\"},"
                + "\"stray\","
                + "{\"content\":\"middle\",\"category\":\"sleep\",\"learned_at\":\"2025-06-01T12:00:00+02:00\"},"
                + "{\"content\":\"undated\"}"
                + "]";
        List<FactEntry> decoded = codec.decode(raw);

        // Act
        List<FactEntry> reDecoded = codec.decode(codec.encode(decoded));

        // Assert
        assertEquals(4, decoded.size());
        assertEquals(decoded, reDecoded);
        assertEquals("newest", reDecoded.get(0).getContent());
        assertEquals("diet", reDecoded.get(0).getCategory());
        assertEquals("https://example.org/a", reDecoded.get(1).getSourceUrl());
        assertEquals("2024-01-15T10:30:00.123456", reDecoded.get(1).getLearnedAt());
        assertEquals(Instant.parse("2024-01-15T10:30:00.123456Z"),
                FactTimestamps.parse(reDecoded.get(1).getLearnedAt()).orElseThrow());
        assertEquals("2025-06-01T12:00:00+02:00", reDecoded.get(2).getLearnedAt());
        assertNull(reDecoded.get(3).getLearnedAt());
    }
}
