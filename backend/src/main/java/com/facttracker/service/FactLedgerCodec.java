package com.facttracker.service;

import com.facttracker.entity.FactEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * JSON codec for the {@code facts_learned} column.
 *
 * Decoding never fails: corrupt history must not block new activity, so an
 * absent, blank, non-JSON or non-array value decodes to an empty ledger and
 * individual elements that are not JSON objects are skipped. Decoded entries
 * always have non-null content ({@code ""} when the stored element had none).
 *
 * @see com.facttracker.entity.FactEntry
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FactLedgerCodec {

    private final ObjectMapper objectMapper;

    /**
     * Decodes the stored ledger.
     *
     * @param raw the stored column value, possibly null
     * @return the entries in stored order; empty on any malformed input
     */
    public List<FactEntry> decode(String raw) {
        if (raw == null || raw.isBlank()) {
            return Collections.emptyList();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Stored fact ledger is not valid JSON, reading as empty: {}", e.getOriginalMessage());
            return Collections.emptyList();
        }

        if (root == null || !root.isArray()) {
            log.warn("Stored fact ledger is not a JSON array, reading as empty");
            return Collections.emptyList();
        }

        List<FactEntry> entries = new ArrayList<>(root.size());
        int skipped = 0;
        for (JsonNode element : root) {
            FactEntry entry = decodeElement(element);
            if (entry == null) {
                skipped++;
                continue;
            }
            entries.add(entry);
        }

        if (skipped > 0) {
            log.warn("Skipped {} malformed fact ledger element(s)", skipped);
        }
        return entries;
    }

    /**
     * Encodes a ledger as a compact JSON array.
     *
     * @param entries the entries in append order
     * @return the column value
     */
    public String encode(List<FactEntry> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize fact ledger", e);
        }
    }

    private FactEntry decodeElement(JsonNode element) {
        if (element == null || !element.isObject()) {
            return null;
        }
        try {
            FactEntry entry = objectMapper.treeToValue(element, FactEntry.class);
            if (entry.getContent() == null) {
                entry.setContent("");
            }
            return entry;
        } catch (JsonProcessingException e) {
            log.debug("Fact ledger element could not be mapped: {}", e.getOriginalMessage());
            return null;
        }
    }
}
