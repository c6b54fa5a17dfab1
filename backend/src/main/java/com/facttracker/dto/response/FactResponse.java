package com.facttracker.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a single learned fact.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "content": "Adults need 7-9 hours of sleep",
 *   "category": "sleep",
 *   "source_url": null,
 *   "learned_at": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 *
 * {@code learned_at} is always in second precision with a {@code Z} suffix.
 * It is null only for legacy entries whose stored timestamp cannot be read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactResponse {

    private String content;

    private String category;

    @JsonProperty("source_url")
    private String sourceUrl;

    @JsonProperty("learned_at")
    private String learnedAt;
}
