package com.facttracker.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One learned fact inside a user's {@code facts_learned} JSON array.
 *
 * Not a JPA entity: entries live inside the serialized ledger column. The
 * {@code learnedAt} value is kept as the stored text so that legacy or
 * malformed timestamps survive a read/write cycle unchanged; parsing happens
 * in {@link com.facttracker.service.FactTimestamps}.
 *
 * Example stored element:
 * <pre>
 * {
 *   "content": "Sleep consolidates memory",
 *   "category": "sleep",
 *   "source_url": "https://example.org/article",
 *   "learned_at": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FactEntry {

    @JsonProperty("content")
    private String content;

    @JsonProperty("category")
    private String category;

    @JsonProperty("source_url")
    private String sourceUrl;

    @JsonProperty("learned_at")
    private String learnedAt;
}
