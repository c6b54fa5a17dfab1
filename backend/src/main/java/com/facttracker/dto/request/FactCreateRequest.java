package com.facttracker.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for recording a learned fact.
 *
 * Validation:
 * - content must not be blank, at most 2000 characters
 * - category is optional, at most 100 characters
 * - source_url is optional, at most 2048 characters
 *
 * Blank optional fields are stored as absent. The timestamp is assigned by
 * the server; clients cannot supply it.
 *
 * Example JSON request:
 * <pre>
 * {
 *   "content": "Adults need 7-9 hours of sleep",
 *   "category": "sleep",
 *   "source_url": "https://example.org/sleep"
 * }
 * </pre>
 *
 * @see com.facttracker.dto.response.FactResponse
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FactCreateRequest {

    public static final int MAX_CONTENT_LENGTH = 2000;
    public static final int MAX_CATEGORY_LENGTH = 100;
    public static final int MAX_SOURCE_URL_LENGTH = 2048;

    @NotBlank(message = "Content is required")
    @Size(max = MAX_CONTENT_LENGTH, message = "Content must be at most 2000 characters")
    private String content;

    @Size(max = MAX_CATEGORY_LENGTH, message = "Category must be at most 100 characters")
    private String category;

    @JsonProperty("source_url")
    @Size(max = MAX_SOURCE_URL_LENGTH, message = "Source URL must be at most 2048 characters")
    private String sourceUrl;
}
