package com.facttracker.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for a page of recent facts.
 *
 * {@code total} counts every fact matching the category filter, not just the
 * returned page, so clients can show "10 of 42".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactListResponse {

    /**
     * Facts ordered newest first.
     */
    private List<FactResponse> items;

    private int total;
}
