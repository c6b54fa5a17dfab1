package com.facttracker.dto.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Response DTO for a user's streak and activity statistics.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "current_streak": 3,
 *   "longest_streak": 7,
 *   "total_facts_count": 42,
 *   "facts_this_week": 5,
 *   "last_activity_date": "2024-01-15"
 * }
 * </pre>
 *
 * {@code facts_this_week} is computed from the ledger on every request and
 * covers the seven calendar days ending today, both ends inclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserStatsResponse {

    @JsonProperty("current_streak")
    private int currentStreak;

    @JsonProperty("longest_streak")
    private int longestStreak;

    @JsonProperty("total_facts_count")
    private int totalFactsCount;

    @JsonProperty("facts_this_week")
    private int factsThisWeek;

    @JsonProperty("last_activity_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate lastActivityDate;
}
