package com.facttracker.service;

import com.facttracker.dto.response.UserStatsResponse;
import com.facttracker.entity.FactEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

/**
 * Builds the statistics view of a user from stored counters and the ledger.
 *
 * Stored counters pass through unchanged. {@code facts_this_week} is always
 * recomputed from the ledger and never stored. Entry dates are taken in the
 * zone of the injected {@link Clock}, the server's single reference calendar.
 */
@Component
@RequiredArgsConstructor
public class UserStatsAggregator {

    static final int WEEK_WINDOW_DAYS = 7;

    private final Clock clock;

    /**
     * Aggregates the statistics view.
     *
     * @param ledger the decoded ledger
     * @param currentStreak stored current streak, possibly null
     * @param longestStreak stored longest streak, possibly null
     * @param totalFactsCount stored total count, possibly null
     * @param lastActivityRaw stored last activity date text, possibly null or malformed
     * @param referenceToday the last day of the weekly window
     * @return the statistics view
     */
    public UserStatsResponse aggregate(List<FactEntry> ledger,
                                       Integer currentStreak,
                                       Integer longestStreak,
                                       Integer totalFactsCount,
                                       String lastActivityRaw,
                                       LocalDate referenceToday) {
        return UserStatsResponse.builder()
                .currentStreak(currentStreak != null ? currentStreak : 0)
                .longestStreak(longestStreak != null ? longestStreak : 0)
                .totalFactsCount(totalFactsCount != null ? totalFactsCount : 0)
                .factsThisWeek(countFactsThisWeek(ledger, referenceToday))
                .lastActivityDate(FactTimestamps.parseDate(lastActivityRaw).orElse(null))
                .build();
    }

    /**
     * Counts entries learned within {@code [referenceToday - 6, referenceToday]}.
     * Entries with an unparsable timestamp are not counted.
     *
     * @param ledger the decoded ledger
     * @param referenceToday the last day of the window
     * @return the number of entries in the window
     */
    public int countFactsThisWeek(List<FactEntry> ledger, LocalDate referenceToday) {
        ZoneId zone = clock.getZone();
        LocalDate windowStart = referenceToday.minusDays(WEEK_WINDOW_DAYS - 1);

        int count = 0;
        for (FactEntry entry : ledger) {
            Optional<Instant> learnedAt = FactTimestamps.parse(entry.getLearnedAt());
            if (learnedAt.isEmpty()) {
                continue;
            }
            LocalDate learnedOn = LocalDate.ofInstant(learnedAt.get(), zone);
            if (!learnedOn.isBefore(windowStart) && !learnedOn.isAfter(referenceToday)) {
                count++;
            }
        }
        return count;
    }
}
