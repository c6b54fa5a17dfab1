package com.facttracker.service;

import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Computes the next streak state when a user records activity.
 *
 * Rules, given the stored state and today's date:
 * <ul>
 *   <li>No previous activity: streak starts at 1</li>
 *   <li>Already active today: streak unchanged (at least 1)</li>
 *   <li>Active yesterday: streak + 1</li>
 *   <li>Gap of two days or more, or a last date in the future: streak resets to 1</li>
 * </ul>
 * The longest streak never decreases. Absent counters read as 0 and an
 * unparsable stored date reads as "no previous activity".
 */
@Component
public class StreakCalculator {

    /**
     * Computes the streak state after an activity on {@code today}, reading the
     * last activity date from its stored text form.
     *
     * @param currentStreak stored current streak, possibly null
     * @param longestStreak stored longest streak, possibly null
     * @param lastActivityRaw stored {@code yyyy-MM-dd} text, possibly null or malformed
     * @param today the reference date of the activity
     * @return the new streak state
     */
    public StreakState computeNewStreak(Integer currentStreak, Integer longestStreak,
                                        String lastActivityRaw, LocalDate today) {
        return computeNewStreak(currentStreak, longestStreak,
                FactTimestamps.parseDate(lastActivityRaw).orElse(null), today);
    }

    /**
     * Computes the streak state after an activity on {@code today}.
     *
     * @param currentStreak stored current streak, possibly null
     * @param longestStreak stored longest streak, possibly null
     * @param lastActivity date of the previous activity, or null if none
     * @param today the reference date of the activity
     * @return the new streak state
     */
    public StreakState computeNewStreak(Integer currentStreak, Integer longestStreak,
                                        LocalDate lastActivity, LocalDate today) {
        int current = currentStreak != null ? currentStreak : 0;
        int longest = longestStreak != null ? longestStreak : 0;

        int newCurrent;
        if (lastActivity == null) {
            newCurrent = 1;
        } else if (lastActivity.equals(today)) {
            newCurrent = Math.max(current, 1);
        } else if (lastActivity.equals(today.minusDays(1))) {
            newCurrent = current + 1;
        } else {
            newCurrent = 1;
        }

        int newLongest = Math.max(longest, newCurrent);
        return new StreakState(newCurrent, newLongest, today);
    }

    /**
     * Streak counters after an activity.
     */
    public static class StreakState {

        private final int currentStreak;
        private final int longestStreak;
        private final LocalDate lastActivityDate;

        public StreakState(int currentStreak, int longestStreak, LocalDate lastActivityDate) {
            this.currentStreak = currentStreak;
            this.longestStreak = longestStreak;
            this.lastActivityDate = lastActivityDate;
        }

        public int getCurrentStreak() {
            return currentStreak;
        }

        public int getLongestStreak() {
            return longestStreak;
        }

        public LocalDate getLastActivityDate() {
            return lastActivityDate;
        }
    }
}
