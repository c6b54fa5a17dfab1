package com.facttracker.service;

import com.facttracker.entity.FactEntry;
import com.facttracker.exception.FactValidationException;
import com.facttracker.exception.InvalidArgumentException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operations over one user's fact ledger.
 *
 * All methods are pure and return new lists; the input list is never
 * modified. Storage order is append order, but queries must not rely on it:
 * readers sort by {@code learned_at} through {@link #sortByRecency(List)}.
 *
 * Typical read pipeline:
 * <pre>
 * filterByCategory → sortByRecency → paginate
 * </pre>
 */
@Component
public class FactLedger {

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 500;

    private static final Comparator<FactEntry> NEWEST_FIRST = Comparator
            .comparing((FactEntry entry) -> FactTimestamps.parse(entry.getLearnedAt()).orElse(Instant.MIN))
            .reversed();

    /**
     * Appends an entry to the end of the ledger.
     *
     * @param ledger the current entries
     * @param entry the entry to add
     * @return a new list holding the existing entries followed by {@code entry}
     * @throws FactValidationException if the entry content is null or blank
     */
    public List<FactEntry> append(List<FactEntry> ledger, FactEntry entry) {
        if (entry == null || entry.getContent() == null || entry.getContent().trim().isEmpty()) {
            throw FactValidationException.emptyContent();
        }
        List<FactEntry> updated = new ArrayList<>(ledger.size() + 1);
        updated.addAll(ledger);
        updated.add(entry);
        return updated;
    }

    /**
     * Keeps entries whose category equals {@code category} exactly (case-sensitive).
     *
     * @param ledger the entries to filter
     * @param category the category to match; null or blank disables filtering
     * @return matching entries in their original order
     */
    public List<FactEntry> filterByCategory(List<FactEntry> ledger, String category) {
        if (category == null || category.isBlank()) {
            return new ArrayList<>(ledger);
        }
        return ledger.stream()
                .filter(entry -> category.equals(entry.getCategory()))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Sorts entries newest first by {@code learned_at}.
     *
     * Entries with an absent or unparsable timestamp sort as the oldest
     * possible value. The sort is stable, so ties keep storage order.
     *
     * @param ledger the entries to sort
     * @return a sorted copy
     */
    public List<FactEntry> sortByRecency(List<FactEntry> ledger) {
        List<FactEntry> sorted = new ArrayList<>(ledger);
        sorted.sort(NEWEST_FIRST);
        return sorted;
    }

    /**
     * Cuts the first {@code limit} entries.
     *
     * @param ledger the (already filtered and sorted) entries
     * @param limit window size, within [{@value #MIN_LIMIT}, {@value #MAX_LIMIT}]
     * @return the window plus the size of {@code ledger}
     * @throws InvalidArgumentException if {@code limit} is out of range
     */
    public LedgerWindow paginate(List<FactEntry> ledger, int limit) {
        validateLimit(limit);
        int end = Math.min(limit, ledger.size());
        return new LedgerWindow(new ArrayList<>(ledger.subList(0, end)), ledger.size());
    }

    /**
     * Rejects page sizes outside [{@value #MIN_LIMIT}, {@value #MAX_LIMIT}].
     *
     * @param limit the requested page size
     * @throws InvalidArgumentException if {@code limit} is out of range
     */
    public void validateLimit(int limit) {
        if (limit < MIN_LIMIT || limit > MAX_LIMIT) {
            throw InvalidArgumentException.limitOutOfRange(limit, MIN_LIMIT, MAX_LIMIT);
        }
    }

    /**
     * A page of ledger entries together with the size of the list it was cut from.
     */
    public static class LedgerWindow {

        private final List<FactEntry> items;
        private final int total;

        public LedgerWindow(List<FactEntry> items, int total) {
            this.items = Collections.unmodifiableList(items);
            this.total = total;
        }

        public List<FactEntry> getItems() {
            return items;
        }

        /**
         * Number of entries before truncation, for "N of M" reporting.
         */
        public int getTotal() {
            return total;
        }
    }
}
