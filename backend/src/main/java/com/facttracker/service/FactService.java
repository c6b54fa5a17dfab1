package com.facttracker.service;

import com.facttracker.dto.request.FactCreateRequest;
import com.facttracker.dto.response.FactListResponse;
import com.facttracker.dto.response.FactResponse;
import com.facttracker.dto.response.UserStatsResponse;
import com.facttracker.entity.FactEntry;
import com.facttracker.entity.User;
import com.facttracker.exception.BusyException;
import com.facttracker.exception.FactValidationException;
import com.facttracker.exception.StorageFailureException;
import com.facttracker.service.lock.UserWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Entry points for recording facts and reading a user's ledger and streaks.
 *
 * Every operation runs the {@link AccessGuard} first. Input checks that do not
 * need the user row (content, field lengths, page limit) run before it, so a
 * malformed request is rejected the same way whoever sends it.
 *
 * Add Flow:
 * 1. Validate content and optional field lengths, normalize blank optionals to null
 * 2. Check ownership of the target user
 * 3. Acquire the per-user write lock
 * 4. {@link FactLedgerWriter} reloads the row, appends, advances the streak, commits
 * 5. Release the lock
 *
 * Error Handling:
 * - Lock not acquired in time, or a concurrent row update detected: {@link BusyException}
 * - Any other database or transaction failure: {@link StorageFailureException}
 *
 * @see FactLedgerWriter
 * @see UserWriteLock
 */
@Service
@Slf4j
public class FactService {

    private final AccessGuard accessGuard;
    private final FactLedgerWriter factLedgerWriter;
    private final FactLedgerCodec factLedgerCodec;
    private final FactLedger factLedger;
    private final UserStatsAggregator userStatsAggregator;
    private final UserWriteLock userWriteLock;
    private final Clock clock;
    private final int defaultLimit;

    public FactService(AccessGuard accessGuard,
                       FactLedgerWriter factLedgerWriter,
                       FactLedgerCodec factLedgerCodec,
                       FactLedger factLedger,
                       UserStatsAggregator userStatsAggregator,
                       UserWriteLock userWriteLock,
                       Clock clock,
                       @Value("${app.facts.default-limit:50}") int defaultLimit) {
        this.accessGuard = accessGuard;
        this.factLedgerWriter = factLedgerWriter;
        this.factLedgerCodec = factLedgerCodec;
        this.factLedger = factLedger;
        this.userStatsAggregator = userStatsAggregator;
        this.userWriteLock = userWriteLock;
        this.clock = clock;
        this.defaultLimit = defaultLimit;
    }

    /**
     * Records a fact for {@code userId}, learned now.
     *
     * @param callerIdentity verified username of the caller
     * @param userId owner of the ledger
     * @param content fact text
     * @param category optional category; blank means absent
     * @param sourceUrl optional source link; blank means absent
     * @return the stored fact
     */
    public FactResponse addFact(String callerIdentity, Long userId,
                                String content, String category, String sourceUrl) {
        validateFact(content, category, sourceUrl);
        String normalizedCategory = blankToNull(category);
        String normalizedSourceUrl = blankToNull(sourceUrl);

        try {
            accessGuard.authorize(callerIdentity, userId);

            FactEntry entry = userWriteLock.executeLocked(userId, () ->
                    factLedgerWriter.appendFact(userId, content, normalizedCategory, normalizedSourceUrl));

            log.info("Fact recorded: userId={}, category={}", userId, normalizedCategory);
            return toResponse(entry);

        } catch (ConcurrencyFailureException e) {
            log.warn("Concurrent ledger update rejected: userId={}", userId);
            throw BusyException.concurrentUpdate(userId, e);

        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure while recording fact: userId={}", userId, e);
            throw new StorageFailureException("add-fact", userId, e);
        }
    }

    /**
     * Lists facts of {@code userId}, newest first, using the configured default limit.
     */
    public FactListResponse listFacts(String callerIdentity, Long userId, String category) {
        return listFacts(callerIdentity, userId, defaultLimit, category);
    }

    /**
     * Lists facts of {@code userId}, newest first.
     *
     * @param callerIdentity verified username of the caller
     * @param userId owner of the ledger
     * @param limit page size within [{@value FactLedger#MIN_LIMIT}, {@value FactLedger#MAX_LIMIT}]
     * @param category exact category to match; null or blank lists every category
     * @return at most {@code limit} facts plus the number that matched the filter
     */
    public FactListResponse listFacts(String callerIdentity, Long userId, int limit, String category) {
        factLedger.validateLimit(limit);

        User user = loadAuthorized(callerIdentity, userId, "list-facts");
        List<FactEntry> ledger = factLedgerCodec.decode(user.getFactsLearned());

        FactLedger.LedgerWindow window = factLedger.paginate(
                factLedger.sortByRecency(factLedger.filterByCategory(ledger, category)), limit);

        log.debug("Facts listed: userId={}, returned={}, total={}",
                userId, window.getItems().size(), window.getTotal());

        return FactListResponse.builder()
                .items(window.getItems().stream().map(this::toResponse).collect(Collectors.toList()))
                .total(window.getTotal())
                .build();
    }

    /**
     * Streak and count statistics of {@code userId}, with the weekly window ending today.
     *
     * @param callerIdentity verified username of the caller
     * @param userId owner of the ledger
     * @return the statistics view
     */
    public UserStatsResponse getStats(String callerIdentity, Long userId) {
        User user = loadAuthorized(callerIdentity, userId, "get-stats");

        return userStatsAggregator.aggregate(
                factLedgerCodec.decode(user.getFactsLearned()),
                user.getCurrentStreak(),
                user.getLongestStreak(),
                user.getTotalFactsCount(),
                user.getLastActivityDate(),
                LocalDate.now(clock));
    }

    private User loadAuthorized(String callerIdentity, Long userId, String operation) {
        try {
            return accessGuard.authorize(callerIdentity, userId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage failure during {}: userId={}", operation, userId, e);
            throw new StorageFailureException(operation, userId, e);
        }
    }

    private void validateFact(String content, String category, String sourceUrl) {
        if (content == null || content.trim().isEmpty()) {
            throw FactValidationException.emptyContent();
        }
        if (content.length() > FactCreateRequest.MAX_CONTENT_LENGTH) {
            throw FactValidationException.tooLong("content", FactCreateRequest.MAX_CONTENT_LENGTH);
        }
        if (category != null && category.length() > FactCreateRequest.MAX_CATEGORY_LENGTH) {
            throw FactValidationException.tooLong("category", FactCreateRequest.MAX_CATEGORY_LENGTH);
        }
        if (sourceUrl != null && sourceUrl.length() > FactCreateRequest.MAX_SOURCE_URL_LENGTH) {
            throw FactValidationException.tooLong("source_url", FactCreateRequest.MAX_SOURCE_URL_LENGTH);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private FactResponse toResponse(FactEntry entry) {
        return FactResponse.builder()
                .content(entry.getContent())
                .category(entry.getCategory())
                .sourceUrl(entry.getSourceUrl())
                .learnedAt(FactTimestamps.parse(entry.getLearnedAt()).map(FactTimestamps::format).orElse(null))
                .build();
    }
}
