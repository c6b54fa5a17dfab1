package com.facttracker.service;

import com.facttracker.entity.FactEntry;
import com.facttracker.entity.User;
import com.facttracker.exception.UserNotFoundException;
import com.facttracker.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Transactional read-modify-write of one user row for a fact append.
 *
 * Callers must hold the user's {@link com.facttracker.service.lock.UserWriteLock}
 * around {@link #appendFact}, so the lock is released only after this
 * transaction has committed or rolled back. The ledger, total count and streak
 * fields are written in one row update; a failure leaves all of them unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FactLedgerWriter {

    private final UserRepository userRepository;
    private final FactLedgerCodec factLedgerCodec;
    private final FactLedger factLedger;
    private final StreakCalculator streakCalculator;
    private final Clock clock;

    /**
     * Appends a fact learned now and advances the user's streak.
     *
     * @param userId the owner of the ledger
     * @param content the fact text, non-blank
     * @param category optional category, null when absent
     * @param sourceUrl optional source link, null when absent
     * @return the stored entry
     * @throws UserNotFoundException if the user row disappeared since the access check
     */
    @Transactional
    public FactEntry appendFact(Long userId, String content, String category, String sourceUrl) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
        LocalDate today = LocalDate.ofInstant(now, clock.getZone());

        FactEntry entry = FactEntry.builder()
                .content(content)
                .category(category)
                .sourceUrl(sourceUrl)
                .learnedAt(FactTimestamps.format(now))
                .build();

        List<FactEntry> ledger = factLedger.append(factLedgerCodec.decode(user.getFactsLearned()), entry);

        StreakCalculator.StreakState streak = streakCalculator.computeNewStreak(
                user.getCurrentStreak(), user.getLongestStreak(), user.getLastActivityDate(), today);

        int previousTotal = user.getTotalFactsCount() != null ? user.getTotalFactsCount() : 0;

        user.setFactsLearned(factLedgerCodec.encode(ledger));
        user.setTotalFactsCount(previousTotal + 1);
        user.setCurrentStreak(streak.getCurrentStreak());
        user.setLongestStreak(streak.getLongestStreak());
        user.setLastActivityDate(FactTimestamps.formatDate(streak.getLastActivityDate()));

        userRepository.saveAndFlush(user);

        log.debug("Ledger row updated: userId={}, entries={}, currentStreak={}, longestStreak={}",
                userId, ledger.size(), streak.getCurrentStreak(), streak.getLongestStreak());
        return entry;
    }
}
