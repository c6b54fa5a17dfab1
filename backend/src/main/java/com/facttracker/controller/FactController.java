package com.facttracker.controller;

import com.facttracker.dto.request.FactCreateRequest;
import com.facttracker.dto.response.FactListResponse;
import com.facttracker.dto.response.FactResponse;
import com.facttracker.dto.response.UserStatsResponse;
import com.facttracker.service.FactService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

/**
 * REST Controller for a user's fact ledger and streak statistics.
 *
 * All endpoints require JWT authentication. The caller identity is the JWT
 * subject (username); FactService rejects any request whose path user id
 * belongs to a different username.
 *
 * Endpoints:
 * - POST /api/users/{userId}/facts: record a fact learned now
 * - GET  /api/users/{userId}/facts: list facts, newest first
 * - GET  /api/users/{userId}/streaks: streak and count statistics
 *
 * Error Responses:
 * - 400 Bad Request: Invalid body, blank content or out-of-range limit
 * - 401 Unauthorized: Missing or invalid JWT token
 * - 403 Forbidden: Targeting another user's ledger
 * - 404 Not Found: Unknown user id
 * - 500 Internal Server Error: Storage failure
 * - 503 Service Unavailable: Concurrent update in progress, retry later
 *
 * All errors are handled by GlobalExceptionHandler and returned in RFC 7807 format.
 *
 * @see com.facttracker.service.FactService
 * @see com.facttracker.exception.GlobalExceptionHandler
 */
@RestController
@RequestMapping("/api/users/{userId}")
@RequiredArgsConstructor
@Slf4j
public class FactController {

    private final FactService factService;

    /**
     * Record a new fact for the user.
     *
     * Request Body:
     * <pre>
     * {
     *   "content": "Octopuses have three hearts",
     *   "category": "biology",
     *   "source_url": "https://example.org/octopus"
     * }
     * </pre>
     *
     * @param userId the ledger owner
     * @param request the fact to record
     * @param authentication the authenticated caller
     * @return 201 Created with the stored fact
     */
    @PostMapping("/facts")
    public ResponseEntity<FactResponse> addFact(
            @PathVariable Long userId,
            @Valid @RequestBody FactCreateRequest request,
            Authentication authentication) {

        String caller = callerOf(authentication);
        log.info("Add fact requested: userId={}, caller={}", userId, caller);

        FactResponse fact = factService.addFact(
                caller, userId, request.getContent(), request.getCategory(), request.getSourceUrl());

        return ResponseEntity.status(HttpStatus.CREATED).body(fact);
    }

    /**
     * List the user's facts, newest first.
     *
     * @param userId the ledger owner
     * @param limit optional page size (1-500); the configured default when omitted
     * @param category optional exact category filter
     * @param authentication the authenticated caller
     * @return 200 OK with the page and the number of matching facts
     */
    @GetMapping("/facts")
    public ResponseEntity<FactListResponse> listFacts(
            @PathVariable Long userId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String category,
            Authentication authentication) {

        String caller = callerOf(authentication);
        log.info("Facts requested: userId={}, caller={}, limit={}, category={}", userId, caller, limit, category);

        FactListResponse facts = limit != null
                ? factService.listFacts(caller, userId, limit, category)
                : factService.listFacts(caller, userId, category);

        log.info("Returning {} of {} facts for user: {}", facts.getItems().size(), facts.getTotal(), userId);
        return ResponseEntity.ok(facts);
    }

    /**
     * Streak statistics of the user.
     *
     * @param userId the ledger owner
     * @param authentication the authenticated caller
     * @return 200 OK with current/longest streak, totals and this week's count
     */
    @GetMapping("/streaks")
    public ResponseEntity<UserStatsResponse> getStreaks(
            @PathVariable Long userId,
            Authentication authentication) {

        String caller = callerOf(authentication);
        log.info("Streak statistics requested: userId={}, caller={}", userId, caller);

        return ResponseEntity.ok(factService.getStats(caller, userId));
    }

    private static String callerOf(Authentication authentication) {
        return authentication != null ? authentication.getName() : null;
    }
}
