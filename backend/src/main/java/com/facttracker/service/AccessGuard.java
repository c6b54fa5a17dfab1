package com.facttracker.service;

import com.facttracker.entity.User;
import com.facttracker.exception.UnauthorizedException;
import com.facttracker.exception.UserNotFoundException;
import com.facttracker.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ownership check run before every ledger operation.
 *
 * The caller identity is the username from a verified JWT. It must equal the
 * stored username of the target user exactly; there is no admin override.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AccessGuard {

    private final UserRepository userRepository;

    /**
     * Loads the target user and confirms the caller owns it.
     *
     * @param callerIdentity verified username of the caller
     * @param targetUserId id of the user whose ledger is accessed
     * @return the loaded user record
     * @throws UnauthorizedException if the identity is missing or does not own the user
     * @throws UserNotFoundException if no user has the given id
     */
    public User authorize(String callerIdentity, Long targetUserId) {
        if (callerIdentity == null || callerIdentity.isBlank()) {
            log.warn("Ledger access attempted without caller identity: userId={}", targetUserId);
            throw UnauthorizedException.missingIdentity();
        }

        User user = userRepository.findById(targetUserId)
                .orElseThrow(() -> {
                    log.warn("Ledger access for non-existent user: userId={}, caller={}",
                            targetUserId, callerIdentity);
                    return new UserNotFoundException(targetUserId);
                });

        if (!callerIdentity.equals(user.getUsername())) {
            log.warn("Cross-user ledger access denied: userId={}, caller={}", targetUserId, callerIdentity);
            throw UnauthorizedException.crossUserAccess(targetUserId);
        }

        return user;
    }
}
