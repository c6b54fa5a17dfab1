package com.facttracker.repository;

import com.facttracker.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository interface for User entity operations.
 *
 * The ledger core only needs one-row reads by id and one-row writes; the
 * username lookup serves tooling and tests.
 *
 * Spring Data JPA will automatically implement this interface at runtime.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    /**
     * Find a user by their login name.
     *
     * @param username the login name to search for
     * @return Optional containing the user if found, empty otherwise
     */
    Optional<User> findByUsername(String username);
}
