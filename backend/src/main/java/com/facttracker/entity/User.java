package com.facttracker.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * User entity carrying the fact ledger and streak counters.
 *
 * The learned facts are kept as one serialized JSON array per user rather than
 * a row per fact. Every append replaces the whole {@code facts_learned} value
 * together with the counters in a single row update.
 *
 * Stored values are read leniently: {@code facts_learned} may hold legacy or
 * corrupt JSON and {@code last_activity_date} may hold text that is not a date.
 * Both degrade to "no history" instead of failing.
 *
 * Database Table: users
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_user_username", columnList = "username", unique = true)
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    /**
     * Login name. The caller identity carried by the JWT must equal this value
     * for any ledger operation on this user.
     */
    @Column(name = "username", nullable = false, unique = true, updatable = false, length = 150)
    private String username;

    /**
     * JSON array of {@link FactEntry} objects in append order.
     */
    @Column(name = "facts_learned", nullable = false, columnDefinition = "TEXT")
    private String factsLearned = "[]";

    @Column(name = "current_streak")
    private Integer currentStreak = 0;

    @Column(name = "longest_streak")
    private Integer longestStreak = 0;

    @Column(name = "total_facts_count")
    private Integer totalFactsCount = 0;

    /**
     * Date of the most recent append, formatted {@code yyyy-MM-dd}.
     * Kept as text so that a malformed legacy value can be read and ignored.
     */
    @Column(name = "last_activity_date", length = 32)
    private String lastActivityDate;

    /**
     * Row version for optimistic locking. Backstop for the per-user write lock.
     */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Constructor for creating a new user with an empty ledger.
     *
     * @param username the unique login name
     */
    public User(String username) {
        this.username = username;
    }
}
