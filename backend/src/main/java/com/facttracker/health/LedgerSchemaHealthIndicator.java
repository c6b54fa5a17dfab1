package com.facttracker.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reports whether the users table carries every ledger column.
 *
 * Exposed as the {@code ledgerSchema} component of {@code /actuator/health}.
 * DOWN lists the missing columns; a database that cannot be inspected is
 * DOWN with the error.
 */
@Component("ledgerSchema")
@Slf4j
@RequiredArgsConstructor
public class LedgerSchemaHealthIndicator implements HealthIndicator {

    static final String USERS_TABLE = "users";

    static final List<String> REQUIRED_COLUMNS = List.of(
            "facts_learned",
            "current_streak",
            "longest_streak",
            "total_facts_count",
            "last_activity_date"
    );

    private final DataSource dataSource;

    @Override
    public Health health() {
        Set<String> existing;
        try {
            existing = readColumns();
        } catch (SQLException e) {
            log.error("Cannot inspect ledger schema", e);
            return Health.down(e).build();
        }

        List<String> present = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (existing.contains(column)) {
                present.add(column);
            } else {
                missing.add(column);
            }
        }

        Health.Builder builder = missing.isEmpty() ? Health.up() : Health.down();
        if (!missing.isEmpty()) {
            log.warn("Ledger columns missing from {} table: {}", USERS_TABLE, missing);
        }
        return builder
                .withDetail("table", USERS_TABLE)
                .withDetail("present", present)
                .withDetail("missing", missing)
                .build();
    }

    private Set<String> readColumns() throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            try (ResultSet rs = metaData.getColumns(null, null, USERS_TABLE, null)) {
                while (rs.next()) {
                    columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
                }
            }
        }
        return columns;
    }
}
