package com.facttracker.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("LedgerSchemaHealthIndicator Unit Tests")
class LedgerSchemaHealthIndicatorTest {

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private DatabaseMetaData metaData;

    @Mock
    private ResultSet columns;

    @InjectMocks
    private LedgerSchemaHealthIndicator indicator;

    @BeforeEach
    void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
    }

    private void givenColumns(String... names) throws SQLException {
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getColumns(isNull(), isNull(), eq("users"), isNull())).thenReturn(columns);

        Boolean[] more = new Boolean[names.length];
        for (int i = 0; i < names.length; i++) {
            more[i] = i < names.length - 1;
        }
        if (names.length == 0) {
            when(columns.next()).thenReturn(false);
            return;
        }
        when(columns.next()).thenReturn(true, more);
        String[] rest = new String[names.length - 1];
        System.arraycopy(names, 1, rest, 0, rest.length);
        when(columns.getString("COLUMN_NAME")).thenReturn(names[0], rest);
    }

    @Test
    @DisplayName("all ledger columns present reports UP")
    void testHealth_AllPresent() throws SQLException {
        // Arrange
        givenColumns("id", "username", "FACTS_LEARNED", "current_streak", "longest_streak",
                "total_facts_count", "last_activity_date");

        // Act
        Health health = indicator.health();

        // Assert
        assertEquals(Status.UP, health.getStatus());
        assertEquals(List.of(), health.getDetails().get("missing"));
        verify(connection).close();
    }

    @Test
    @DisplayName("missing ledger columns report DOWN with their names")
    void testHealth_Missing() throws SQLException {
        // Arrange
        givenColumns("id", "username", "facts_learned", "current_streak");

        // Act
        Health health = indicator.health();

        // Assert
        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(List.of("longest_streak", "total_facts_count", "last_activity_date"),
                health.getDetails().get("missing"));
        assertEquals(List.of("facts_learned", "current_streak"), health.getDetails().get("present"));
    }

    @Test
    @DisplayName("a missing users table reports every column missing")
    void testHealth_NoTable() throws SQLException {
        // Arrange
        givenColumns();

        // Act
        Health health = indicator.health();

        // Assert
        assertEquals(Status.DOWN, health.getStatus());
        assertEquals(LedgerSchemaHealthIndicator.REQUIRED_COLUMNS, health.getDetails().get("missing"));
    }

    @Test
    @DisplayName("a database that cannot be inspected reports DOWN")
    void testHealth_DatabaseError() throws SQLException {
        // Arrange
        when(connection.getMetaData()).thenThrow(new SQLException("connection closed"));

        // Act
        Health health = indicator.health();

        // Assert
        assertEquals(Status.DOWN, health.getStatus());
        assertTrue(health.getDetails().containsKey("error"));
    }
}
