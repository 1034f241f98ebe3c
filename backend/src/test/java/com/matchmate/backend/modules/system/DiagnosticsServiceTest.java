package com.matchmate.backend.modules.system;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import javax.sql.DataSource;

import com.matchmate.backend.modules.system.application.DiagnosticsService;
import com.matchmate.backend.modules.system.presentation.dto.DiagnosticsResponse;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.mock.env.MockEnvironment;

@ExtendWith(MockitoExtension.class)
class DiagnosticsServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    @Mock
    private HealthEndpoint healthEndpoint;

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private DatabaseMetaData metaData;

    @Mock
    private ResultSet tables;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void reportsConnectedDatabaseAndWhetherTheUrlIsSet() throws SQLException {
        when(healthEndpoint.health()).thenReturn(Health.up().build());
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metaData);
        when(connection.getCatalog()).thenReturn("matchmate");
        when(metaData.getTables(isNull(), eq("public"), eq("%"), any(String[].class))).thenReturn(tables);
        when(tables.next()).thenReturn(true, true, false);
        when(tables.getString("TABLE_NAME")).thenReturn("app_user", "swipe");
        MockEnvironment environment = new MockEnvironment()
                .withProperty("DATABASE_URL", "postgresql://user:secret@db:5432/matchmate");

        DiagnosticsResponse response = new DiagnosticsService(healthEndpoint, dataSource, environment, clock).diagnose();

        assertThat(response.database()).isEqualTo("UP");
        assertThat(response.databaseUrl()).isEqualTo("Set");
        assertThat(response.databaseName()).isEqualTo("matchmate");
        assertThat(response.connectionStatus()).isEqualTo("Connected");
        assertThat(response.tables()).containsExactly("app_user", "swipe");
        assertThat(response.timestamp()).isEqualTo("2025-01-01T00:00:00Z");
    }

    @Test
    void missingDatabaseUrlVariableIsReportedAsNotSet() throws SQLException {
        when(healthEndpoint.health()).thenReturn(Health.up().build());
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.getTables(isNull(), eq("public"), eq("%"), any(String[].class))).thenReturn(tables);
        when(tables.next()).thenReturn(false);

        DiagnosticsResponse response =
                new DiagnosticsService(healthEndpoint, dataSource, new MockEnvironment(), clock).diagnose();

        assertThat(response.databaseUrl()).isEqualTo("Not Set");
        assertThat(response.tables()).isEmpty();
    }

    @Test
    void connectionFailureIsReportedInTheBody() throws SQLException {
        when(healthEndpoint.health()).thenReturn(Health.down().build());
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        DiagnosticsResponse response =
                new DiagnosticsService(healthEndpoint, dataSource, new MockEnvironment(), clock).diagnose();

        assertThat(response.backend()).isEqualTo("running");
        assertThat(response.database()).isEqualTo("error: Connection refused");
        assertThat(response.databaseUrl()).isNull();
        assertThat(response.databaseName()).isNull();
        assertThat(response.connectionStatus()).isEqualTo("Not Connected");
        assertThat(response.tables()).isEmpty();
    }
}
