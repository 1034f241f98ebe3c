package com.matchmate.backend.modules.system.application;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import javax.sql.DataSource;

import com.matchmate.backend.modules.system.presentation.dto.DiagnosticsResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Backs {@code GET /test}: reports whether the database answers and which tables it holds.
 * Failures are reported in the body rather than thrown.
 */
@Service
public class DiagnosticsService {

    static final String BACKEND_RUNNING = "running";
    static final String CONNECTED = "Connected";
    static final String NOT_CONNECTED = "Not Connected";
    static final String URL_SET = "Set";
    static final String URL_NOT_SET = "Not Set";
    static final String DATABASE_URL_VARIABLE = "DATABASE_URL";
    private static final int MAX_ERROR_LENGTH = 80;

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsService.class);

    private final HealthEndpoint healthEndpoint;
    private final DataSource dataSource;
    private final Environment environment;
    private final Clock clock;

    public DiagnosticsService(HealthEndpoint healthEndpoint, DataSource dataSource, Environment environment,
                              Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.dataSource = dataSource;
        this.environment = environment;
        this.clock = clock;
    }

    public DiagnosticsResponse diagnose() {
        String timestamp = Instant.now(clock).toString();
        String dbStatus = resolveDatabaseHealth();

        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            return new DiagnosticsResponse(
                    BACKEND_RUNNING,
                    dbStatus,
                    describeDatabaseUrl(),
                    connection.getCatalog(),
                    CONNECTED,
                    listTables(metaData),
                    timestamp
            );
        } catch (SQLException ex) {
            log.warn("Database diagnostics failed: {}", ex.getMessage());
            return new DiagnosticsResponse(
                    BACKEND_RUNNING,
                    "error: " + truncate(ex.getMessage()),
                    null,
                    null,
                    NOT_CONNECTED,
                    List.of(),
                    timestamp
            );
        }
    }

    private String resolveDatabaseHealth() {
        HealthComponent health = healthEndpoint.health();
        if (health instanceof CompositeHealth composite) {
            HealthComponent db = composite.getComponents().get("db");
            if (db != null) {
                return db.getStatus().getCode();
            }
        }
        return health.getStatus().getCode();
    }

    // only whether the variable is present; the URL itself may carry credentials
    private String describeDatabaseUrl() {
        return StringUtils.hasText(environment.getProperty(DATABASE_URL_VARIABLE)) ? URL_SET : URL_NOT_SET;
    }

    private List<String> listTables(DatabaseMetaData metaData) throws SQLException {
        List<String> tables = new ArrayList<>();
        try (ResultSet rs = metaData.getTables(null, "public", "%", new String[]{"TABLE"})) {
            while (rs.next()) {
                tables.add(rs.getString("TABLE_NAME"));
            }
        }
        return tables;
    }

    private String truncate(String message) {
        if (message == null) {
            return "unknown";
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
