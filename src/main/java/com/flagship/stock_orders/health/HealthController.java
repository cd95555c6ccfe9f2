package com.flagship.stock_orders.health;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;

/**
 * Unauthenticated readiness check. The service is UP only when the database
 * answers a ping and every Flyway migration has been applied, since the order
 * tables and their CHECK constraints come from those migrations.
 */
@RestController
@Slf4j
public class HealthController {

    static final String SERVICE_NAME = "stock-orders";

    private final DataSource dataSource;
    private final ObjectProvider<Flyway> flyway;

    public HealthController(DataSource dataSource, ObjectProvider<Flyway> flyway) {
        this.dataSource = dataSource;
        this.flyway = flyway;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthStatus> health() {
        HealthStatus.HealthStatusBuilder body = HealthStatus.builder()
            .service(SERVICE_NAME)
            .timestamp(Instant.now());

        if (!pingDatabase()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body.status("DOWN").database("DOWN").build());
        }
        body.database("UP");

        Flyway migrations = flyway.getIfAvailable();
        if (migrations == null) {
            return ResponseEntity.ok(body.status("UP").build());
        }

        try {
            MigrationInfoService info = migrations.info();
            MigrationInfo current = info.current();
            int pending = info.pending().length;
            body.schemaVersion(current == null ? null : current.getVersion().getVersion())
                .pendingMigrations(pending);

            if (current == null || pending > 0) {
                log.warn("Schema not migrated: current={}, pending={}",
                    current == null ? "none" : current.getVersion(), pending);
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body.status("DOWN").build());
            }
            return ResponseEntity.ok(body.status("UP").build());
        } catch (FlywayException e) {
            log.warn("Schema version lookup failed: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body.status("DOWN").build());
        }
    }

    private boolean pingDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
