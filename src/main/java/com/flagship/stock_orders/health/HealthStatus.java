package com.flagship.stock_orders.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Body of {@code GET /health}. Schema fields are omitted when the database is unreachable.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthStatus {
    String status;
    String service;
    Instant timestamp;
    String database;
    String schemaVersion;
    Integer pendingMigrations;
}
