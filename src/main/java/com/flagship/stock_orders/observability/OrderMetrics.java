package com.flagship.stock_orders.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for the order lifecycle.
 *
 * Metrics exposed:
 * - orders.created{outcome}: intake attempts
 * - orders.approved{outcome}: settlement attempts
 * - orders.rejected{outcome}: rejection attempts
 * - orders.latency{operation}: time per lifecycle operation
 * - stock.units.settled: units removed from stock by approvals
 */
@Component
public class OrderMetrics {

    public static final String SUCCESS = "success";
    public static final String INSUFFICIENT_STOCK = "insufficient_stock";
    public static final String INVALID_TRANSITION = "invalid_transition";
    public static final String VALIDATION_ERROR = "validation_error";
    public static final String NOT_FOUND = "not_found";
    public static final String ERROR = "error";

    private final MeterRegistry registry;
    private final Timer settlementTimer;

    public OrderMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.settlementTimer = Timer.builder("orders.settlement.duration")
                .description("Time taken to settle an approved order against stock")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordOrderCreated(String outcome) {
        registry.counter("orders.created", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordOrderApproved(String outcome) {
        registry.counter("orders.approved", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordOrderRejected(String outcome) {
        registry.counter("orders.rejected", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordUnitsSettled(int units) {
        registry.counter("stock.units.settled").increment(units);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("orders.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordSettlementDuration(Duration duration) {
        settlementTimer.record(duration);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
