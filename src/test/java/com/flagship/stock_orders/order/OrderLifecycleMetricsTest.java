package com.flagship.stock_orders.order;

import com.flagship.stock_orders.exception.ValidationException;
import com.flagship.stock_orders.observability.OrderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Outcome tags recorded by the lifecycle service when intake or rejection fails.
 */
@ExtendWith(MockitoExtension.class)
class OrderLifecycleMetricsTest {

    @Mock
    private OrderIntakeValidator intakeValidator;

    @Mock
    private OrderPersistenceService persistenceService;

    @Mock
    private OrderSettlementService settlementService;

    private SimpleMeterRegistry registry;
    private OrderLifecycleService lifecycleService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        lifecycleService = new OrderLifecycleService(
            intakeValidator, persistenceService, settlementService, new OrderMetrics(registry));
    }

    private double count(String name, String outcome) {
        Counter counter = registry.find(name).tag("outcome", outcome).counter();
        return counter == null ? 0 : counter.count();
    }

    private Order createOrder() {
        return lifecycleService.createOrder(UUID.randomUUID(), "Acme Ltd", "acme@example.com",
            List.of(new RequestedLine(UUID.randomUUID(), 1, BigDecimal.ONE)));
    }

    @Test
    @DisplayName("Unexpected intake failure is counted as an error and rethrown")
    void unexpectedIntakeFailureCountsAsError() {
        when(intakeValidator.validate(anyString(), anyString(), anyList()))
            .thenThrow(new IllegalStateException("connection reset"));

        IllegalStateException e = assertThrows(IllegalStateException.class, this::createOrder);

        assertEquals("connection reset", e.getMessage());
        assertEquals(1.0, count("orders.created", OrderMetrics.ERROR));
        assertEquals(0.0, count("orders.created", OrderMetrics.VALIDATION_ERROR));
        assertEquals(0.0, count("orders.created", OrderMetrics.SUCCESS));
        verifyNoInteractions(persistenceService);
    }

    @Test
    @DisplayName("Validation failure keeps its own outcome tag")
    void validationFailureCountsAsValidationError() {
        when(intakeValidator.validate(anyString(), anyString(), anyList()))
            .thenThrow(new ValidationException(ValidationException.MISSING_FIELDS, "items are required"));

        assertThrows(ValidationException.class, this::createOrder);

        assertEquals(1.0, count("orders.created", OrderMetrics.VALIDATION_ERROR));
        assertEquals(0.0, count("orders.created", OrderMetrics.ERROR));
    }

    @Test
    @DisplayName("Unexpected rejection failure is counted as an error and rethrown")
    void unexpectedRejectionFailureCountsAsError() {
        when(persistenceService.findEntityForUpdate(any(UUID.class)))
            .thenThrow(new IllegalStateException("lock timeout"));

        assertThrows(IllegalStateException.class,
            () -> lifecycleService.reject(UUID.randomUUID(), "Customer cancelled"));

        assertEquals(1.0, count("orders.rejected", OrderMetrics.ERROR));
    }
}
