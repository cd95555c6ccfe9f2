package com.flagship.stock_orders.order;

import com.flagship.stock_orders.exception.InvalidTransitionException;
import com.flagship.stock_orders.exception.NotFoundException;
import com.flagship.stock_orders.exception.ValidationException;
import com.flagship.stock_orders.observability.CorrelationContext;
import com.flagship.stock_orders.observability.OrderMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Entry point for every order state change: creation, approval and rejection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderLifecycleService {

    private final OrderIntakeValidator intakeValidator;
    private final OrderPersistenceService persistenceService;
    private final OrderSettlementService settlementService;
    private final OrderMetrics orderMetrics;

    /**
     * Validates and stores a new PENDING order. Stock is not touched.
     */
    @Transactional
    public Order createOrder(UUID salesRepId, String customerName, String customerContact,
                             List<RequestedLine> lines) {
        long startTime = System.currentTimeMillis();
        try {
            OrderDraft draft = intakeValidator.validate(customerName, customerContact, lines);
            Order saved = persistenceService.save(Order.place(salesRepId, draft));

            MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, saved.getId().toString());
            orderMetrics.recordOrderCreated(OrderMetrics.SUCCESS);
            orderMetrics.recordLatency("create", System.currentTimeMillis() - startTime);
            log.info("Order created: lines={}, total={}", saved.getLines().size(), saved.getTotalAmount());
            return saved;
        } catch (ValidationException e) {
            orderMetrics.recordOrderCreated(OrderMetrics.VALIDATION_ERROR);
            log.warn("Order rejected at intake: code={}, message={}", e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            orderMetrics.recordOrderCreated(OrderMetrics.ERROR);
            log.error("Order creation failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    public Order approve(UUID orderId) {
        return settlementService.settleOrder(orderId);
    }

    /**
     * Moves a PENDING order to REJECTED. Stock is not touched.
     *
     * @throws ValidationException if the reason is blank
     * @throws NotFoundException if the order does not exist
     * @throws InvalidTransitionException if the order is not PENDING
     */
    @Transactional
    public Order reject(UUID orderId, String reason) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId.toString());
        try {
            if (reason == null || reason.isBlank()) {
                throw new ValidationException(ValidationException.MISSING_REASON, "Rejection reason is required");
            }

            OrderEntity entity = persistenceService.findEntityForUpdate(orderId)
                .orElseThrow(() -> NotFoundException.order(orderId));

            Order rejected = entity.toDomain().reject(reason);
            entity.updateFromDomain(rejected);
            OrderEntity saved = persistenceService.saveEntity(entity);

            orderMetrics.recordOrderRejected(OrderMetrics.SUCCESS);
            orderMetrics.recordLatency("reject", System.currentTimeMillis() - startTime);
            log.info("Order rejected: reason={}", rejected.getRejectionReason());
            return saved.toDomain();
        } catch (ValidationException e) {
            orderMetrics.recordOrderRejected(OrderMetrics.VALIDATION_ERROR);
            throw e;
        } catch (InvalidTransitionException e) {
            orderMetrics.recordOrderRejected(OrderMetrics.INVALID_TRANSITION);
            log.warn("Order rejection refused: {}", e.getMessage());
            throw e;
        } catch (NotFoundException e) {
            orderMetrics.recordOrderRejected(OrderMetrics.NOT_FOUND);
            throw e;
        } catch (RuntimeException e) {
            orderMetrics.recordOrderRejected(OrderMetrics.ERROR);
            log.error("Order rejection failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }
}
