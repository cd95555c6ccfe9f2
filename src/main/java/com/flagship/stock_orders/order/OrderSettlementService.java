package com.flagship.stock_orders.order;

import com.flagship.stock_orders.exception.InsufficientStockException;
import com.flagship.stock_orders.exception.InvalidTransitionException;
import com.flagship.stock_orders.exception.NotFoundException;
import com.flagship.stock_orders.observability.CorrelationContext;
import com.flagship.stock_orders.observability.OrderMetrics;
import com.flagship.stock_orders.stock.StockItemEntity;
import com.flagship.stock_orders.stock.StockItemRepository;
import com.flagship.stock_orders.stock.StockLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Approves an order and removes its units from stock atomically.
 *
 * Key principles:
 * - The order row is locked first, then the stock rows in ascending id order
 * - Every line is checked against the locked rows before any stock changes
 * - Each decrement is conditional, so stock never goes below zero
 * - Any failure rolls back the status change and every decrement already made
 *
 * Two approvals of the same order serialize on the order lock; the second
 * finds the order APPROVED and fails with an invalid transition.
 * Two approvals of different orders sharing stock serialize on the stock
 * locks; the second sees the reduced quantities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderSettlementService {

    private final OrderPersistenceService persistenceService;
    private final StockItemRepository stockItemRepository;
    private final StockLedger stockLedger;
    private final OrderMetrics orderMetrics;

    /**
     * Settles a PENDING order against stock and marks it APPROVED.
     *
     * @return the approved order
     * @throws NotFoundException if the order does not exist
     * @throws InvalidTransitionException if the order is not PENDING
     * @throws InsufficientStockException if any stock item no longer covers its lines
     */
    @Transactional
    public Order settleOrder(UUID orderId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.ORDER_ID_MDC_KEY, orderId.toString());

        log.info("Attempting to settle order");

        try {
            OrderEntity entity = persistenceService.findEntityForUpdate(orderId)
                .orElseThrow(() -> NotFoundException.order(orderId));

            if (!entity.getStatus().canTransitionTo(OrderStatus.APPROVED)) {
                throw new InvalidTransitionException(orderId,
                    String.format("Order %s is not pending (status %s); cannot approve", orderId, entity.getStatus()));
            }

            Map<UUID, Integer> required = entity.requiredQuantities();

            // Lock before reading quantities; the rows must not be loaded earlier in this transaction.
            List<StockItemEntity> lockedItems = stockItemRepository.findAllByIdForUpdate(required.keySet());
            Map<UUID, StockItemEntity> lockedById = lockedItems.stream()
                .collect(Collectors.toMap(StockItemEntity::getId, Function.identity()));

            for (Map.Entry<UUID, Integer> entry : required.entrySet()) {
                StockItemEntity stockItem = lockedById.get(entry.getKey());
                if (stockItem == null) {
                    throw new IllegalStateException("Order " + orderId + " references missing stock item " + entry.getKey());
                }
                if (!stockItem.covers(entry.getValue())) {
                    throw new InsufficientStockException(stockItem.getId(), stockItem.getName(),
                        entry.getValue(), stockItem.getQuantity());
                }
            }

            int unitsSettled = 0;
            for (StockItemEntity stockItem : lockedItems) {
                int quantity = required.get(stockItem.getId());
                if (!stockLedger.decrement(stockItem.getId(), quantity)) {
                    throw new InsufficientStockException(stockItem.getId(), stockItem.getName(),
                        quantity, stockLedger.currentQuantity(stockItem.getId()));
                }
                unitsSettled += quantity;
            }

            Order approved = entity.toDomain().approve();
            entity.updateFromDomain(approved);
            OrderEntity saved = persistenceService.saveEntity(entity);

            long duration = System.currentTimeMillis() - startTime;
            orderMetrics.recordOrderApproved(OrderMetrics.SUCCESS);
            orderMetrics.recordUnitsSettled(unitsSettled);
            orderMetrics.recordSettlementDuration(Duration.ofMillis(duration));
            orderMetrics.recordLatency("approve", duration);

            log.info("Order settled: stockItems={}, units={}, total={}, duration={}ms",
                    lockedItems.size(), unitsSettled, saved.getTotalAmount(), duration);

            return saved.toDomain();

        } catch (InsufficientStockException e) {
            recordFailure(OrderMetrics.INSUFFICIENT_STOCK, startTime);
            log.warn("Order settlement refused: {}", e.getMessage());
            throw e;
        } catch (InvalidTransitionException e) {
            recordFailure(OrderMetrics.INVALID_TRANSITION, startTime);
            log.warn("Order settlement refused: {}", e.getMessage());
            throw e;
        } catch (NotFoundException e) {
            recordFailure(OrderMetrics.NOT_FOUND, startTime);
            throw e;
        } catch (RuntimeException e) {
            recordFailure(OrderMetrics.ERROR, startTime);
            log.error("Order settlement failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.ORDER_ID_MDC_KEY);
        }
    }

    private void recordFailure(String outcome, long startTime) {
        orderMetrics.recordOrderApproved(outcome);
        orderMetrics.recordLatency("approve", System.currentTimeMillis() - startTime);
    }
}
