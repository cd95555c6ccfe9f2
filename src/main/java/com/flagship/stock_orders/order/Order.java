package com.flagship.stock_orders.order;

import com.flagship.stock_orders.exception.InvalidTransitionException;
import com.flagship.stock_orders.exception.ValidationException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Order domain object and its state machine.
 *
 * Instances are immutable: a transition returns a new Order with the new
 * status. Only PENDING orders can transition, and only once.
 * The total amount is fixed when the order is placed.
 */
@Value
public class Order {
    UUID id;
    String customerName;
    String customerContact;
    OrderStatus status;
    BigDecimal totalAmount;
    String rejectionReason;
    UUID salesRepId;
    String salesRepUsername;
    List<OrderLine> lines;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new PENDING order from a validated draft.
     */
    public static Order place(UUID salesRepId, OrderDraft draft) {
        Instant now = Instant.now();
        return new Order(
            UUID.randomUUID(),
            draft.getCustomerName(),
            draft.getCustomerContact(),
            OrderStatus.PENDING,
            draft.getTotalAmount(),
            null,
            salesRepId,
            null,
            List.copyOf(draft.getLines()),
            now,
            now
        );
    }

    /**
     * Transitions the order to APPROVED. Stock settlement is the caller's job.
     *
     * @throws InvalidTransitionException if the order is not PENDING
     */
    public Order approve() {
        requireTransition(OrderStatus.APPROVED);
        return withStatus(OrderStatus.APPROVED, null);
    }

    /**
     * Transitions the order to REJECTED, recording why.
     *
     * @throws ValidationException if the reason is blank
     * @throws InvalidTransitionException if the order is not PENDING
     */
    public Order reject(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new ValidationException(ValidationException.MISSING_REASON, "Rejection reason is required");
        }
        requireTransition(OrderStatus.REJECTED);
        return withStatus(OrderStatus.REJECTED, reason.trim());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isOwnedBy(UUID userId) {
        return salesRepId != null && salesRepId.equals(userId);
    }

    private void requireTransition(OrderStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id,
                String.format("Order %s is not pending (status %s); cannot move to %s", id, status, target));
        }
    }

    private Order withStatus(OrderStatus newStatus, String reason) {
        return new Order(
            id,
            customerName,
            customerContact,
            newStatus,
            totalAmount,
            reason,
            salesRepId,
            salesRepUsername,
            lines,
            createdAt,
            Instant.now()
        );
    }
}
