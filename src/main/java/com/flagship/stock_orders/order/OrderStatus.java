package com.flagship.stock_orders.order;

/**
 * Order status. Transitions are one-way and happen at most once.
 */
public enum OrderStatus {
    /**
     * Created by a sales representative, awaiting a store keeper's decision.
     * Initial state for all orders.
     */
    PENDING,

    /**
     * Approved and settled against stock.
     * Terminal state - no further transitions allowed.
     */
    APPROVED,

    /**
     * Rejected with a reason; stock untouched.
     * Terminal state - no further transitions allowed.
     */
    REJECTED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(OrderStatus target) {
        return this == PENDING && target != PENDING;
    }
}
