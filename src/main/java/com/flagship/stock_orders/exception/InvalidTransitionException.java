package com.flagship.stock_orders.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * An order status change was requested from a state that does not allow it.
 */
@Getter
public class InvalidTransitionException extends RuntimeException {

    private final UUID orderId;

    public InvalidTransitionException(UUID orderId, String message) {
        super(message);
        this.orderId = orderId;
    }
}
