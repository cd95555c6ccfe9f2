package com.flagship.stock_orders.exception;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException order(Object id) {
        return new NotFoundException("Order not found: " + id);
    }

    public static NotFoundException stockItem(Object id) {
        return new NotFoundException("Stock item not found: " + id);
    }

    public static NotFoundException user(Object id) {
        return new NotFoundException("User not found: " + id);
    }
}
