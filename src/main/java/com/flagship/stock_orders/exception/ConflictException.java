package com.flagship.stock_orders.exception;

import lombok.Getter;

/**
 * The request is well-formed but clashes with existing data.
 */
@Getter
public class ConflictException extends RuntimeException {

    public static final String STOCK_IN_USE = "stock_in_use";

    private final String code;

    public ConflictException(String code, String message) {
        super(message);
        this.code = code;
    }
}
