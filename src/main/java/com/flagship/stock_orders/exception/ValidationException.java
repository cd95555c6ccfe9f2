package com.flagship.stock_orders.exception;

import lombok.Getter;

/**
 * Caller input is malformed or references something that does not exist.
 *
 * The code is surfaced verbatim to the caller as the {@code error} field
 * of the response body, with a 400 status.
 */
@Getter
public class ValidationException extends RuntimeException {

    public static final String MISSING_FIELDS = "missing_fields";
    public static final String STOCK_NOT_FOUND = "stock_not_found";
    public static final String INSUFFICIENT_STOCK = "insufficient_stock";
    public static final String INVALID_PRICE = "invalid_price";
    public static final String INVALID_VALUE = "invalid_value";
    public static final String MISSING_REASON = "missing_reason";
    public static final String DUPLICATE_NAME = "duplicate_name";
    public static final String DUPLICATE_USERNAME = "duplicate_username";
    public static final String INVALID_ROLE = "invalid_role";

    private final String code;

    public ValidationException(String code, String message) {
        super(message);
        this.code = code;
    }
}
