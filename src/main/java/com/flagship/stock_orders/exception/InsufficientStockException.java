package com.flagship.stock_orders.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised by settlement when the stock on hand no longer covers an order line.
 * Kept apart from {@link ValidationException} so a client can prompt for re-entry.
 */
@Getter
public class InsufficientStockException extends RuntimeException {

    private final UUID stockItemId;
    private final String stockItemName;
    private final int requestedQuantity;
    private final int availableQuantity;

    public InsufficientStockException(UUID stockItemId, String stockItemName,
                                      int requestedQuantity, int availableQuantity) {
        super(String.format("Insufficient stock for %s: requested %d, available %d",
                stockItemName, requestedQuantity, availableQuantity));
        this.stockItemId = stockItemId;
        this.stockItemName = stockItemName;
        this.requestedQuantity = requestedQuantity;
        this.availableQuantity = availableQuantity;
    }
}
