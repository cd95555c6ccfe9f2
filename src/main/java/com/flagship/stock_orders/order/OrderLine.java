package com.flagship.stock_orders.order;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * One line of an order. The unit price is a snapshot taken at intake and is
 * never re-read from the stock item afterwards.
 */
@Value
public class OrderLine {

    /**
     * Scale of every stored money column.
     */
    public static final int MONEY_SCALE = 4;

    UUID id;
    int lineNumber;
    UUID stockItemId;
    String stockItemName;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal totalPrice;

    public static OrderLine create(int lineNumber, UUID stockItemId, String stockItemName,
                                   int quantity, BigDecimal unitPrice) {
        if (quantity < 1) {
            throw new IllegalArgumentException("Line quantity must be at least 1");
        }
        // Totals are derived from the stored price, so a reloaded order adds up the same way.
        BigDecimal storedPrice = toMoneyScale(unitPrice);
        return new OrderLine(
            UUID.randomUUID(),
            lineNumber,
            stockItemId,
            stockItemName,
            quantity,
            storedPrice,
            storedPrice.multiply(BigDecimal.valueOf(quantity))
        );
    }

    public static BigDecimal toMoneyScale(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
