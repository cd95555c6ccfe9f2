package com.flagship.stock_orders.order;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a successful intake: priced lines ready to become a PENDING order.
 */
@Value
public class OrderDraft {
    String customerName;
    String customerContact;
    List<OrderLine> lines;

    public BigDecimal getTotalAmount() {
        return lines.stream()
            .map(OrderLine::getTotalPrice)
            .reduce(BigDecimal.ZERO.setScale(OrderLine.MONEY_SCALE), BigDecimal::add);
    }
}
