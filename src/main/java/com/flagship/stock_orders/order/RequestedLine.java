package com.flagship.stock_orders.order;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Unvalidated order line as submitted by a sales representative.
 * Any field may be null; intake decides what is acceptable.
 */
@Value
public class RequestedLine {
    UUID stockItemId;
    Integer quantity;
    BigDecimal sellingPrice;
}
