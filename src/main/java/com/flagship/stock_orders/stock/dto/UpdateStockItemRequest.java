package com.flagship.stock_orders.stock.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Partial update; absent fields are left as they are.
 */
@Value
@Builder
@Jacksonized
public class UpdateStockItemRequest {
    Integer quantity;
    BigDecimal buyingPrice;
    BigDecimal sellingPrice;
}
