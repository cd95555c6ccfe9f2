package com.flagship.stock_orders.order.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
@Jacksonized
public class OrderLineRequest {
    UUID stockItemId;
    Integer quantity;
    BigDecimal sellingPrice;
}
