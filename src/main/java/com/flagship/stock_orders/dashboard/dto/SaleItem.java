package com.flagship.stock_orders.dashboard.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SaleItem {
    String name;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal totalPrice;
}
