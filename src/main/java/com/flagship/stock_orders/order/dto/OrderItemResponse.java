package com.flagship.stock_orders.order.dto;

import com.flagship.stock_orders.order.OrderLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class OrderItemResponse {
    UUID id;
    UUID stockItemId;
    String stockItemName;
    int quantity;
    BigDecimal unitPrice;
    BigDecimal totalPrice;

    public static OrderItemResponse from(OrderLine line) {
        return OrderItemResponse.builder()
            .id(line.getId())
            .stockItemId(line.getStockItemId())
            .stockItemName(line.getStockItemName())
            .quantity(line.getQuantity())
            .unitPrice(line.getUnitPrice())
            .totalPrice(line.getTotalPrice())
            .build();
    }
}
