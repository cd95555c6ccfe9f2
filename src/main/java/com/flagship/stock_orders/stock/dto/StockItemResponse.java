package com.flagship.stock_orders.stock.dto;

import com.flagship.stock_orders.stock.StockItemEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class StockItemResponse {
    UUID id;
    String name;
    int quantity;
    BigDecimal buyingPrice;
    BigDecimal sellingPrice;
    Instant createdAt;
    Instant updatedAt;

    public static StockItemResponse from(StockItemEntity entity) {
        return StockItemResponse.builder()
            .id(entity.getId())
            .name(entity.getName())
            .quantity(entity.getQuantity())
            .buyingPrice(entity.getBuyingPrice())
            .sellingPrice(entity.getSellingPrice())
            .createdAt(entity.getCreatedAt())
            .updatedAt(entity.getUpdatedAt())
            .build();
    }
}
