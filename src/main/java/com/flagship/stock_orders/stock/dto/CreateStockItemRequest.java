package com.flagship.stock_orders.stock.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

@Value
@Builder
@Jacksonized
public class CreateStockItemRequest {

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    String name;

    @NotNull(message = "Quantity is required")
    Integer quantity;

    @NotNull(message = "Buying price is required")
    BigDecimal buyingPrice;

    BigDecimal sellingPrice;
}
