package com.flagship.stock_orders.order.dto;

import com.flagship.stock_orders.order.RequestedLine;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Body of {@code POST /api/orders}. Fields are checked by order intake,
 * not by bean validation, so that failures carry intake's error codes.
 */
@Value
@Builder
@Jacksonized
public class CreateOrderRequest {
    String customerName;
    String customerContact;
    List<OrderLineRequest> items;

    public List<RequestedLine> toRequestedLines() {
        if (items == null) {
            return List.of();
        }
        return items.stream()
            .map(item -> item == null
                ? new RequestedLine(null, null, null)
                : new RequestedLine(item.getStockItemId(), item.getQuantity(), item.getSellingPrice()))
            .toList();
    }
}
