package com.flagship.stock_orders.order.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.stock_orders.order.Order;
import com.flagship.stock_orders.order.OrderStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Order as returned by the API. {@code salesRep} (the creator's username)
 * is only filled in for callers who can see other people's orders.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {
    UUID id;
    String customerName;
    String customerContact;
    OrderStatus status;
    BigDecimal totalAmount;
    String rejectionReason;
    UUID salesRepId;
    String salesRep;
    List<OrderItemResponse> orderItems;
    Instant createdAt;
    Instant updatedAt;

    public static OrderResponse from(Order order, boolean includeSalesRep) {
        return OrderResponse.builder()
            .id(order.getId())
            .customerName(order.getCustomerName())
            .customerContact(order.getCustomerContact())
            .status(order.getStatus())
            .totalAmount(order.getTotalAmount())
            .rejectionReason(order.getRejectionReason())
            .salesRepId(order.getSalesRepId())
            .salesRep(includeSalesRep ? order.getSalesRepUsername() : null)
            .orderItems(order.getLines().stream().map(OrderItemResponse::from).toList())
            .createdAt(order.getCreatedAt())
            .updatedAt(order.getUpdatedAt())
            .build();
    }
}
