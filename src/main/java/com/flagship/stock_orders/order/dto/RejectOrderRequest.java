package com.flagship.stock_orders.order.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class RejectOrderRequest {
    String rejectionReason;
}
