package com.flagship.stock_orders.dashboard.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class SalesTotals {
    BigDecimal totalRevenue;
    BigDecimal totalCost;
    BigDecimal totalProfit;
    int totalOrders;
}
