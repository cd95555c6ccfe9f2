package com.flagship.stock_orders.dashboard.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Headline counts for the dashboard. {@code totalUsers} excludes ADMIN and inactive accounts.
 */
@Value
@Builder
public class DashboardStats {
    long totalUsers;
    long totalStockItems;
    long pendingOrders;
    long approvedOrders;
    long lowStockItems;
}
