package com.flagship.stock_orders.dashboard.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SalesSummaryResponse {
    List<SaleRecord> sales;
    SalesTotals summary;
}
