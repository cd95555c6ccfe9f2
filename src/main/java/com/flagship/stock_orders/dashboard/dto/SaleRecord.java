package com.flagship.stock_orders.dashboard.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One approved order with its cost and profit.
 * Cost is priced at the stock items' current buying prices.
 */
@Value
@Builder
public class SaleRecord {
    UUID id;
    String customerName;
    String customerContact;
    String salesRep;
    BigDecimal totalAmount;
    BigDecimal cost;
    BigDecimal profit;
    Instant createdAt;
    List<SaleItem> items;
}
