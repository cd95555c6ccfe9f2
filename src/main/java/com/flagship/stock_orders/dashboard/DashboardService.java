package com.flagship.stock_orders.dashboard;

import com.flagship.stock_orders.dashboard.dto.DashboardStats;
import com.flagship.stock_orders.dashboard.dto.SaleItem;
import com.flagship.stock_orders.dashboard.dto.SaleRecord;
import com.flagship.stock_orders.dashboard.dto.SalesSummaryResponse;
import com.flagship.stock_orders.dashboard.dto.SalesTotals;
import com.flagship.stock_orders.exception.ValidationException;
import com.flagship.stock_orders.order.OrderEntity;
import com.flagship.stock_orders.order.OrderItemEntity;
import com.flagship.stock_orders.order.OrderLine;
import com.flagship.stock_orders.order.OrderRepository;
import com.flagship.stock_orders.order.OrderStatus;
import com.flagship.stock_orders.stock.StockItemRepository;
import com.flagship.stock_orders.user.UserRepository;
import com.flagship.stock_orders.user.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Read-only aggregates over users, stock and orders.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DashboardService {

    /** Stock items at or below this quantity count as low. */
    public static final int LOW_STOCK_THRESHOLD = 10;

    private final UserRepository userRepository;
    private final StockItemRepository stockItemRepository;
    private final OrderRepository orderRepository;

    @Transactional(readOnly = true)
    public DashboardStats stats() {
        return DashboardStats.builder()
            .totalUsers(userRepository.countByRoleNotAndActiveTrue(UserRole.ADMIN))
            .totalStockItems(stockItemRepository.count())
            .pendingOrders(orderRepository.countByStatus(OrderStatus.PENDING))
            .approvedOrders(orderRepository.countByStatus(OrderStatus.APPROVED))
            .lowStockItems(stockItemRepository.countByQuantityLessThanEqual(LOW_STOCK_THRESHOLD))
            .build();
    }

    /**
     * Revenue, cost and profit of approved orders.
     *
     * The date range applies only when both bounds are given. Both are UTC calendar
     * days and the end day is included in full.
     *
     * @throws ValidationException if the start date is after the end date
     */
    @Transactional(readOnly = true)
    public SalesSummaryResponse salesSummary(LocalDate startDate, LocalDate endDate) {
        List<OrderEntity> approved;
        if (startDate != null && endDate != null) {
            if (startDate.isAfter(endDate)) {
                throw new ValidationException(ValidationException.INVALID_VALUE,
                    "startDate must not be after endDate");
            }
            Instant from = startDate.atStartOfDay(ZoneOffset.UTC).toInstant();
            Instant to = endDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            approved = orderRepository.findAllWithItemsByStatusCreatedBetween(OrderStatus.APPROVED, from, to);
        } else {
            approved = orderRepository.findAllWithItemsByStatus(OrderStatus.APPROVED);
        }

        List<SaleRecord> sales = approved.stream().map(this::toSaleRecord).toList();

        BigDecimal revenue = sum(sales.stream().map(SaleRecord::getTotalAmount).toList());
        BigDecimal cost = sum(sales.stream().map(SaleRecord::getCost).toList());

        log.debug("Sales summary: {} approved orders between {} and {}", sales.size(), startDate, endDate);

        return SalesSummaryResponse.builder()
            .sales(sales)
            .summary(SalesTotals.builder()
                .totalRevenue(revenue)
                .totalCost(cost)
                .totalProfit(revenue.subtract(cost))
                .totalOrders(sales.size())
                .build())
            .build();
    }

    private SaleRecord toSaleRecord(OrderEntity order) {
        BigDecimal cost = sum(order.getItems().stream().map(DashboardService::lineCost).toList());
        return SaleRecord.builder()
            .id(order.getId())
            .customerName(order.getCustomerName())
            .customerContact(order.getCustomerContact())
            .salesRep(order.getSalesRep().getUsername())
            .totalAmount(order.getTotalAmount())
            .cost(cost)
            .profit(order.getTotalAmount().subtract(cost))
            .createdAt(order.getCreatedAt())
            .items(order.getItems().stream().map(DashboardService::toSaleItem).toList())
            .build();
    }

    private static BigDecimal lineCost(OrderItemEntity item) {
        return OrderLine.toMoneyScale(
            item.getStockItem().getBuyingPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
    }

    private static SaleItem toSaleItem(OrderItemEntity item) {
        return SaleItem.builder()
            .name(item.getStockItem().getName())
            .quantity(item.getQuantity())
            .unitPrice(item.getUnitPrice())
            .totalPrice(item.getTotalPrice())
            .build();
    }

    private static BigDecimal sum(List<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO.setScale(OrderLine.MONEY_SCALE), BigDecimal::add);
    }
}
