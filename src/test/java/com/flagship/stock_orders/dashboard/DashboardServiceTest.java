package com.flagship.stock_orders.dashboard;

import com.flagship.stock_orders.dashboard.dto.DashboardStats;
import com.flagship.stock_orders.dashboard.dto.SaleRecord;
import com.flagship.stock_orders.dashboard.dto.SalesSummaryResponse;
import com.flagship.stock_orders.exception.ValidationException;
import com.flagship.stock_orders.order.Order;
import com.flagship.stock_orders.order.OrderLifecycleService;
import com.flagship.stock_orders.order.RequestedLine;
import com.flagship.stock_orders.stock.StockItemEntity;
import com.flagship.stock_orders.support.IntegrationTestSupport;
import com.flagship.stock_orders.user.UserEntity;
import com.flagship.stock_orders.user.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class DashboardServiceTest extends IntegrationTestSupport {

    @Autowired
    private DashboardService dashboardService;

    @Autowired
    private OrderLifecycleService lifecycleService;

    private UserEntity salesRep;

    @BeforeEach
    void setUp() {
        salesRep = createUser(UserRole.SALES_REPRESENTATIVE);
    }

    private Order placeOrder(StockItemEntity item, int quantity, String price) {
        return lifecycleService.createOrder(salesRep.getId(), "Acme Ltd", "acme@example.com",
            List.of(new RequestedLine(item.getId(), quantity, new BigDecimal(price))));
    }

    private StockItemEntity stockBoughtAt(String name, int quantity, String buyingPrice) {
        return stockService.createStockItem(name, quantity, new BigDecimal(buyingPrice), new BigDecimal("999.00"));
    }

    private static SaleRecord saleFor(SalesSummaryResponse summary, UUID orderId) {
        return summary.getSales().stream()
            .filter(sale -> sale.getId().equals(orderId))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No sale for order " + orderId));
    }

    @Test
    @DisplayName("Stats count active non-admin users, order statuses and low stock")
    void statsReflectCurrentState() {
        printTestHeader("Dashboard stats");
        createUser(UserRole.STORE_KEEPER);
        createUser(UserRole.ADMIN);
        UserEntity manager = createUser(UserRole.MANAGER);
        userService.updateStatus(manager.getId(), false);

        StockItemEntity plywood = createStock("Plywood", 20, "120.00");
        StockItemEntity nails = createStock("Nails", 11, "0.10");
        createStock("Screws", 5, "0.20");

        lifecycleService.approve(placeOrder(plywood, 12, "100").getId());
        placeOrder(nails, 1, "0.10");
        placeOrder(nails, 1, "0.10");
        lifecycleService.reject(placeOrder(nails, 1, "0.10").getId(), "Customer cancelled");

        DashboardStats stats = dashboardService.stats();

        printOutput("Stats", stats);
        assertEquals(2, stats.getTotalUsers(), "Sales rep and store keeper; admin and inactive manager excluded");
        assertEquals(3, stats.getTotalStockItems());
        assertEquals(2, stats.getPendingOrders());
        assertEquals(1, stats.getApprovedOrders());
        assertEquals(2, stats.getLowStockItems(), "Plywood settled down to 8 and Screws at 5");
        printSuccess("Counts match");
    }

    @Test
    @DisplayName("Sales summary covers approved orders only, costed at buying price")
    void salesSummaryTotals() {
        printTestHeader("Sales summary totals");
        StockItemEntity plywood = stockBoughtAt("Plywood", 10, "60.00");
        StockItemEntity nails = stockBoughtAt("Nails", 100, "0.50");

        Order plywoodOrder = lifecycleService.approve(placeOrder(plywood, 3, "100").getId());
        Order nailsOrder = lifecycleService.approve(placeOrder(nails, 10, "1.25").getId());
        placeOrder(plywood, 1, "100");

        SalesSummaryResponse summary = dashboardService.salesSummary(null, null);

        printOutput("Summary", summary.getSummary());
        assertEquals(2, summary.getSummary().getTotalOrders());
        assertEquals(2, summary.getSales().size());
        assertEquals(0, new BigDecimal("312.50").compareTo(summary.getSummary().getTotalRevenue()));
        assertEquals(0, new BigDecimal("185.00").compareTo(summary.getSummary().getTotalCost()));
        assertEquals(0, new BigDecimal("127.50").compareTo(summary.getSummary().getTotalProfit()));

        SaleRecord plywoodSale = saleFor(summary, plywoodOrder.getId());
        assertEquals(salesRep.getUsername(), plywoodSale.getSalesRep());
        assertEquals(0, new BigDecimal("180.00").compareTo(plywoodSale.getCost()));
        assertEquals(0, new BigDecimal("120.00").compareTo(plywoodSale.getProfit()));
        assertEquals("Plywood", plywoodSale.getItems().get(0).getName());
        assertEquals(3, plywoodSale.getItems().get(0).getQuantity());

        SaleRecord nailsSale = saleFor(summary, nailsOrder.getId());
        assertEquals(0, new BigDecimal("7.50").compareTo(nailsSale.getProfit()));
        printSuccess("Revenue, cost and profit add up");
    }

    @Test
    @DisplayName("Sales summary with no approved orders reports zeros")
    void emptySalesSummary() {
        SalesSummaryResponse summary = dashboardService.salesSummary(null, null);

        assertTrue(summary.getSales().isEmpty());
        assertEquals(0, summary.getSummary().getTotalOrders());
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.getSummary().getTotalRevenue()));
        assertEquals(0, BigDecimal.ZERO.compareTo(summary.getSummary().getTotalProfit()));
    }

    @Test
    @DisplayName("Date range includes the whole end day and excludes orders outside it")
    void salesSummaryDateRange() {
        StockItemEntity plywood = stockBoughtAt("Plywood", 10, "60.00");
        lifecycleService.approve(placeOrder(plywood, 1, "100").getId());
        LocalDate today = LocalDate.now(ZoneOffset.UTC);

        assertEquals(1, dashboardService.salesSummary(today.minusDays(1), today).getSummary().getTotalOrders());
        assertEquals(0, dashboardService.salesSummary(LocalDate.of(2000, 1, 1), LocalDate.of(2000, 1, 31))
            .getSummary().getTotalOrders());
        assertEquals(1, dashboardService.salesSummary(LocalDate.of(2000, 1, 1), null)
            .getSummary().getTotalOrders(), "A single bound is ignored");
    }

    @Test
    @DisplayName("Start date after end date is refused")
    void invertedDateRangeRefused() {
        LocalDate today = LocalDate.now(ZoneOffset.UTC);

        ValidationException e = assertThrows(ValidationException.class,
            () -> dashboardService.salesSummary(today, today.minusDays(1)));

        assertEquals(ValidationException.INVALID_VALUE, e.getCode());
    }
}
