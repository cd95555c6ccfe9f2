package com.flagship.stock_orders.order;

import com.flagship.stock_orders.exception.InsufficientStockException;
import com.flagship.stock_orders.exception.InvalidTransitionException;
import com.flagship.stock_orders.exception.NotFoundException;
import com.flagship.stock_orders.exception.ValidationException;
import com.flagship.stock_orders.stock.StockItemEntity;
import com.flagship.stock_orders.support.IntegrationTestSupport;
import com.flagship.stock_orders.user.UserEntity;
import com.flagship.stock_orders.user.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end order lifecycle against a migrated database:
 * intake, approval with stock settlement, rejection and terminality.
 */
class OrderLifecycleServiceTest extends IntegrationTestSupport {

    @Autowired
    private OrderLifecycleService lifecycleService;

    @Autowired
    private OrderQueryService queryService;

    private UserEntity salesRep;
    private UserEntity storeKeeper;

    @BeforeEach
    void setUp() {
        salesRep = createUser(UserRole.SALES_REPRESENTATIVE);
        storeKeeper = createUser(UserRole.STORE_KEEPER);
    }

    private Order placeOrder(StockItemEntity item, int quantity, String price) {
        return lifecycleService.createOrder(salesRep.getId(), "Acme Ltd", "acme@example.com",
            List.of(new RequestedLine(item.getId(), quantity, new BigDecimal(price))));
    }

    private int countOrders() {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM orders", Integer.class);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Create then approve decrements stock and marks the order APPROVED")
    void createAndApprove() {
        printTestHeader("Create then approve");
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");

        Order created = placeOrder(plywood, 4, "100");

        assertEquals(OrderStatus.PENDING, created.getStatus());
        assertEquals(0, new BigDecimal("400").compareTo(created.getTotalAmount()));
        assertEquals(1, created.getLines().size());
        assertEquals("Plywood", created.getLines().get(0).getStockItemName());
        assertEquals(10, stockQuantity(plywood.getId()), "Intake must not touch stock");

        Order approved = lifecycleService.approve(created.getId());

        printOutput("Approved order", approved.getId());
        assertEquals(OrderStatus.APPROVED, approved.getStatus());
        assertEquals(6, stockQuantity(plywood.getId()));
        assertEquals(OrderStatus.APPROVED,
            queryService.getOrder(principalOf(storeKeeper), created.getId()).getStatus());
        printSuccess("Stock settled and order approved");
    }

    @Test
    @DisplayName("Intake refuses a quantity above stock and persists nothing")
    void intakeRefusesInsufficientStock() {
        StockItemEntity plywood = createStock("Plywood", 3, "120.00");

        ValidationException e = assertThrows(ValidationException.class, () -> placeOrder(plywood, 4, "100"));

        assertEquals(ValidationException.INSUFFICIENT_STOCK, e.getCode());
        assertEquals(0, countOrders());
        assertEquals(3, stockQuantity(plywood.getId()));
    }

    @Test
    @DisplayName("Reject records the reason and leaves stock unchanged")
    void rejectLeavesStockUnchanged() {
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        Order created = placeOrder(plywood, 4, "100");

        Order rejected = lifecycleService.reject(created.getId(), "customer cancelled");

        assertEquals(OrderStatus.REJECTED, rejected.getStatus());
        assertEquals("customer cancelled", rejected.getRejectionReason());
        assertEquals(10, stockQuantity(plywood.getId()));
    }

    @Test
    @DisplayName("Approving a rejected order fails and changes nothing")
    void approveRejectedOrderFails() {
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        Order created = placeOrder(plywood, 4, "100");
        lifecycleService.reject(created.getId(), "customer cancelled");

        assertThrows(InvalidTransitionException.class, () -> lifecycleService.approve(created.getId()));

        Order reloaded = queryService.getOrder(principalOf(storeKeeper), created.getId());
        assertEquals(OrderStatus.REJECTED, reloaded.getStatus());
        assertEquals("customer cancelled", reloaded.getRejectionReason());
        assertEquals(10, stockQuantity(plywood.getId()));
    }

    @Test
    @DisplayName("Approved orders are terminal: a second approve or a reject fails")
    void approvedOrderIsTerminal() {
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        Order created = placeOrder(plywood, 4, "100");
        lifecycleService.approve(created.getId());

        assertThrows(InvalidTransitionException.class, () -> lifecycleService.approve(created.getId()));
        assertThrows(InvalidTransitionException.class,
            () -> lifecycleService.reject(created.getId(), "changed my mind"));

        assertEquals(6, stockQuantity(plywood.getId()), "Second approval must not decrement again");
        assertEquals(OrderStatus.APPROVED,
            queryService.getOrder(principalOf(storeKeeper), created.getId()).getStatus());
    }

    @Test
    @DisplayName("Reject without a reason fails with missing_reason")
    void rejectWithoutReason() {
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        Order created = placeOrder(plywood, 4, "100");

        ValidationException e = assertThrows(ValidationException.class,
            () -> lifecycleService.reject(created.getId(), "  "));

        assertEquals(ValidationException.MISSING_REASON, e.getCode());
        assertEquals(OrderStatus.PENDING,
            queryService.getOrder(principalOf(storeKeeper), created.getId()).getStatus());
    }

    @Test
    @DisplayName("Approve and reject of an unknown order fail with NotFound")
    void unknownOrder() {
        UUID unknown = UUID.randomUUID();

        assertThrows(NotFoundException.class, () -> lifecycleService.approve(unknown));
        assertThrows(NotFoundException.class, () -> lifecycleService.reject(unknown, "whatever"));
    }

    @Test
    @DisplayName("Settlement re-checks stock that shrank after intake")
    void settlementRechecksStock() {
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        Order created = placeOrder(plywood, 8, "100");
        stockService.updateStockItem(plywood.getId(), 5, null, null);

        InsufficientStockException e = assertThrows(InsufficientStockException.class,
            () -> lifecycleService.approve(created.getId()));

        assertEquals(8, e.getRequestedQuantity());
        assertEquals(5, e.getAvailableQuantity());
        assertEquals(5, stockQuantity(plywood.getId()));
        assertEquals(OrderStatus.PENDING,
            queryService.getOrder(principalOf(storeKeeper), created.getId()).getStatus());
    }

    @Test
    @DisplayName("Multi-line approval settles every stock item, summing repeated items")
    void multiLineApproval() {
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        StockItemEntity nails = createStock("Nails", 500, "0.10");

        Order created = lifecycleService.createOrder(salesRep.getId(), "Acme Ltd", "acme@example.com", List.of(
            new RequestedLine(plywood.getId(), 2, new BigDecimal("100")),
            new RequestedLine(nails.getId(), 200, new BigDecimal("0.05")),
            new RequestedLine(plywood.getId(), 3, new BigDecimal("90"))
        ));
        assertEquals(0, new BigDecimal("480").compareTo(created.getTotalAmount()));

        lifecycleService.approve(created.getId());

        assertEquals(5, stockQuantity(plywood.getId()));
        assertEquals(300, stockQuantity(nails.getId()));
    }

    @Test
    @DisplayName("Editing a stock price does not change the total of existing orders")
    void totalIsFixedAtCreation() {
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        Order created = placeOrder(plywood, 4, "100");

        stockService.updateStockItem(plywood.getId(), null, new BigDecimal("500"), new BigDecimal("999"));

        Order reloaded = queryService.getOrder(principalOf(storeKeeper), created.getId());
        assertEquals(0, new BigDecimal("400").compareTo(reloaded.getTotalAmount()));
        assertEquals(0, new BigDecimal("100").compareTo(reloaded.getLines().get(0).getUnitPrice()));
    }

    @Test
    @DisplayName("Sales representatives only see their own orders")
    void salesRepVisibility() {
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        UserEntity otherRep = createUser(UserRole.SALES_REPRESENTATIVE);
        Order mine = placeOrder(plywood, 1, "100");
        Order theirs = lifecycleService.createOrder(otherRep.getId(), "Other", "other@example.com",
            List.of(new RequestedLine(plywood.getId(), 1, new BigDecimal("100"))));

        List<Order> visibleToMe = queryService.listOrders(principalOf(salesRep));
        List<Order> visibleToKeeper = queryService.listOrders(principalOf(storeKeeper));

        assertEquals(List.of(mine.getId()), visibleToMe.stream().map(Order::getId).toList());
        assertEquals(2, visibleToKeeper.size());
        assertThrows(NotFoundException.class, () -> queryService.getOrder(principalOf(salesRep), theirs.getId()));
        assertEquals(otherRep.getUsername(),
            queryService.getOrder(principalOf(storeKeeper), theirs.getId()).getSalesRepUsername());
    }

    @Test
    @DisplayName("Sub-cent prices are rounded once so the stored total equals the sum of stored lines")
    void storedTotalMatchesStoredLines() {
        StockItemEntity washers = createStock("Washers", 100, "0.01");

        Order created = lifecycleService.createOrder(salesRep.getId(), "Acme Ltd", "acme@example.com", List.of(
            new RequestedLine(washers.getId(), 1, new BigDecimal("0.00005")),
            new RequestedLine(washers.getId(), 1, new BigDecimal("0.00005"))
        ));

        Order reloaded = queryService.getOrder(principalOf(storeKeeper), created.getId());
        BigDecimal sumOfLines = reloaded.getLines().stream()
            .map(OrderLine::getTotalPrice)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        printOutput("Reloaded total", reloaded.getTotalAmount());
        assertEquals(0, sumOfLines.compareTo(reloaded.getTotalAmount()));
        assertEquals(0, created.getTotalAmount().compareTo(reloaded.getTotalAmount()));
        assertEquals(0, new BigDecimal("0.0002").compareTo(reloaded.getTotalAmount()));
        assertEquals(0, new BigDecimal("0.0001").compareTo(reloaded.getLines().get(0).getUnitPrice()));
    }
}
