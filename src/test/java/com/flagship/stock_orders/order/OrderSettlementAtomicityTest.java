package com.flagship.stock_orders.order;

import com.flagship.stock_orders.stock.StockItemEntity;
import com.flagship.stock_orders.stock.StockLedger;
import com.flagship.stock_orders.support.IntegrationTestSupport;
import com.flagship.stock_orders.user.UserEntity;
import com.flagship.stock_orders.user.UserRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * A failure between two stock decrements must roll back the whole settlement.
 */
class OrderSettlementAtomicityTest extends IntegrationTestSupport {

    @SpyBean
    private StockLedger spiedLedger;

    @Autowired
    private OrderLifecycleService lifecycleService;

    @Autowired
    private OrderPersistenceService persistenceService;

    @Test
    @DisplayName("Fault after the first decrement leaves stock and status untouched")
    void faultMidSettlementRollsBack() {
        printTestHeader("Fault mid-settlement");
        UserEntity salesRep = createUser(UserRole.SALES_REPRESENTATIVE);
        StockItemEntity plywood = createStock("Plywood", 10, "120.00");
        StockItemEntity nails = createStock("Nails", 100, "0.10");

        Order created = lifecycleService.createOrder(salesRep.getId(), "Acme Ltd", "acme@example.com", List.of(
            new RequestedLine(plywood.getId(), 4, new BigDecimal("100")),
            new RequestedLine(nails.getId(), 40, new BigDecimal("0.10"))
        ));

        // First decrement runs for real, the second one fails.
        doCallRealMethod()
            .doThrow(new DataAccessResourceFailureException("connection lost"))
            .when(spiedLedger).decrement(any(), anyInt());

        assertThrows(DataAccessResourceFailureException.class, () -> lifecycleService.approve(created.getId()));

        verify(spiedLedger, times(2)).decrement(any(), anyInt());
        assertEquals(10, stockQuantity(plywood.getId()));
        assertEquals(100, stockQuantity(nails.getId()));
        assertEquals(OrderStatus.PENDING, persistenceService.findById(created.getId()).orElseThrow().getStatus());
        printSuccess("Settlement rolled back completely");
    }
}
