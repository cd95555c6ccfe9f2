package com.flagship.stock_orders.order;

import com.flagship.stock_orders.exception.NotFoundException;
import com.flagship.stock_orders.security.UserPrincipal;
import com.flagship.stock_orders.user.UserRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Read access to orders. Sales representatives see only the orders they created;
 * every other role sees all orders.
 */
@Service
@RequiredArgsConstructor
public class OrderQueryService {

    private final OrderPersistenceService persistenceService;

    public List<Order> listOrders(UserPrincipal caller) {
        if (caller.hasRole(UserRole.SALES_REPRESENTATIVE)) {
            return persistenceService.findAllForSalesRep(caller.getUserId());
        }
        return persistenceService.findAll();
    }

    /**
     * @throws NotFoundException if the order does not exist or is not visible to the caller
     */
    public Order getOrder(UserPrincipal caller, UUID orderId) {
        return persistenceService.findById(orderId)
            .filter(order -> isVisibleTo(caller, order))
            .orElseThrow(() -> NotFoundException.order(orderId));
    }

    private boolean isVisibleTo(UserPrincipal caller, Order order) {
        return !caller.hasRole(UserRole.SALES_REPRESENTATIVE) || order.isOwnedBy(caller.getUserId());
    }
}
