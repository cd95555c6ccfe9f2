package com.flagship.stock_orders.order;

import com.flagship.stock_orders.order.dto.CreateOrderRequest;
import com.flagship.stock_orders.order.dto.OrderResponse;
import com.flagship.stock_orders.order.dto.RejectOrderRequest;
import com.flagship.stock_orders.security.UserPrincipal;
import com.flagship.stock_orders.user.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for orders. Role checks live in the security configuration;
 * this controller only maps requests onto the lifecycle and query services.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private final OrderLifecycleService lifecycleService;
    private final OrderQueryService queryService;

    @GetMapping
    public List<OrderResponse> listOrders(@AuthenticationPrincipal UserPrincipal caller) {
        boolean includeSalesRep = showsSalesRep(caller);
        return queryService.listOrders(caller).stream()
            .map(order -> OrderResponse.from(order, includeSalesRep))
            .toList();
    }

    @GetMapping("/{id}")
    public OrderResponse getOrder(@AuthenticationPrincipal UserPrincipal caller,
                                  @PathVariable("id") UUID id) {
        return OrderResponse.from(queryService.getOrder(caller, id), showsSalesRep(caller));
    }

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@AuthenticationPrincipal UserPrincipal caller,
                                                     @RequestBody CreateOrderRequest request) {
        log.info("Received order request: customer={}, items={}",
            request.getCustomerName(), request.getItems() == null ? 0 : request.getItems().size());
        Order created = lifecycleService.createOrder(
            caller.getUserId(),
            request.getCustomerName(),
            request.getCustomerContact(),
            request.toRequestedLines()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(created, false));
    }

    @PatchMapping("/{id}/approve")
    public OrderResponse approveOrder(@PathVariable("id") UUID id) {
        return OrderResponse.from(lifecycleService.approve(id), true);
    }

    @PatchMapping("/{id}/reject")
    public OrderResponse rejectOrder(@PathVariable("id") UUID id,
                                     @RequestBody(required = false) RejectOrderRequest request) {
        String reason = request == null ? null : request.getRejectionReason();
        return OrderResponse.from(lifecycleService.reject(id, reason), true);
    }

    private boolean showsSalesRep(UserPrincipal caller) {
        return !caller.hasRole(UserRole.SALES_REPRESENTATIVE);
    }
}
