package com.flagship.stock_orders.order;

import com.flagship.stock_orders.stock.StockItemEntity;
import com.flagship.stock_orders.user.UserEntity;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

/**
 * JPA entity for an order and, through cascade, its lines.
 *
 * No setters: the only mutation after creation is {@link #updateFromDomain(Order)},
 * which copies the status and rejection reason of a transitioned {@link Order}.
 * Customer details, lines and the total are written once.
 */
@Entity
@Table(name = "orders")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_name", nullable = false, updatable = false)
    private String customerName;

    @Column(name = "customer_contact", nullable = false, updatable = false)
    private String customerContact;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus status;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Column(name = "rejection_reason")
    private String rejectionReason;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "sales_rep_id", nullable = false, updatable = false)
    private UserEntity salesRep;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    private List<OrderItemEntity> items = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Builds a new entity from a freshly placed order.
     *
     * @param stockItems resolves a stock item id to a (possibly proxied) entity reference
     */
    public static OrderEntity fromDomain(Order order, UserEntity salesRep,
                                         Function<UUID, StockItemEntity> stockItems) {
        OrderEntity entity = new OrderEntity();
        entity.id = order.getId();
        entity.customerName = order.getCustomerName();
        entity.customerContact = order.getCustomerContact();
        entity.status = order.getStatus();
        entity.totalAmount = order.getTotalAmount();
        entity.rejectionReason = order.getRejectionReason();
        entity.salesRep = salesRep;
        for (OrderLine line : order.getLines()) {
            entity.items.add(OrderItemEntity.fromDomain(entity, line, stockItems.apply(line.getStockItemId())));
        }
        return entity;
    }

    public Order toDomain() {
        List<OrderLine> lines = items.stream()
            .map(OrderItemEntity::toDomain)
            .toList();
        return new Order(
            id,
            customerName,
            customerContact,
            status,
            totalAmount,
            rejectionReason,
            salesRep.getId(),
            salesRep.getUsername(),
            lines,
            createdAt,
            updatedAt
        );
    }

    /**
     * Copies the outcome of a state transition onto this entity.
     */
    public void updateFromDomain(Order order) {
        if (!id.equals(order.getId())) {
            throw new IllegalArgumentException("Order id mismatch: " + id + " vs " + order.getId());
        }
        this.status = order.getStatus();
        this.rejectionReason = order.getRejectionReason();
    }

    /**
     * Units requested per stock item, summed across lines.
     * Reads only the line rows, so no stock item is loaded.
     */
    public Map<UUID, Integer> requiredQuantities() {
        Map<UUID, Integer> required = new LinkedHashMap<>();
        for (OrderItemEntity item : items) {
            required.merge(item.getStockItemId(), item.getQuantity(), Integer::sum);
        }
        return required;
    }
}
