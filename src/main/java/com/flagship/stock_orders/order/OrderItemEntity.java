package com.flagship.stock_orders.order;

import com.flagship.stock_orders.stock.StockItemEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * JPA entity for one order line. Immutable once inserted.
 */
@Entity
@Table(name = "order_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private OrderEntity order;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "stock_item_id", nullable = false, updatable = false)
    private StockItemEntity stockItem;

    // Same column as stockItem, readable without initializing the association.
    @Column(name = "stock_item_id", insertable = false, updatable = false)
    private UUID stockItemId;

    @Column(name = "line_number", nullable = false, updatable = false)
    private int lineNumber;

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Column(name = "total_price", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal totalPrice;

    static OrderItemEntity fromDomain(OrderEntity order, OrderLine line, StockItemEntity stockItem) {
        OrderItemEntity entity = new OrderItemEntity();
        entity.id = line.getId();
        entity.order = order;
        entity.stockItem = stockItem;
        entity.stockItemId = line.getStockItemId();
        entity.lineNumber = line.getLineNumber();
        entity.quantity = line.getQuantity();
        entity.unitPrice = line.getUnitPrice();
        entity.totalPrice = line.getTotalPrice();
        return entity;
    }

    OrderLine toDomain() {
        return new OrderLine(
            id,
            lineNumber,
            stockItemId,
            stockItem.getName(),
            quantity,
            unitPrice,
            totalPrice
        );
    }
}
