package com.flagship.stock_orders.stock;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for an inventory line.
 *
 * Quantity changes made by order approval go through {@link StockLedger}
 * rather than this entity, so that the decrement and its guard run as one
 * SQL statement.
 */
@Entity
@Table(name = "stock_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StockItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private int quantity;

    @Column(name = "buying_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal buyingPrice;

    @Column(name = "selling_price", precision = 19, scale = 4)
    private BigDecimal sellingPrice;

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

    public static StockItemEntity create(String name, int quantity, BigDecimal buyingPrice, BigDecimal sellingPrice) {
        return new StockItemEntity(UUID.randomUUID(), name, quantity, buyingPrice, sellingPrice, null, null);
    }

    /**
     * Applies a partial update; null arguments leave the field unchanged.
     */
    void applyUpdate(Integer quantity, BigDecimal buyingPrice, BigDecimal sellingPrice) {
        if (quantity != null) {
            this.quantity = quantity;
        }
        if (buyingPrice != null) {
            this.buyingPrice = buyingPrice;
        }
        if (sellingPrice != null) {
            this.sellingPrice = sellingPrice;
        }
    }

    public boolean covers(int requestedQuantity) {
        return quantity >= requestedQuantity;
    }
}
