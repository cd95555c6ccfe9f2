package com.flagship.stock_orders.stock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;

/**
 * Direct SQL access to stock quantities.
 *
 * Decrements are conditional, so a row is only changed if it still holds
 * enough units. Combined with the {@code quantity >= 0} check constraint,
 * stock cannot be driven negative even by a caller that skipped its own
 * checks.
 */
@Component
@Slf4j
public class StockLedger {

    private final JdbcTemplate jdbcTemplate;

    public StockLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Removes {@code quantity} units from a stock item within the caller's transaction.
     *
     * @return true if the row was decremented, false if it holds fewer units (or does not exist)
     */
    public boolean decrement(UUID stockItemId, int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Decrement quantity must be positive: " + quantity);
        }
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Stock decrement requires an active transaction");
        }
        int updated = jdbcTemplate.update(
            "UPDATE stock_items SET quantity = quantity - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND quantity >= ?",
            quantity,
            stockItemId,
            quantity
        );
        log.debug("Stock decrement: stockItemId={}, quantity={}, applied={}", stockItemId, quantity, updated == 1);
        return updated == 1;
    }

    public int currentQuantity(UUID stockItemId) {
        Integer quantity = jdbcTemplate.queryForObject(
            "SELECT quantity FROM stock_items WHERE id = ?",
            Integer.class,
            stockItemId
        );
        if (quantity == null) {
            throw new IllegalArgumentException("Stock item not found: " + stockItemId);
        }
        return quantity;
    }

    /**
     * Whether any order line, pending or settled, points at this stock item.
     */
    public boolean isReferencedByOrders(UUID stockItemId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM order_items WHERE stock_item_id = ?",
            Integer.class,
            stockItemId
        );
        return count != null && count > 0;
    }
}
