package com.flagship.stock_orders.stock;

import com.flagship.stock_orders.exception.ConflictException;
import com.flagship.stock_orders.exception.NotFoundException;
import com.flagship.stock_orders.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Inventory maintenance performed by managers.
 *
 * Each operation touches a single stock row and relies on the database's
 * single-statement atomicity; approval-time decrements live in the order
 * settlement instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockService {

    private final StockItemRepository stockItemRepository;
    private final StockLedger stockLedger;

    @Transactional(readOnly = true)
    public List<StockItemEntity> listStock() {
        return stockItemRepository.findAllByOrderByNameAsc();
    }

    @Transactional
    public StockItemEntity createStockItem(String name, Integer quantity, BigDecimal buyingPrice, BigDecimal sellingPrice) {
        if (name == null || name.isBlank() || quantity == null || buyingPrice == null) {
            throw new ValidationException(ValidationException.MISSING_FIELDS,
                "Name, quantity, and buying price are required");
        }
        requireNonNegative(quantity, buyingPrice, sellingPrice);

        String trimmedName = name.trim();
        if (stockItemRepository.existsByName(trimmedName)) {
            throw new ValidationException(ValidationException.DUPLICATE_NAME, "Item with this name already exists");
        }

        StockItemEntity saved = stockItemRepository.save(
            StockItemEntity.create(trimmedName, quantity, buyingPrice, sellingPrice));
        log.info("Stock item created: id={}, name={}, quantity={}", saved.getId(), saved.getName(), saved.getQuantity());
        return saved;
    }

    /**
     * Existing order lines keep the prices they were created with.
     */
    @Transactional
    public StockItemEntity updateStockItem(UUID id, Integer quantity, BigDecimal buyingPrice, BigDecimal sellingPrice) {
        requireNonNegative(quantity, buyingPrice, sellingPrice);

        StockItemEntity entity = stockItemRepository.findById(id)
            .orElseThrow(() -> NotFoundException.stockItem(id));
        entity.applyUpdate(quantity, buyingPrice, sellingPrice);
        StockItemEntity saved = stockItemRepository.saveAndFlush(entity);

        log.info("Stock item updated: id={}, quantity={}", saved.getId(), saved.getQuantity());
        return saved;
    }

    /**
     * @throws ConflictException if any order line references the item
     */
    @Transactional
    public void deleteStockItem(UUID id) {
        StockItemEntity entity = stockItemRepository.findById(id)
            .orElseThrow(() -> NotFoundException.stockItem(id));

        if (stockLedger.isReferencedByOrders(id)) {
            throw new ConflictException(ConflictException.STOCK_IN_USE,
                "Stock item " + entity.getName() + " is referenced by existing orders");
        }

        try {
            stockItemRepository.delete(entity);
            stockItemRepository.flush();
        } catch (DataIntegrityViolationException e) {
            // An order line was added between the check and the delete.
            throw new ConflictException(ConflictException.STOCK_IN_USE,
                "Stock item " + entity.getName() + " is referenced by existing orders");
        }
        log.info("Stock item deleted: id={}, name={}", id, entity.getName());
    }

    private void requireNonNegative(Integer quantity, BigDecimal buyingPrice, BigDecimal sellingPrice) {
        if ((quantity != null && quantity < 0)
                || (buyingPrice != null && buyingPrice.signum() < 0)
                || (sellingPrice != null && sellingPrice.signum() < 0)) {
            throw new ValidationException(ValidationException.INVALID_VALUE, "Values must be non-negative");
        }
    }
}
