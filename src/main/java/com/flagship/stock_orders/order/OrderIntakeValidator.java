package com.flagship.stock_orders.order;

import com.flagship.stock_orders.exception.ValidationException;
import com.flagship.stock_orders.stock.StockItemEntity;
import com.flagship.stock_orders.stock.StockItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Checks a submitted order against current stock and prices its lines.
 *
 * Reads only. The availability check here is advisory: stock may change
 * before the order is approved, and settlement checks again under lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderIntakeValidator {

    private final StockItemRepository stockItemRepository;

    /**
     * @throws ValidationException with code {@code missing_fields}, {@code invalid_price},
     *         {@code stock_not_found} or {@code insufficient_stock}
     */
    @Transactional(readOnly = true)
    public OrderDraft validate(String customerName, String customerContact, List<RequestedLine> lines) {
        if (isBlank(customerName) || isBlank(customerContact) || lines == null || lines.isEmpty()) {
            throw new ValidationException(ValidationException.MISSING_FIELDS,
                "Customer name, customer contact and at least one item are required");
        }

        Map<UUID, StockItemEntity> stockById = new HashMap<>();
        Map<UUID, Integer> requestedSoFar = new HashMap<>();
        List<OrderLine> orderLines = new ArrayList<>(lines.size());
        int lineNumber = 1;

        for (RequestedLine line : lines) {
            if (line == null || line.getStockItemId() == null
                    || line.getQuantity() == null || line.getQuantity() < 1) {
                throw new ValidationException(ValidationException.MISSING_FIELDS,
                    "Each item needs a stock item and a quantity of at least 1");
            }

            BigDecimal requestedPrice = line.getSellingPrice() == null ? BigDecimal.ZERO : line.getSellingPrice();
            if (requestedPrice.signum() < 0) {
                throw new ValidationException(ValidationException.INVALID_PRICE,
                    "Selling price cannot be negative");
            }
            BigDecimal unitPrice = OrderLine.toMoneyScale(requestedPrice);

            UUID stockItemId = line.getStockItemId();
            StockItemEntity stockItem = stockById.get(stockItemId);
            if (stockItem == null) {
                stockItem = stockItemRepository.findById(stockItemId)
                    .orElseThrow(() -> new ValidationException(ValidationException.STOCK_NOT_FOUND,
                        "Stock item not found: " + stockItemId));
                stockById.put(stockItemId, stockItem);
            }

            // Lines naming the same item are checked against their combined quantity.
            int requested = requestedSoFar.merge(stockItemId, line.getQuantity(), Integer::sum);
            if (!stockItem.covers(requested)) {
                throw new ValidationException(ValidationException.INSUFFICIENT_STOCK,
                    String.format("Insufficient stock for %s: requested %d, available %d",
                        stockItem.getName(), requested, stockItem.getQuantity()));
            }

            orderLines.add(OrderLine.create(lineNumber++, stockItemId, stockItem.getName(),
                line.getQuantity(), unitPrice));
        }

        log.debug("Order intake passed: {} lines across {} stock items", orderLines.size(), stockById.size());
        return new OrderDraft(customerName.trim(), customerContact.trim(), orderLines);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
