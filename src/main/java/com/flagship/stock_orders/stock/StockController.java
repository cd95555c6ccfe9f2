package com.flagship.stock_orders.stock;

import com.flagship.stock_orders.stock.dto.CreateStockItemRequest;
import com.flagship.stock_orders.stock.dto.StockItemResponse;
import com.flagship.stock_orders.stock.dto.UpdateStockItemRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/stock")
@RequiredArgsConstructor
public class StockController {

    private final StockService stockService;

    @GetMapping
    public List<StockItemResponse> listStock() {
        return stockService.listStock().stream()
            .map(StockItemResponse::from)
            .toList();
    }

    @PostMapping
    public ResponseEntity<StockItemResponse> createStockItem(@Valid @RequestBody CreateStockItemRequest request) {
        StockItemEntity created = stockService.createStockItem(
            request.getName(), request.getQuantity(), request.getBuyingPrice(), request.getSellingPrice());
        return ResponseEntity.status(HttpStatus.CREATED).body(StockItemResponse.from(created));
    }

    @PatchMapping("/{id}")
    public StockItemResponse updateStockItem(@PathVariable("id") UUID id,
                                             @RequestBody UpdateStockItemRequest request) {
        return StockItemResponse.from(stockService.updateStockItem(
            id, request.getQuantity(), request.getBuyingPrice(), request.getSellingPrice()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteStockItem(@PathVariable("id") UUID id) {
        stockService.deleteStockItem(id);
        return ResponseEntity.noContent().build();
    }
}
