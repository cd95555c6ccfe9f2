package com.flagship.stock_orders.order;

import com.flagship.stock_orders.stock.StockItemRepository;
import com.flagship.stock_orders.user.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link Order} domain object and {@link OrderEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderPersistenceService {

    private final OrderRepository orderRepository;
    private final UserRepository userRepository;
    private final StockItemRepository stockItemRepository;

    /**
     * Inserts a newly placed order with its lines.
     */
    @Transactional
    public Order save(Order order) {
        OrderEntity entity = OrderEntity.fromDomain(
            order,
            userRepository.getReferenceById(order.getSalesRepId()),
            stockItemRepository::getReferenceById
        );
        OrderEntity saved = orderRepository.saveAndFlush(entity);
        log.debug("Saved order {} with {} lines", saved.getId(), saved.getItems().size());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Order> findById(UUID orderId) {
        return orderRepository.findWithItemsById(orderId)
            .map(OrderEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Order> findAll() {
        return orderRepository.findAllWithItems().stream()
            .map(OrderEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Order> findAllForSalesRep(UUID salesRepId) {
        return orderRepository.findAllWithItemsBySalesRepId(salesRepId).stream()
            .map(OrderEntity::toDomain)
            .toList();
    }

    /**
     * Loads an order entity and holds its row lock until the surrounding
     * transaction ends. Must be called inside a read-write transaction.
     */
    @Transactional
    public Optional<OrderEntity> findEntityForUpdate(UUID orderId) {
        return orderRepository.findByIdForUpdate(orderId);
    }

    /**
     * Flushes a transitioned entity so its updated timestamp is current.
     */
    @Transactional
    public OrderEntity saveEntity(OrderEntity entity) {
        OrderEntity saved = orderRepository.saveAndFlush(entity);
        log.debug("Saved order entity {} with status {}", saved.getId(), saved.getStatus());
        return saved;
    }
}
