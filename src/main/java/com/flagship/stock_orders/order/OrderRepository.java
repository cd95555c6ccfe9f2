package com.flagship.stock_orders.order;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<OrderEntity, UUID> {

    /**
     * Loads and row-locks an order. Associations are left lazy: a locking
     * read cannot be combined with outer fetch joins on PostgreSQL.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM OrderEntity o WHERE o.id = :id")
    Optional<OrderEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT o FROM OrderEntity o JOIN FETCH o.salesRep " +
           "LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.stockItem WHERE o.id = :id")
    Optional<OrderEntity> findWithItemsById(@Param("id") UUID id);

    @Query("SELECT o FROM OrderEntity o JOIN FETCH o.salesRep " +
           "LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.stockItem ORDER BY o.createdAt DESC")
    List<OrderEntity> findAllWithItems();

    @Query("SELECT o FROM OrderEntity o JOIN FETCH o.salesRep " +
           "LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.stockItem " +
           "WHERE o.salesRep.id = :salesRepId ORDER BY o.createdAt DESC")
    List<OrderEntity> findAllWithItemsBySalesRepId(@Param("salesRepId") UUID salesRepId);

    long countByStatus(OrderStatus status);

    @Query("SELECT o FROM OrderEntity o JOIN FETCH o.salesRep " +
           "LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.stockItem " +
           "WHERE o.status = :status ORDER BY o.createdAt DESC")
    List<OrderEntity> findAllWithItemsByStatus(@Param("status") OrderStatus status);

    /**
     * Orders in the given status created in {@code [from, to)}.
     */
    @Query("SELECT o FROM OrderEntity o JOIN FETCH o.salesRep " +
           "LEFT JOIN FETCH o.items i LEFT JOIN FETCH i.stockItem " +
           "WHERE o.status = :status AND o.createdAt >= :from AND o.createdAt < :to " +
           "ORDER BY o.createdAt DESC")
    List<OrderEntity> findAllWithItemsByStatusCreatedBetween(@Param("status") OrderStatus status,
                                                             @Param("from") Instant from,
                                                             @Param("to") Instant to);
}
