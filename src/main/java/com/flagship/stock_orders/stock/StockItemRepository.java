package com.flagship.stock_orders.stock;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface StockItemRepository extends JpaRepository<StockItemEntity, UUID> {

    List<StockItemEntity> findAllByOrderByNameAsc();

    boolean existsByName(String name);

    long countByQuantityLessThanEqual(int quantity);

    /**
     * Loads and row-locks the given stock items for the rest of the transaction.
     *
     * Rows are locked in ascending id order so that two settlements sharing
     * several items always acquire their locks in the same sequence.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM StockItemEntity s WHERE s.id IN :ids ORDER BY s.id")
    List<StockItemEntity> findAllByIdForUpdate(@Param("ids") Collection<UUID> ids);
}
