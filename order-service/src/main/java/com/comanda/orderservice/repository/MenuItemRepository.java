package com.comanda.orderservice.repository;

import com.comanda.orderservice.model.InventoryType;
import com.comanda.orderservice.model.MenuItem;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MenuItemRepository extends JpaRepository<MenuItem, Long> {

    // SELECT ... FOR UPDATE, held until the surrounding transaction ends
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM MenuItem m WHERE m.id = :id")
    Optional<MenuItem> findByIdWithLock(@Param("id") Long id);

    @Query("SELECT m FROM MenuItem m WHERE m.inventoryType = :type " +
            "AND m.stockQuantity <= m.lowStockAlert ORDER BY m.name ASC")
    List<MenuItem> findLowStock(@Param("type") InventoryType type);

    List<MenuItem> findByInventoryTypeAndStockQuantityOrderByNameAsc(InventoryType type, Integer stockQuantity);
}
