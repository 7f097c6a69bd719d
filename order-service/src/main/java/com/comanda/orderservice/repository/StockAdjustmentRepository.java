package com.comanda.orderservice.repository;

import com.comanda.orderservice.model.StockAdjustment;
import com.comanda.orderservice.model.StockAdjustmentType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface StockAdjustmentRepository extends JpaRepository<StockAdjustment, UUID> {

    Page<StockAdjustment> findByMenuItemIdOrderByCreatedAtDesc(Long menuItemId, Pageable pageable);

    // audit rows written on behalf of one order
    List<StockAdjustment> findByOrderIdAndAdjustmentType(UUID orderId, StockAdjustmentType adjustmentType);
}
