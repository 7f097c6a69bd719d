package com.comanda.orderservice.mapper;

import com.comanda.orderservice.dto.MenuItemResponse;
import com.comanda.orderservice.dto.StockAdjustmentResponse;
import com.comanda.orderservice.model.MenuItem;
import com.comanda.orderservice.model.StockAdjustment;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface MenuItemMapper {

    MenuItemResponse toMenuItemResponse(MenuItem menuItem);

    StockAdjustmentResponse toStockAdjustmentResponse(StockAdjustment adjustment);
}
