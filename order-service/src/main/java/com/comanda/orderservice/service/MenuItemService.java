package com.comanda.orderservice.service;

import com.comanda.orderservice.dto.MenuItemResponse;
import com.comanda.orderservice.model.MenuItem;

import java.util.Collection;
import java.util.Map;

/**
 * Read-only access to menu items for the order engine.
 */
public interface MenuItemService {

    /**
     * Fails with ResourceNotFoundException for missing or deleted items.
     */
    MenuItem findMenuItemByIdOrFail(Long id);

    /**
     * Loads all given items with one query. Missing ids are simply absent from the map.
     */
    Map<Long, MenuItem> findAllByIds(Collection<Long> ids);

    MenuItemResponse getMenuItem(Long id);
}
