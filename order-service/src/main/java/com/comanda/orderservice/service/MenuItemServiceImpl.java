package com.comanda.orderservice.service;

import com.comanda.common.exception.ResourceNotFoundException;
import com.comanda.orderservice.dto.MenuItemResponse;
import com.comanda.orderservice.mapper.MenuItemMapper;
import com.comanda.orderservice.model.MenuItem;
import com.comanda.orderservice.repository.MenuItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class MenuItemServiceImpl implements MenuItemService {

    private final MenuItemRepository menuItemRepository;
    private final MenuItemMapper menuItemMapper;

    @Override
    @Transactional(readOnly = true)
    public MenuItem findMenuItemByIdOrFail(Long id) {
        return menuItemRepository.findById(id)
                .orElseThrow(() -> {
                    log.warn("Menu item not found: menuItemId={}", id);
                    return new ResourceNotFoundException("Menu item not found with id: " + id);
                });
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Long, MenuItem> findAllByIds(Collection<Long> ids) {
        return menuItemRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(MenuItem::getId, Function.identity()));
    }

    @Override
    @Transactional(readOnly = true)
    public MenuItemResponse getMenuItem(Long id) {
        return menuItemMapper.toMenuItemResponse(findMenuItemByIdOrFail(id));
    }
}
