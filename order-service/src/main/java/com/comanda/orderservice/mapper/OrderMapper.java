// order-service/src/main/java/com/comanda/orderservice/mapper/OrderMapper.java
package com.comanda.orderservice.mapper;

import com.comanda.common.contracts.OrderLineContract;
import com.comanda.orderservice.dto.OrderItemResponse;
import com.comanda.orderservice.dto.OrderResponse;
import com.comanda.orderservice.model.Order;
import com.comanda.orderservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    // event payload lines
    OrderLineContract toLineContract(OrderItem orderItem);

    List<OrderLineContract> toLineContracts(List<OrderItem> orderItems);

    // Request -> entity is done in the service, prices come from the menu
}
