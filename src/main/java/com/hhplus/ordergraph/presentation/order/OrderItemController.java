package com.hhplus.ordergraph.presentation.order;

import com.hhplus.ordergraph.application.order.OrderItemService;
import com.hhplus.ordergraph.application.order.dto.OrderItemResponse;
import com.hhplus.ordergraph.presentation.order.mapper.OrderMapper;
import com.hhplus.ordergraph.presentation.order.request.CreateOrderItemInput;
import com.hhplus.ordergraph.presentation.order.request.DeleteOrderItemInput;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.List;

/**
 * OrderItemController - 주문 항목 GraphQL 엔드포인트
 */
@Controller
public class OrderItemController {

    private final OrderItemService orderItemService;
    private final OrderMapper orderMapper;

    public OrderItemController(OrderItemService orderItemService, OrderMapper orderMapper) {
        this.orderItemService = orderItemService;
        this.orderMapper = orderMapper;
    }

    @QueryMapping
    public List<OrderItemResponse> orderItems() {
        return orderItemService.findAll();
    }

    @MutationMapping
    public OrderItemResponse createOrderItem(@Argument CreateOrderItemInput input) {
        return orderItemService.createOrderItem(orderMapper.toCreateOrderItemCommand(input));
    }

    /**
     * mutation deleteOrderItem - 삭제 직전 스냅샷 반환
     */
    @MutationMapping
    public OrderItemResponse deleteOrderItem(@Argument DeleteOrderItemInput input) {
        return orderItemService.deleteOrderItem(input.getId());
    }
}
