package com.hhplus.ordergraph.presentation.order;

import com.hhplus.ordergraph.application.order.OrderItemService;
import com.hhplus.ordergraph.application.order.OrderService;
import com.hhplus.ordergraph.application.order.dto.OrderItemResponse;
import com.hhplus.ordergraph.application.order.dto.OrderResponse;
import com.hhplus.ordergraph.application.user.UserService;
import com.hhplus.ordergraph.application.user.dto.UserResponse;
import com.hhplus.ordergraph.presentation.order.mapper.OrderMapper;
import com.hhplus.ordergraph.presentation.order.request.CreateOrderInput;
import com.hhplus.ordergraph.presentation.order.request.DeleteOrderInput;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.BatchMapping;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * OrderController - 주문 GraphQL 엔드포인트
 */
@Controller
public class OrderController {

    private final OrderService orderService;
    private final OrderItemService orderItemService;
    private final UserService userService;
    private final OrderMapper orderMapper;

    public OrderController(OrderService orderService,
                           OrderItemService orderItemService,
                           UserService userService,
                           OrderMapper orderMapper) {
        this.orderService = orderService;
        this.orderItemService = orderItemService;
        this.userService = userService;
        this.orderMapper = orderMapper;
    }

    /**
     * query orders
     */
    @QueryMapping
    public List<OrderResponse> orders() {
        return orderService.findAll();
    }

    /**
     * mutation createOrder - 주문과 주문 항목을 하나의 트랜잭션으로 생성
     */
    @MutationMapping
    public OrderResponse createOrder(@Argument CreateOrderInput input) {
        // GraphQL Input → Application Command로 변환
        var command = orderMapper.toCreateOrderCommand(input);
        return orderService.createOrder(command);
    }

    /**
     * mutation deleteOrder - 삭제 직전 스냅샷 반환
     */
    @MutationMapping
    public OrderResponse deleteOrder(@Argument DeleteOrderInput input) {
        return orderService.deleteOrder(input.getId());
    }

    /**
     * Order.user 배치 로딩
     */
    @BatchMapping(typeName = "Order", field = "user")
    public Map<OrderResponse, UserResponse> user(List<OrderResponse> orders) {
        Set<UUID> userIdsToLoad = orders.stream()
                .filter(order -> !order.hasUserLoaded())
                .map(OrderResponse::getUserId)
                .collect(Collectors.toSet());

        Map<UUID, UserResponse> loaded = userIdsToLoad.isEmpty()
                ? Map.of()
                : userService.findByIds(userIdsToLoad);

        Map<OrderResponse, UserResponse> result = new LinkedHashMap<>();
        for (OrderResponse order : orders) {
            UserResponse user = order.hasUserLoaded() ? order.getUser() : loaded.get(order.getUserId());
            if (user != null) {
                result.put(order, user);
            }
        }
        return result;
    }

    /**
     * Order.orderItems 배치 로딩
     */
    @BatchMapping(typeName = "Order", field = "orderItems")
    public Map<OrderResponse, List<OrderItemResponse>> orderItems(List<OrderResponse> orders) {
        Set<UUID> orderIdsToLoad = orders.stream()
                .filter(order -> !order.hasOrderItemsLoaded())
                .map(OrderResponse::getId)
                .collect(Collectors.toSet());

        Map<UUID, List<OrderItemResponse>> loaded = orderIdsToLoad.isEmpty()
                ? Map.of()
                : orderItemService.findByOrderIds(orderIdsToLoad);

        Map<OrderResponse, List<OrderItemResponse>> result = new LinkedHashMap<>();
        for (OrderResponse order : orders) {
            result.put(order, order.hasOrderItemsLoaded()
                    ? order.getOrderItems()
                    : loaded.getOrDefault(order.getId(), List.of()));
        }
        return result;
    }
}
