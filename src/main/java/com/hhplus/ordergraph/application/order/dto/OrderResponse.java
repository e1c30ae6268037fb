package com.hhplus.ordergraph.application.order.dto;

import com.hhplus.ordergraph.application.user.dto.UserResponse;
import com.hhplus.ordergraph.domain.order.Order;
import com.hhplus.ordergraph.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 주문 응답 DTO (Application layer)
 *
 * user, orderItems가 null이면 아직 로드하지 않은 상태이다.
 * status는 DB 저장 값과 같은 소문자 문자열(pending, paid, shipped, cancelled)로 노출한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {
    private UUID id;
    private UUID userId;
    private UserResponse user;
    private String status;
    private BigDecimal totalCost;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private List<OrderItemResponse> orderItems;

    /**
     * Order → OrderResponse 변환 (연관 엔티티 미포함)
     */
    public static OrderResponse fromOrder(Order order) {
        return builderFrom(order).build();
    }

    /**
     * Order → OrderResponse 변환 (주문 항목 포함)
     * orderItems 컬렉션이 이미 초기화(fetch join)되어 있어야 한다.
     */
    public static OrderResponse fromOrderWithItems(Order order) {
        return builderFrom(order)
                .orderItems(toItemResponses(order.getOrderItems()))
                .build();
    }

    /**
     * Order → OrderResponse 변환 (사용자, 주문 항목 포함)
     */
    public static OrderResponse fromOrderWithUserAndItems(Order order) {
        return builderFrom(order)
                .user(UserResponse.fromUser(order.getUser()))
                .orderItems(toItemResponses(order.getOrderItems()))
                .build();
    }

    private static OrderResponseBuilder builderFrom(Order order) {
        return OrderResponse.builder()
                .id(order.getId())
                .userId(order.getUser().getId())
                .status(order.getStatus().getValue())
                .totalCost(order.getTotalCost())
                .createdAt(order.getCreatedAt().atOffset(ZoneOffset.UTC))
                .updatedAt(order.getUpdatedAt().atOffset(ZoneOffset.UTC));
    }

    private static List<OrderItemResponse> toItemResponses(List<OrderItem> orderItems) {
        return orderItems.stream()
                .map(OrderItemResponse::fromOrderItem)
                .collect(Collectors.toList());
    }

    public boolean hasUserLoaded() {
        return user != null;
    }

    public boolean hasOrderItemsLoaded() {
        return orderItems != null;
    }
}
