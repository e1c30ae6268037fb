package com.hhplus.ordergraph.application.order.dto;

import com.hhplus.ordergraph.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * 주문 항목 응답 DTO (Application layer)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemResponse {
    private UUID id;
    private UUID orderId;
    private Integer quantity;
    private BigDecimal unitPrice;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;

    public static OrderItemResponse fromOrderItem(OrderItem orderItem) {
        return OrderItemResponse.builder()
                .id(orderItem.getId())
                // 지연 로딩 프록시의 식별자 접근은 초기화를 일으키지 않음
                .orderId(orderItem.getOrder().getId())
                .quantity(orderItem.getQuantity())
                .unitPrice(orderItem.getUnitPrice())
                .createdAt(orderItem.getCreatedAt().atOffset(ZoneOffset.UTC))
                .updatedAt(orderItem.getUpdatedAt().atOffset(ZoneOffset.UTC))
                .build();
    }
}
