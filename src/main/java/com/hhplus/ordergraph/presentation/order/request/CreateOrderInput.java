package com.hhplus.ordergraph.presentation.order.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * 주문 생성 입력 (GraphQL CreateOrderInput)
 *
 * status를 생략하면 pending으로 생성된다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderInput {
    private UUID userId;
    private String status;
    private BigDecimal totalCost;
    private List<OrderItemInput> orderItems;
}
