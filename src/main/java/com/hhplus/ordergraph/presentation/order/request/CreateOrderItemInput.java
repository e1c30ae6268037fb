package com.hhplus.ordergraph.presentation.order.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * 기존 주문에 항목을 추가하는 입력
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderItemInput {
    private UUID orderId;
    private Integer quantity;
    private BigDecimal unitPrice;
}
