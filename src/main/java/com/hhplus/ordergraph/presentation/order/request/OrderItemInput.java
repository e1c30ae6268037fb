package com.hhplus.ordergraph.presentation.order.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * 주문 생성 시 함께 전달되는 주문 항목 입력
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemInput {
    private Integer quantity;
    private BigDecimal unitPrice;
}
