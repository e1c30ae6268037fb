package com.hhplus.ordergraph.application.order.dto;

import com.hhplus.ordergraph.domain.order.OrderConstants;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * 주문 생성 커맨드 (Application layer)
 *
 * status는 null이면 pending으로 처리된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderCommand {

    @NotNull
    private UUID userId;

    private String status;

    @NotNull
    @DecimalMin(value = OrderConstants.MONEY_MIN, message = OrderConstants.MONEY_RANGE_MESSAGE)
    @DecimalMax(value = OrderConstants.MONEY_MAX, message = OrderConstants.MONEY_RANGE_MESSAGE)
    private BigDecimal totalCost;

    @NotNull
    @Size(min = OrderConstants.MIN_ORDER_ITEMS, message = "주문 항목은 최소 1개 이상이어야 합니다")
    private List<@NotNull @Valid OrderItemCommand> orderItems;
}
