package com.hhplus.ordergraph.application.order.dto;

import com.hhplus.ordergraph.domain.order.OrderConstants;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * 기존 주문에 항목을 추가하는 커맨드
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderItemCommand {

    @NotNull
    private UUID orderId;

    @NotNull
    private Integer quantity;

    @NotNull
    @DecimalMin(value = OrderConstants.MONEY_MIN, message = OrderConstants.MONEY_RANGE_MESSAGE)
    @DecimalMax(value = OrderConstants.MONEY_MAX, message = OrderConstants.MONEY_RANGE_MESSAGE)
    private BigDecimal unitPrice;
}
