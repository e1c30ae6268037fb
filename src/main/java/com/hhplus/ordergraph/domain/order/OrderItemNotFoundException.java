package com.hhplus.ordergraph.domain.order;

import com.hhplus.ordergraph.common.exception.DomainException;
import com.hhplus.ordergraph.common.exception.ErrorCode;

import java.util.UUID;

/**
 * 주문 항목을 찾을 수 없을 때 발생하는 예외
 */
public class OrderItemNotFoundException extends DomainException {

    private final UUID orderItemId;

    public OrderItemNotFoundException(UUID orderItemId) {
        super(ErrorCode.ORDER_ITEM_NOT_FOUND, "OrderItem ID: " + orderItemId);
        this.orderItemId = orderItemId;
    }

    public UUID getOrderItemId() {
        return orderItemId;
    }
}
