package com.hhplus.ordergraph.domain.order;

import com.hhplus.ordergraph.common.exception.DomainException;
import com.hhplus.ordergraph.common.exception.ErrorCode;

import java.util.UUID;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외
 */
public class OrderNotFoundException extends DomainException {

    private final UUID orderId;

    public OrderNotFoundException(UUID orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order ID: " + orderId);
        this.orderId = orderId;
    }

    public UUID getOrderId() {
        return orderId;
    }
}
