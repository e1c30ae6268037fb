package com.hhplus.ordergraph.domain.order;

import com.hhplus.ordergraph.common.exception.DomainException;
import com.hhplus.ordergraph.common.exception.ErrorCode;

/**
 * 정의되지 않은 주문 상태 값이 입력되었을 때 발생하는 예외 (400 Bad Request)
 * 허용 값: pending, paid, shipped, cancelled
 */
public class InvalidOrderStatusException extends DomainException {

    public InvalidOrderStatusException(String status) {
        super(ErrorCode.INVALID_ORDER_STATUS, "Status: " + status);
    }
}
