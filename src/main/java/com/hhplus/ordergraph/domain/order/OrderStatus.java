package com.hhplus.ordergraph.domain.order;

import lombok.Getter;

import java.util.Arrays;

/**
 * OrderStatus - 도메인 값 객체 (Enum)
 *
 * 주문 상태를 나타내며 DB에는 소문자 값(orders_status_enum)으로 저장된다.
 * - PENDING: 주문 생성됨 (기본값)
 * - PAID: 결제 완료
 * - SHIPPED: 배송됨
 * - CANCELLED: 주문 취소
 *
 * 상태 전환 규칙은 없다. 생성 시 어떤 값이든 지정할 수 있고 이후 변경 연산은 제공하지 않는다.
 */
@Getter
public enum OrderStatus {
    PENDING("pending"),
    PAID("paid"),
    SHIPPED("shipped"),
    CANCELLED("cancelled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    /**
     * 문자열에서 OrderStatus로 변환 (대소문자 무시)
     *
     * @param status 상태 문자열, null이면 PENDING
     * @throws InvalidOrderStatusException 정의되지 않은 상태
     */
    public static OrderStatus fromValue(String status) {
        if (status == null) {
            return PENDING;
        }
        return Arrays.stream(values())
                .filter(candidate -> candidate.value.equalsIgnoreCase(status.trim()))
                .findFirst()
                .orElseThrow(() -> new InvalidOrderStatusException(status));
    }
}
