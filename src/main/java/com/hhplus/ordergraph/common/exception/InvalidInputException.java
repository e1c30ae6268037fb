package com.hhplus.ordergraph.common.exception;

/**
 * 입력값 검증 실패 예외 (400 Bad Request)
 *
 * 이름 길이, 이메일 형식, 빈 주문 항목 목록 등
 * 요청 수준에서 거부되어야 하는 경우에 사용한다.
 */
public class InvalidInputException extends DomainException {

    public InvalidInputException(String detailMessage) {
        super(ErrorCode.INVALID_INPUT, detailMessage);
    }
}
