package com.hhplus.ordergraph.common.exception;

/**
 * ApplicationException - 애플리케이션 계층 처리 실패 예외
 *
 * 역할:
 * - 입력은 유효하지만 저장소 쓰기 도중 실패한 경우
 * - 일반적으로 서버 오류(5XX)로 응답
 *
 * 사용 예:
 * - 주문 + 주문 항목 원자적 저장 중 제약 조건 위반 (ORDER_CREATION_FAILED)
 *
 * DomainException과의 차이:
 * - DomainException: 요청 자체가 규칙을 위반 (예: 빈 주문 항목)
 * - ApplicationException: 규칙은 만족하지만 처리 과정이 실패 (예: DB 제약 위반)
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
