package com.hhplus.ordergraph.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 입력값 검증 실패, 존재하지 않는 리소스 참조, 유일성 제약 위반
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - UserNotFoundException: 사용자 조회 실패
 * - DuplicateEmailException: 이메일 중복
 * - ReferencedEntityNotFoundException: 존재하지 않는 부모 ID 참조
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public DomainException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
