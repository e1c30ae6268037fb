package com.hhplus.ordergraph.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑 (GraphQL ErrorType 분류 기준)
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_USER_NOT_FOUND, APP_ORDER_CREATION_FAILED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Common
    INVALID_INPUT("DOMAIN_INVALID_INPUT", "입력값이 유효하지 않습니다", 400),
    REFERENCED_ENTITY_NOT_FOUND("DOMAIN_REFERENCED_ENTITY_NOT_FOUND", "참조하는 리소스가 존재하지 않습니다", 404),

    // User Domain
    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "사용자를 찾을 수 없습니다", 404),
    DUPLICATE_EMAIL("DOMAIN_USER_DUPLICATE_EMAIL", "이미 사용 중인 이메일입니다", 409),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS", "유효하지 않은 주문 상태입니다", 400),
    ORDER_ITEM_NOT_FOUND("DOMAIN_ORDER_ITEM_NOT_FOUND", "주문 항목을 찾을 수 없습니다", 404),

    // ========== Application Layer Errors (5XX) ==========

    ORDER_CREATION_FAILED("APP_ORDER_CREATION_FAILED", "주문 생성에 실패했습니다", 500),
    ORDER_ITEM_CREATION_FAILED("APP_ORDER_ITEM_CREATION_FAILED", "주문 항목 생성에 실패했습니다", 500),

    // ========== System Errors (5XX) ==========

    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
