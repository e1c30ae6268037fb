package com.hhplus.ordergraph.common.exception;

import java.util.UUID;

/**
 * 쓰기 시점에 참조한 부모 리소스가 존재하지 않을 때 발생하는 예외
 *
 * 외래 키 위반을 도메인 오류로 표현한 것으로,
 * 주문 생성 시 userId, 주문 항목 생성 시 orderId 검증에 사용된다.
 */
public class ReferencedEntityNotFoundException extends DomainException {

    private final String entityName;
    private final UUID entityId;

    public ReferencedEntityNotFoundException(String entityName, UUID entityId) {
        super(ErrorCode.REFERENCED_ENTITY_NOT_FOUND, String.format("%s (ID: %s)", entityName, entityId));
        this.entityName = entityName;
        this.entityId = entityId;
    }

    public ReferencedEntityNotFoundException(String entityName, UUID entityId, Throwable cause) {
        super(ErrorCode.REFERENCED_ENTITY_NOT_FOUND, String.format("%s (ID: %s)", entityName, entityId), cause);
        this.entityName = entityName;
        this.entityId = entityId;
    }

    public String getEntityName() {
        return entityName;
    }

    public UUID getEntityId() {
        return entityId;
    }
}
