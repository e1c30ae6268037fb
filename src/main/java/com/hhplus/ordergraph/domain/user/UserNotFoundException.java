package com.hhplus.ordergraph.domain.user;

import com.hhplus.ordergraph.common.exception.DomainException;
import com.hhplus.ordergraph.common.exception.ErrorCode;

import java.util.UUID;

/**
 * 사용자를 찾을 수 없을 때 발생하는 예외
 */
public class UserNotFoundException extends DomainException {

    private final UUID userId;

    public UserNotFoundException(UUID userId) {
        super(ErrorCode.USER_NOT_FOUND, "User ID: " + userId);
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }
}
