package com.hhplus.ordergraph.domain.user;

import com.hhplus.ordergraph.common.exception.DomainException;
import com.hhplus.ordergraph.common.exception.ErrorCode;

/**
 * 이미 등록된 이메일로 사용자를 생성하려 할 때 발생하는 예외 (409 Conflict)
 */
public class DuplicateEmailException extends DomainException {

    private final String email;

    public DuplicateEmailException(String email) {
        super(ErrorCode.DUPLICATE_EMAIL, "email: " + email);
        this.email = email;
    }

    public DuplicateEmailException(String email, Throwable cause) {
        super(ErrorCode.DUPLICATE_EMAIL, "email: " + email, cause);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
