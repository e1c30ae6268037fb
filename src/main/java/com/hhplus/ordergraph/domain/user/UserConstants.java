package com.hhplus.ordergraph.domain.user;

/**
 * User 도메인 상수
 */
public final class UserConstants {

    public static final int NAME_MIN_LENGTH = 2;
    public static final int NAME_MAX_LENGTH = 100;
    public static final int EMAIL_MAX_LENGTH = 255;

    private UserConstants() {
    }
}
