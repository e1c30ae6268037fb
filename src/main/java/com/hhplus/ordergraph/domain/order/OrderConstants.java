package com.hhplus.ordergraph.domain.order;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Order 도메인 상수
 */
public final class OrderConstants {

    /** numeric(10,2) */
    public static final int MONEY_PRECISION = 10;
    public static final int MONEY_SCALE = 2;

    /** numeric(10,2)에 저장 가능한 최대/최소 금액 */
    public static final String MONEY_MAX = "99999999.99";
    public static final String MONEY_MIN = "-99999999.99";
    public static final String MONEY_RANGE_MESSAGE = "금액은 -99999999.99 이상 99999999.99 이하여야 합니다";

    public static final int MIN_ORDER_ITEMS = 1;

    private OrderConstants() {
    }

    /**
     * 금액을 소수점 둘째 자리로 정규화 (HALF_UP)
     */
    public static BigDecimal normalizeMoney(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("금액은 필수입니다");
        }
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
