package com.hhplus.ordergraph.unit.domain.order;

import com.hhplus.ordergraph.common.exception.ErrorCode;
import com.hhplus.ordergraph.domain.order.InvalidOrderStatusException;
import com.hhplus.ordergraph.domain.order.OrderStatus;
import com.hhplus.ordergraph.domain.order.OrderStatusConverter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OrderStatus 변환 테스트")
class OrderStatusTest {

    @ParameterizedTest
    @CsvSource({
            "pending, PENDING",
            "PAID, PAID",
            "' shipped ', SHIPPED",
            "Cancelled, CANCELLED"
    })
    @DisplayName("문자열 → OrderStatus (대소문자, 공백 무시)")
    void testFromValue(String raw, OrderStatus expected) {
        assertThat(OrderStatus.fromValue(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("null이면 PENDING")
    void testFromValue_Null() {
        assertThat(OrderStatus.fromValue(null)).isEqualTo(OrderStatus.PENDING);
    }

    @Test
    @DisplayName("정의되지 않은 상태 - InvalidOrderStatusException")
    void testFromValue_Unknown() {
        assertThatThrownBy(() -> OrderStatus.fromValue("refunded"))
                .isInstanceOf(InvalidOrderStatusException.class)
                .satisfies(e -> assertThat(((InvalidOrderStatusException) e).getErrorCode())
                        .isEqualTo(ErrorCode.INVALID_ORDER_STATUS))
                .hasMessageContaining("refunded");
    }

    @Test
    @DisplayName("DB 컬럼 값은 소문자 문자열")
    void testConverter() {
        OrderStatusConverter converter = new OrderStatusConverter();

        assertThat(converter.convertToDatabaseColumn(OrderStatus.SHIPPED)).isEqualTo("shipped");
        assertThat(converter.convertToEntityAttribute("paid")).isEqualTo(OrderStatus.PAID);
    }
}
