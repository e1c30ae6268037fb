package com.hhplus.ordergraph.unit.domain.order;

import com.hhplus.ordergraph.config.TestDataFactory;
import com.hhplus.ordergraph.domain.order.Order;
import com.hhplus.ordergraph.domain.order.OrderItem;
import com.hhplus.ordergraph.domain.order.OrderStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrderItem 도메인 엔티티 단위 테스트
 */
@DisplayName("OrderItem 도메인 엔티티 테스트")
class OrderItemTest {

    private final Order order = TestDataFactory.order(
            TestDataFactory.user("김철수", "kim@example.com"), OrderStatus.PENDING, "100.00");

    @Test
    @DisplayName("주문 항목 생성 - 단가 정규화, 부모 주문 연결")
    void testCreateOrderItem() {
        // When
        OrderItem orderItem = OrderItem.createOrderItem(order, 3, new BigDecimal("9.999"));

        // Then
        assertSame(order, orderItem.getOrder());
        assertEquals(3, orderItem.getQuantity());
        assertEquals(new BigDecimal("10.00"), orderItem.getUnitPrice());
        assertEquals(orderItem.getCreatedAt(), orderItem.getUpdatedAt());
    }

    @Test
    @DisplayName("수량 0도 허용 (하한은 강제하지 않음)")
    void testCreateOrderItem_ZeroQuantityAllowed() {
        OrderItem orderItem = OrderItem.createOrderItem(order, 0, BigDecimal.TEN);

        assertEquals(0, orderItem.getQuantity());
    }

    @Test
    @DisplayName("주문 항목 생성 실패 - 부모 주문 없음")
    void testCreateOrderItem_Failed_NullOrder() {
        assertThrows(IllegalArgumentException.class,
                () -> OrderItem.createOrderItem(null, 1, BigDecimal.ONE));
    }

    @Test
    @DisplayName("주문 항목 생성 실패 - 단가 없음")
    void testCreateOrderItem_Failed_NullUnitPrice() {
        assertThrows(IllegalArgumentException.class,
                () -> OrderItem.createOrderItem(order, 1, null));
    }
}
