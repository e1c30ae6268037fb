package com.hhplus.ordergraph.unit.domain.order;

import com.hhplus.ordergraph.config.TestDataFactory;
import com.hhplus.ordergraph.domain.order.Order;
import com.hhplus.ordergraph.domain.order.OrderItem;
import com.hhplus.ordergraph.domain.order.OrderStatus;
import com.hhplus.ordergraph.domain.user.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order 도메인 엔티티 단위 테스트
 */
@DisplayName("Order 도메인 엔티티 테스트")
class OrderTest {

    private User user;

    @BeforeEach
    void setUp() {
        user = TestDataFactory.user("김철수", "kim@example.com");
    }

    @Test
    @DisplayName("주문 생성 - 상태 미지정 시 PENDING")
    void testCreateOrder_DefaultStatus() {
        // When
        Order order = Order.createOrder(user, null, new BigDecimal("100"));

        // Then
        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertSame(user, order.getUser());
        assertEquals(0, order.getOrderItemCount());
    }

    @Test
    @DisplayName("주문 생성 - 총액은 소수점 둘째 자리로 반올림(HALF_UP)")
    void testCreateOrder_NormalizesTotalCost() {
        // When
        Order order = Order.createOrder(user, OrderStatus.PAID, new BigDecimal("10.005"));

        // Then
        assertEquals(new BigDecimal("10.01"), order.getTotalCost());
        assertEquals(OrderStatus.PAID, order.getStatus());
    }

    @Test
    @DisplayName("주문 생성 - 생성 시각 <= 수정 시각")
    void testCreateOrder_Timestamps() {
        Order order = Order.createOrder(user, OrderStatus.PENDING, BigDecimal.ONE);

        assertNotNull(order.getCreatedAt());
        assertFalse(order.getCreatedAt().isAfter(order.getUpdatedAt()));
    }

    @Test
    @DisplayName("주문 생성 실패 - 사용자 없음")
    void testCreateOrder_Failed_NullUser() {
        assertThrows(IllegalArgumentException.class,
                () -> Order.createOrder(null, OrderStatus.PENDING, BigDecimal.ONE));
    }

    @Test
    @DisplayName("주문 생성 실패 - 총액 없음")
    void testCreateOrder_Failed_NullTotalCost() {
        assertThrows(IllegalArgumentException.class,
                () -> Order.createOrder(user, OrderStatus.PENDING, null));
    }

    @Test
    @DisplayName("주문 항목 추가")
    void testAddOrderItem() {
        // Given
        Order order = Order.createOrder(user, OrderStatus.PENDING, new BigDecimal("30"));
        OrderItem first = OrderItem.createOrderItem(order, 1, new BigDecimal("10"));
        OrderItem second = OrderItem.createOrderItem(order, 2, new BigDecimal("10"));

        // When
        order.addOrderItem(first);
        order.addOrderItem(second);

        // Then
        assertEquals(2, order.getOrderItemCount());
        assertThrows(IllegalArgumentException.class, () -> order.addOrderItem(null));
    }
}
