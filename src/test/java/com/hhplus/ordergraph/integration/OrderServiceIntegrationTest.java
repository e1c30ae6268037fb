package com.hhplus.ordergraph.integration;

import com.hhplus.ordergraph.application.order.OrderItemService;
import com.hhplus.ordergraph.application.order.OrderService;
import com.hhplus.ordergraph.application.order.dto.CreateOrderCommand;
import com.hhplus.ordergraph.application.order.dto.CreateOrderItemCommand;
import com.hhplus.ordergraph.application.order.dto.OrderItemCommand;
import com.hhplus.ordergraph.application.order.dto.OrderItemResponse;
import com.hhplus.ordergraph.application.order.dto.OrderResponse;
import com.hhplus.ordergraph.application.user.UserService;
import com.hhplus.ordergraph.application.user.dto.CreateUserCommand;
import com.hhplus.ordergraph.common.exception.InvalidInputException;
import com.hhplus.ordergraph.common.exception.ReferencedEntityNotFoundException;
import com.hhplus.ordergraph.config.AbstractIntegrationTest;
import com.hhplus.ordergraph.domain.order.OrderItemNotFoundException;
import com.hhplus.ordergraph.domain.order.OrderItemRepository;
import com.hhplus.ordergraph.domain.order.OrderNotFoundException;
import com.hhplus.ordergraph.domain.order.OrderRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 주문/주문 항목 통합 테스트 (H2)
 */
@DisplayName("OrderService, OrderItemService 통합 테스트")
class OrderServiceIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private UserService userService;

    @Autowired
    private OrderService orderService;

    @Autowired
    private OrderItemService orderItemService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    private UUID userId;

    @BeforeEach
    void setUp() {
        userId = userService.createUser(new CreateUserCommand("김철수", "kim@example.com")).getId();
    }

    private CreateOrderCommand orderCommand(UUID ownerId, String status, List<OrderItemCommand> items) {
        return CreateOrderCommand.builder()
                .userId(ownerId)
                .status(status)
                .totalCost(new BigDecimal("100.00"))
                .orderItems(items)
                .build();
    }

    @Test
    @DisplayName("주문 생성 - 주문과 항목이 함께 저장되고 조회된다")
    void testCreateOrder() {
        // When
        OrderResponse created = orderService.createOrder(orderCommand(userId, "paid", List.of(
                new OrderItemCommand(1, new BigDecimal("10")),
                new OrderItemCommand(2, new BigDecimal("45")))));

        // Then
        assertThat(created.getId()).isNotNull();
        assertThat(created.getStatus()).isEqualTo("paid");
        assertThat(created.getOrderItems()).hasSize(2)
                .allSatisfy(item -> assertThat(item.getOrderId()).isEqualTo(created.getId()));
        assertThat(orderItemRepository.countByOrderId(created.getId())).isEqualTo(2);

        List<OrderResponse> all = orderService.findAll();
        assertThat(all).hasSize(1);
        assertThat(all.get(0).getUser().getEmail()).isEqualTo("kim@example.com");
        assertThat(all.get(0).getOrderItems()).hasSize(2);
    }

    @Test
    @DisplayName("주문 생성 실패 - 항목 없음")
    void testCreateOrder_EmptyItems() {
        assertThatThrownBy(() -> orderService.createOrder(orderCommand(userId, "pending", List.of())))
                .isInstanceOf(InvalidInputException.class);
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    @DisplayName("주문 생성 실패 - 없는 사용자, 주문/항목 수 변화 없음")
    void testCreateOrder_UnknownUser() {
        // Given
        long ordersBefore = orderRepository.count();
        long itemsBefore = orderItemRepository.count();

        // When & Then
        assertThatThrownBy(() -> orderService.createOrder(orderCommand(UUID.randomUUID(), "pending",
                List.of(new OrderItemCommand(1, BigDecimal.TEN)))))
                .isInstanceOf(ReferencedEntityNotFoundException.class);

        assertThat(orderRepository.count()).isEqualTo(ordersBefore);
        assertThat(orderItemRepository.count()).isEqualTo(itemsBefore);
    }

    @Test
    @DisplayName("주문 삭제 - N개 항목이 함께 삭제되고 스냅샷은 N개 유지")
    void testDeleteOrder_CascadesToItems() {
        // Given
        OrderResponse created = orderService.createOrder(orderCommand(userId, null, List.of(
                new OrderItemCommand(1, BigDecimal.ONE),
                new OrderItemCommand(1, BigDecimal.ONE),
                new OrderItemCommand(1, BigDecimal.ONE),
                new OrderItemCommand(1, BigDecimal.ONE))));

        // When
        OrderResponse snapshot = orderService.deleteOrder(created.getId());

        // Then
        assertThat(snapshot.getOrderItems()).hasSize(4);
        assertThat(snapshot.getStatus()).isEqualTo("pending");
        assertThat(orderRepository.existsById(created.getId())).isFalse();
        assertThat(orderItemRepository.countByOrderId(created.getId())).isZero();

        assertThatThrownBy(() -> orderService.deleteOrder(created.getId()))
                .isInstanceOf(OrderNotFoundException.class);
    }

    @Test
    @DisplayName("주문 항목 추가/삭제")
    void testCreateAndDeleteOrderItem() {
        // Given
        OrderResponse order = orderService.createOrder(orderCommand(userId, "pending",
                List.of(new OrderItemCommand(1, BigDecimal.TEN))));

        // When
        OrderItemResponse added = orderItemService.createOrderItem(
                new CreateOrderItemCommand(order.getId(), 5, new BigDecimal("2.345")));

        // Then
        assertThat(added.getUnitPrice()).isEqualByComparingTo("2.35");
        assertThat(orderItemRepository.countByOrderId(order.getId())).isEqualTo(2);
        assertThat(orderItemService.findAll()).hasSize(2);

        OrderItemResponse snapshot = orderItemService.deleteOrderItem(added.getId());
        assertThat(snapshot.getQuantity()).isEqualTo(5);
        assertThat(orderItemRepository.countByOrderId(order.getId())).isEqualTo(1);
        assertThatThrownBy(() -> orderItemService.deleteOrderItem(added.getId()))
                .isInstanceOf(OrderItemNotFoundException.class);
    }

    @Test
    @DisplayName("주문 항목 추가 실패 - 없는 주문")
    void testCreateOrderItem_UnknownOrder() {
        assertThatThrownBy(() -> orderItemService.createOrderItem(
                new CreateOrderItemCommand(UUID.randomUUID(), 1, BigDecimal.ONE)))
                .isInstanceOf(ReferencedEntityNotFoundException.class);
    }
}
