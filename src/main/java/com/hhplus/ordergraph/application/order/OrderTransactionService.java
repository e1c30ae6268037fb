package com.hhplus.ordergraph.application.order;

import com.hhplus.ordergraph.application.order.dto.OrderItemCommand;
import com.hhplus.ordergraph.application.order.dto.OrderResponse;
import com.hhplus.ordergraph.common.exception.ApplicationException;
import com.hhplus.ordergraph.common.exception.ErrorCode;
import com.hhplus.ordergraph.common.exception.ReferencedEntityNotFoundException;
import com.hhplus.ordergraph.domain.order.Order;
import com.hhplus.ordergraph.domain.order.OrderItem;
import com.hhplus.ordergraph.domain.order.OrderItemRepository;
import com.hhplus.ordergraph.domain.order.OrderRepository;
import com.hhplus.ordergraph.domain.order.OrderStatus;
import com.hhplus.ordergraph.domain.user.User;
import com.hhplus.ordergraph.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * OrderTransactionService - 주문 트랜잭션 처리 서비스 (Application 계층)
 *
 * 역할:
 * - OrderService와 분리된 독립적인 서비스
 * - 주문 + 주문 항목 INSERT를 하나의 트랜잭션으로 처리
 * - @Transactional이 프록시를 통해 정상 작동하도록 보장
 *
 * 이유:
 * - OrderService 내에서 @Transactional 메서드를 직접 호출하면
 *   Spring AOP 프록시가 작동하지 않아 트랜잭션이 적용되지 않음
 *
 * 아키텍처:
 * OrderService (검증, 상태 파싱, 로깅)
 *     ↓ (의존성 주입)
 * OrderTransactionService (@Transactional 처리)
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final UserRepository userRepository;

    public OrderTransactionService(OrderRepository orderRepository,
                                   OrderItemRepository orderItemRepository,
                                   UserRepository userRepository) {
        this.orderRepository = orderRepository;
        this.orderItemRepository = orderItemRepository;
        this.userRepository = userRepository;
    }

    /**
     * 원자적 주문 생성
     *
     * 처리 순서:
     * 1. 주문자 조회 (없으면 ReferencedEntityNotFoundException)
     * 2. 주문 INSERT
     * 3. 주문 항목 INSERT (요청 순서대로)
     * 4. flush로 모든 INSERT를 반환 전에 실행
     *
     * 어느 단계에서든 저장소 오류가 나면 트랜잭션 전체가 롤백되고
     * ApplicationException(ORDER_CREATION_FAILED)으로 전달된다.
     *
     * @return 사용자, 주문 항목이 포함된 주문
     */
    @Transactional
    public OrderResponse executeTransactionalOrder(UUID userId,
                                                   OrderStatus status,
                                                   BigDecimal totalCost,
                                                   List<OrderItemCommand> itemCommands) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ReferencedEntityNotFoundException("User", userId));

        try {
            Order order = orderRepository.save(Order.createOrder(user, status, totalCost));

            for (OrderItemCommand itemCommand : itemCommands) {
                OrderItem orderItem = OrderItem.createOrderItem(
                        order, itemCommand.getQuantity(), itemCommand.getUnitPrice());
                order.addOrderItem(orderItemRepository.save(orderItem));
            }

            orderRepository.flush();

            log.debug("[OrderTransactionService] 주문 INSERT 완료: orderId={}, items={}",
                    order.getId(), order.getOrderItemCount());
            return OrderResponse.fromOrderWithUserAndItems(order);
        } catch (DataAccessException e) {
            // 드라이버 메시지에는 SQL이 포함되므로 로그에만 남긴다
            log.error("[OrderTransactionService] 주문 저장 실패, 롤백: userId={}, cause={}",
                    userId, e.getMostSpecificCause().getMessage());
            throw new ApplicationException(ErrorCode.ORDER_CREATION_FAILED, e);
        }
    }
}
