package com.hhplus.ordergraph.application.order;

import com.hhplus.ordergraph.application.common.CommandValidator;
import com.hhplus.ordergraph.application.order.dto.CreateOrderCommand;
import com.hhplus.ordergraph.application.order.dto.OrderResponse;
import com.hhplus.ordergraph.domain.order.Order;
import com.hhplus.ordergraph.domain.order.OrderNotFoundException;
import com.hhplus.ordergraph.domain.order.OrderRepository;
import com.hhplus.ordergraph.domain.order.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * OrderService - 주문 관리 서비스 (Application 계층)
 *
 * 주문 생성 흐름:
 * 1단계: 입력 검증 (CommandValidator) + 주문 상태 파싱
 * 2단계: 원자적 저장 (@Transactional, OrderTransactionService에서 처리)
 * 3단계: 결과 로깅
 *
 * OrderService 내에서 @Transactional 메서드를 직접 호출하면
 * 프록시를 거치지 않으므로 2단계는 별도 빈으로 분리되어 있다.
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private final OrderRepository orderRepository;
    private final OrderTransactionService orderTransactionService;
    private final CommandValidator commandValidator;

    public OrderService(OrderRepository orderRepository,
                        OrderTransactionService orderTransactionService,
                        CommandValidator commandValidator) {
        this.orderRepository = orderRepository;
        this.orderTransactionService = orderTransactionService;
        this.commandValidator = commandValidator;
    }

    /**
     * 주문 생성 (주문 항목 포함)
     *
     * @throws com.hhplus.ordergraph.common.exception.InvalidInputException 필수 값 누락, 주문 항목 없음
     * @throws com.hhplus.ordergraph.domain.order.InvalidOrderStatusException 알 수 없는 주문 상태
     * @throws com.hhplus.ordergraph.common.exception.ReferencedEntityNotFoundException 주문자 없음
     * @throws com.hhplus.ordergraph.common.exception.ApplicationException 저장 실패 (전체 롤백)
     */
    public OrderResponse createOrder(CreateOrderCommand command) {
        // 1단계: 검증
        commandValidator.validate(command);
        OrderStatus status = OrderStatus.fromValue(command.getStatus());

        // 2단계: 원자적 저장
        OrderResponse response = orderTransactionService.executeTransactionalOrder(
                command.getUserId(),
                status,
                command.getTotalCost(),
                command.getOrderItems()
        );

        // 3단계
        log.info("[OrderService] 주문 생성 완료: orderId={}, userId={}, status={}, items={}",
                response.getId(), response.getUserId(), response.getStatus(), response.getOrderItems().size());
        return response;
    }

    /**
     * 전체 주문 조회 (사용자, 주문 항목 포함)
     */
    @Transactional(readOnly = true)
    public List<OrderResponse> findAll() {
        List<OrderResponse> orders = orderRepository.findAllWithUserAndItems().stream()
                .map(OrderResponse::fromOrderWithUserAndItems)
                .collect(Collectors.toList());
        log.debug("[OrderService] 전체 주문 조회: count={}", orders.size());
        return orders;
    }

    /**
     * 여러 사용자의 주문 일괄 조회 (GraphQL 배치 로딩용)
     *
     * @return 사용자 ID → 주문 목록, 주문이 없는 사용자는 포함되지 않음
     */
    @Transactional(readOnly = true)
    public Map<UUID, List<OrderResponse>> findByUserIds(Collection<UUID> userIds) {
        return orderRepository.findAllByUserIdIn(userIds).stream()
                .map(OrderResponse::fromOrder)
                .collect(Collectors.groupingBy(OrderResponse::getUserId));
    }

    /**
     * 주문 삭제
     *
     * 사용자와 주문 항목을 포함한 스냅샷을 만든 뒤 단일 DELETE 문을 실행한다.
     * 주문 항목은 ON DELETE CASCADE로 같은 문장에서 삭제된다.
     *
     * @return 삭제 직전 스냅샷
     */
    @Transactional
    public OrderResponse deleteOrder(UUID orderId) {
        Order order = orderRepository.findByIdWithUserAndItems(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        OrderResponse snapshot = OrderResponse.fromOrderWithUserAndItems(order);

        if (!orderRepository.deleteById(orderId)) {
            throw new OrderNotFoundException(orderId);
        }

        log.info("[OrderService] 주문 삭제 완료: orderId={}, items={}", orderId, snapshot.getOrderItems().size());
        return snapshot;
    }
}
