package com.hhplus.ordergraph.application.order;

import com.hhplus.ordergraph.application.common.CommandValidator;
import com.hhplus.ordergraph.application.order.dto.CreateOrderItemCommand;
import com.hhplus.ordergraph.application.order.dto.OrderItemResponse;
import com.hhplus.ordergraph.common.exception.ApplicationException;
import com.hhplus.ordergraph.common.exception.ErrorCode;
import com.hhplus.ordergraph.common.exception.ReferencedEntityNotFoundException;
import com.hhplus.ordergraph.domain.order.Order;
import com.hhplus.ordergraph.domain.order.OrderItem;
import com.hhplus.ordergraph.domain.order.OrderItemNotFoundException;
import com.hhplus.ordergraph.domain.order.OrderItemRepository;
import com.hhplus.ordergraph.domain.order.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * OrderItemService - 주문 항목 관리 서비스 (Application 계층)
 */
@Service
public class OrderItemService {

    private static final Logger log = LoggerFactory.getLogger(OrderItemService.class);

    private final OrderItemRepository orderItemRepository;
    private final OrderRepository orderRepository;
    private final CommandValidator commandValidator;

    public OrderItemService(OrderItemRepository orderItemRepository,
                            OrderRepository orderRepository,
                            CommandValidator commandValidator) {
        this.orderItemRepository = orderItemRepository;
        this.orderRepository = orderRepository;
        this.commandValidator = commandValidator;
    }

    /**
     * 기존 주문에 항목 추가
     *
     * @throws com.hhplus.ordergraph.common.exception.InvalidInputException 필수 값 누락
     * @throws ReferencedEntityNotFoundException 주문 없음
     * @throws ApplicationException 저장소 쓰기 실패 (ORDER_ITEM_CREATION_FAILED)
     */
    @Transactional
    public OrderItemResponse createOrderItem(CreateOrderItemCommand command) {
        commandValidator.validate(command);

        Order order = orderRepository.findById(command.getOrderId())
                .orElseThrow(() -> new ReferencedEntityNotFoundException("Order", command.getOrderId()));

        OrderItem saved;
        try {
            saved = orderItemRepository.save(
                    OrderItem.createOrderItem(order, command.getQuantity(), command.getUnitPrice()));
            orderItemRepository.flush();
        } catch (DataAccessException e) {
            log.error("[OrderItemService] 주문 항목 저장 실패: orderId={}, cause={}",
                    order.getId(), e.getMostSpecificCause().getMessage());
            throw new ApplicationException(ErrorCode.ORDER_ITEM_CREATION_FAILED, e);
        }

        log.info("[OrderItemService] 주문 항목 생성 완료: orderItemId={}, orderId={}", saved.getId(), order.getId());
        return OrderItemResponse.fromOrderItem(saved);
    }

    @Transactional(readOnly = true)
    public List<OrderItemResponse> findAll() {
        return orderItemRepository.findAll().stream()
                .map(OrderItemResponse::fromOrderItem)
                .collect(Collectors.toList());
    }

    /**
     * 여러 주문의 항목 일괄 조회 (GraphQL 배치 로딩용)
     *
     * @return 주문 ID → 주문 항목 목록, 항목이 없는 주문은 포함되지 않음
     */
    @Transactional(readOnly = true)
    public Map<UUID, List<OrderItemResponse>> findByOrderIds(Collection<UUID> orderIds) {
        return orderItemRepository.findAllByOrderIdIn(orderIds).stream()
                .map(OrderItemResponse::fromOrderItem)
                .collect(Collectors.groupingBy(OrderItemResponse::getOrderId));
    }

    /**
     * 주문 항목 삭제
     *
     * @return 삭제 직전 스냅샷
     */
    @Transactional
    public OrderItemResponse deleteOrderItem(UUID orderItemId) {
        OrderItem orderItem = orderItemRepository.findById(orderItemId)
                .orElseThrow(() -> new OrderItemNotFoundException(orderItemId));
        OrderItemResponse snapshot = OrderItemResponse.fromOrderItem(orderItem);

        if (!orderItemRepository.deleteById(orderItemId)) {
            throw new OrderItemNotFoundException(orderItemId);
        }

        log.info("[OrderItemService] 주문 항목 삭제 완료: orderItemId={}, orderId={}", orderItemId, snapshot.getOrderId());
        return snapshot;
    }
}
