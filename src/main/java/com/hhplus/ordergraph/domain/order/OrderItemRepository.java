package com.hhplus.ordergraph.domain.order;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * OrderItem 도메인 영속성 Port Interface
 */
public interface OrderItemRepository {

    OrderItem save(OrderItem orderItem);

    /**
     * 현재 영속성 컨텍스트의 변경 사항을 DB에 반영
     */
    void flush();

    Optional<OrderItem> findById(UUID orderItemId);

    List<OrderItem> findAll();

    /**
     * 여러 주문의 항목 일괄 조회 (GraphQL 배치 로딩용)
     */
    List<OrderItem> findAllByOrderIdIn(Collection<UUID> orderIds);

    long countByOrderId(UUID orderId);

    /**
     * @return 실제로 삭제된 행이 있으면 true
     */
    boolean deleteById(UUID orderItemId);

    long count();
}
