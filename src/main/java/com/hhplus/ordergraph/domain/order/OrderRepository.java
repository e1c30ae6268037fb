package com.hhplus.ordergraph.domain.order;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order 도메인 영속성 Port Interface
 * 주문 데이터의 저장, 조회, 삭제를 담당
 */
public interface OrderRepository {
    /**
     * 주문 저장 (flush하지 않음, 트랜잭션 커밋 또는 flush() 시 INSERT)
     */
    Order save(Order order);

    /**
     * 현재 영속성 컨텍스트의 변경 사항을 DB에 반영
     */
    void flush();

    Optional<Order> findById(UUID orderId);

    /**
     * 주문 ID로 조회 (사용자, 주문 항목 함께 로드)
     */
    Optional<Order> findByIdWithUserAndItems(UUID orderId);

    /**
     * 모든 주문 조회 (사용자, 주문 항목 함께 로드)
     */
    List<Order> findAllWithUserAndItems();

    /**
     * 사용자별 주문 조회 (주문 항목 함께 로드)
     */
    List<Order> findAllWithItemsByUserId(UUID userId);

    /**
     * 여러 사용자의 주문 일괄 조회 (GraphQL 배치 로딩용)
     */
    List<Order> findAllByUserIdIn(Collection<UUID> userIds);

    boolean existsById(UUID orderId);

    /**
     * 주문 삭제 (단일 DELETE 문, 주문 항목은 DB CASCADE)
     *
     * @return 실제로 삭제된 행이 있으면 true
     */
    boolean deleteById(UUID orderId);

    long count();
}
