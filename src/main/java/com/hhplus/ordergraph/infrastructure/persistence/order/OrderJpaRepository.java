package com.hhplus.ordergraph.infrastructure.persistence.order;

import com.hhplus.ordergraph.domain.order.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order JPA Repository
 * Spring Data JPA를 통한 Order 엔티티 영구 저장소
 *
 * ✅ FetchType 정책:
 * - Order.user, Order.orderItems 모두 FetchType.LAZY
 * - 함께 필요한 조회는 fetch join으로 한 번에 로드 (N+1 방지)
 */
public interface OrderJpaRepository extends JpaRepository<Order, UUID> {

    /**
     * 주문 ID로 조회 (사용자, 주문 항목 함께 로드)
     */
    @Query("SELECT DISTINCT o FROM Order o " +
           "JOIN FETCH o.user " +
           "LEFT JOIN FETCH o.orderItems " +
           "WHERE o.id = :orderId")
    Optional<Order> findByIdWithUserAndItems(@Param("orderId") UUID orderId);

    /**
     * 전체 주문 조회 (사용자, 주문 항목 함께 로드)
     */
    @Query("SELECT DISTINCT o FROM Order o " +
           "JOIN FETCH o.user " +
           "LEFT JOIN FETCH o.orderItems")
    List<Order> findAllWithUserAndItems();

    /**
     * 사용자별 주문 조회 (주문 항목 함께 로드)
     */
    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems " +
           "WHERE o.user.id = :userId")
    List<Order> findAllWithItemsByUserId(@Param("userId") UUID userId);

    @Query("SELECT o FROM Order o WHERE o.user.id IN :userIds")
    List<Order> findAllByUserIdIn(@Param("userIds") Collection<UUID> userIds);

    /**
     * 주문 단건 삭제 (JPQL bulk delete)
     *
     * SQL 생성:
     * DELETE FROM orders WHERE id = ?
     *
     * order_items.order_id FK의 ON DELETE CASCADE로 주문 항목도 같은 문장에서 삭제
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Order o WHERE o.id = :orderId")
    int deleteByIdInBulk(@Param("orderId") UUID orderId);
}
