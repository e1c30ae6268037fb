package com.hhplus.ordergraph.infrastructure.persistence.order;

import com.hhplus.ordergraph.domain.order.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * OrderItem JPA Repository
 */
public interface OrderItemJpaRepository extends JpaRepository<OrderItem, UUID> {

    @Query("SELECT i FROM OrderItem i WHERE i.order.id IN :orderIds")
    List<OrderItem> findAllByOrderIdIn(@Param("orderIds") Collection<UUID> orderIds);

    @Query("SELECT COUNT(i) FROM OrderItem i WHERE i.order.id = :orderId")
    long countByOrderId(@Param("orderId") UUID orderId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM OrderItem i WHERE i.id = :orderItemId")
    int deleteByIdInBulk(@Param("orderItemId") UUID orderItemId);
}
