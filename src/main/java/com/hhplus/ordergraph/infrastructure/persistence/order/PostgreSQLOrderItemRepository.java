package com.hhplus.ordergraph.infrastructure.persistence.order;

import com.hhplus.ordergraph.domain.order.OrderItem;
import com.hhplus.ordergraph.domain.order.OrderItemRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL 기반 OrderItem Repository 구현
 */
@Repository
public class PostgreSQLOrderItemRepository implements OrderItemRepository {

    private final OrderItemJpaRepository orderItemJpaRepository;

    public PostgreSQLOrderItemRepository(OrderItemJpaRepository orderItemJpaRepository) {
        this.orderItemJpaRepository = orderItemJpaRepository;
    }

    @Override
    public OrderItem save(OrderItem orderItem) {
        return orderItemJpaRepository.save(orderItem);
    }

    @Override
    public void flush() {
        orderItemJpaRepository.flush();
    }

    @Override
    public Optional<OrderItem> findById(UUID orderItemId) {
        return orderItemJpaRepository.findById(orderItemId);
    }

    @Override
    public List<OrderItem> findAll() {
        return orderItemJpaRepository.findAll();
    }

    @Override
    public List<OrderItem> findAllByOrderIdIn(Collection<UUID> orderIds) {
        if (orderIds.isEmpty()) {
            return List.of();
        }
        return orderItemJpaRepository.findAllByOrderIdIn(orderIds);
    }

    @Override
    public long countByOrderId(UUID orderId) {
        return orderItemJpaRepository.countByOrderId(orderId);
    }

    @Override
    public boolean deleteById(UUID orderItemId) {
        return orderItemJpaRepository.deleteByIdInBulk(orderItemId) > 0;
    }

    @Override
    public long count() {
        return orderItemJpaRepository.count();
    }
}
