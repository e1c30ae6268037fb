package com.hhplus.ordergraph.infrastructure.persistence.order;

import com.hhplus.ordergraph.domain.order.Order;
import com.hhplus.ordergraph.domain.order.OrderRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL 기반 Order Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(OrderRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
public class PostgreSQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public PostgreSQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public void flush() {
        orderJpaRepository.flush();
    }

    @Override
    public Optional<Order> findById(UUID orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    public Optional<Order> findByIdWithUserAndItems(UUID orderId) {
        return orderJpaRepository.findByIdWithUserAndItems(orderId);
    }

    @Override
    public List<Order> findAllWithUserAndItems() {
        return orderJpaRepository.findAllWithUserAndItems();
    }

    @Override
    public List<Order> findAllWithItemsByUserId(UUID userId) {
        return orderJpaRepository.findAllWithItemsByUserId(userId);
    }

    @Override
    public List<Order> findAllByUserIdIn(Collection<UUID> userIds) {
        if (userIds.isEmpty()) {
            return List.of();
        }
        return orderJpaRepository.findAllByUserIdIn(userIds);
    }

    @Override
    public boolean existsById(UUID orderId) {
        return orderJpaRepository.existsById(orderId);
    }

    @Override
    public boolean deleteById(UUID orderId) {
        return orderJpaRepository.deleteByIdInBulk(orderId) > 0;
    }

    @Override
    public long count() {
        return orderJpaRepository.count();
    }
}
