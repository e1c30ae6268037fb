package com.hhplus.ordergraph.domain.order;

import com.hhplus.ordergraph.domain.user.User;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Order 도메인 엔티티
 *
 * 책임:
 * - 주문 상태, 총액 보관
 * - 소유 사용자(user_id)와 주문 항목 연관관계 보관
 *
 * 핵심 비즈니스 규칙:
 * - 주문은 반드시 한 명의 사용자에 속하며 생성 후 소유자는 변경 불가 (updatable = false)
 * - 사용자 삭제 시 주문도 삭제 (FK ON DELETE CASCADE)
 * - 주문 생성 시 최소 1개 이상의 항목 필요 (OrderTransactionService에서 함께 저장)
 */
@Entity
@Table(name = "orders")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @Convert(converter = OrderStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Column(name = "total_cost", nullable = false,
            precision = OrderConstants.MONEY_PRECISION, scale = OrderConstants.MONEY_SCALE)
    private BigDecimal totalCost;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 주문 항목 관계 (읽기 전용)
     * ✅ cascade 미설정: 항목 저장은 OrderTransactionService가 명시적으로 수행하고,
     *    삭제는 order_items.order_id FK의 ON DELETE CASCADE가 담당
     */
    @OneToMany(mappedBy = "order", fetch = FetchType.LAZY)
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드 (정적 팩토리)
     *
     * 비즈니스 규칙:
     * - 사용자는 필수
     * - 상태 미지정 시 PENDING
     * - 총액은 소수점 둘째 자리로 정규화
     */
    public static Order createOrder(User user, OrderStatus status, BigDecimal totalCost) {
        if (user == null) {
            throw new IllegalArgumentException("주문 사용자는 필수입니다");
        }

        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        return Order.builder()
                .user(user)
                .status(status == null ? OrderStatus.PENDING : status)
                .totalCost(OrderConstants.normalizeMoney(totalCost))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 주문 항목 추가 (메모리 상의 연관관계만 갱신)
     */
    public void addOrderItem(OrderItem orderItem) {
        if (orderItem == null) {
            throw new IllegalArgumentException("null 주문 항목을 추가할 수 없습니다");
        }
        this.orderItems.add(orderItem);
    }

    public int getOrderItemCount() {
        return this.orderItems.size();
    }

    @PreUpdate
    void touchUpdatedAt() {
        this.updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
