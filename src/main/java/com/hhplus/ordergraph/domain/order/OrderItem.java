package com.hhplus.ordergraph.domain.order;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * OrderItem 도메인 엔티티
 *
 * 책임:
 * - 주문 내 각 항목의 수량과 단가 보관
 * - 단가는 주문 시점의 스냅샷 (카탈로그 참조 아님)
 *
 * 핵심 비즈니스 규칙:
 * - 부모 주문 없이 존재할 수 없음 (order_id NOT NULL + ON DELETE CASCADE)
 * - 수량은 1 이상을 기대하지만 강제하지 않음
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private Order order;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false,
            precision = OrderConstants.MONEY_PRECISION, scale = OrderConstants.MONEY_SCALE)
    private BigDecimal unitPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * OrderItem 생성 팩토리 메서드
     *
     * @param order 부모 주문
     * @param quantity 수량
     * @param unitPrice 단가 (소수점 둘째 자리로 정규화)
     * @return OrderItem 인스턴스
     */
    public static OrderItem createOrderItem(Order order, Integer quantity, BigDecimal unitPrice) {
        if (order == null) {
            throw new IllegalArgumentException("부모 주문은 필수입니다");
        }
        if (quantity == null) {
            throw new IllegalArgumentException("수량은 필수입니다");
        }

        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        return OrderItem.builder()
                .order(order)
                .quantity(quantity)
                .unitPrice(OrderConstants.normalizeMoney(unitPrice))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @PreUpdate
    void touchUpdatedAt() {
        this.updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
