package com.hhplus.ordergraph.domain.user;

import com.hhplus.ordergraph.domain.order.Order;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * User 도메인 엔티티
 *
 * 책임:
 * - 사용자 계정 정보(이름, 이메일) 관리
 * - 생성/수정 시각은 서버에서만 부여
 *
 * 핵심 비즈니스 규칙:
 * - 이메일은 저장소 수준에서 유일 (users.email UNIQUE)
 * - 사용자 삭제 시 주문과 주문 항목은 DB의 ON DELETE CASCADE로 함께 삭제
 */
@Entity
@Table(name = "users")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id")
    private UUID id;

    @Column(name = "name", nullable = false, length = UserConstants.NAME_MAX_LENGTH)
    private String name;

    @Column(name = "email", nullable = false, unique = true, length = UserConstants.EMAIL_MAX_LENGTH)
    private String email;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 사용자의 주문 목록 (읽기 전용 연관관계)
     * 저장/삭제 전파는 JPA cascade가 아니라 DB 외래 키가 담당한다.
     */
    @OneToMany(mappedBy = "user", fetch = FetchType.LAZY)
    @Builder.Default
    private List<Order> orders = new ArrayList<>();

    /**
     * 사용자 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - createdAt, updatedAt은 같은 시각으로 초기화 (createdAt <= updatedAt 보장)
     * - 이메일은 앞뒤 공백 제거 후 저장
     */
    public static User createUser(String name, String email) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("이름은 필수입니다");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("이메일은 필수입니다");
        }

        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        return User.builder()
                .name(name.trim())
                .email(email.trim())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    @PreUpdate
    void touchUpdatedAt() {
        this.updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
