package com.hhplus.ordergraph.application.user.dto;

import com.hhplus.ordergraph.application.order.dto.OrderResponse;
import com.hhplus.ordergraph.domain.user.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

/**
 * 사용자 응답 DTO (Application layer)
 *
 * orders가 null이면 "아직 로드하지 않음"을 의미하며,
 * GraphQL 계층이 필요할 때 배치 로딩으로 채운다.
 * 삭제 응답처럼 스냅샷이 필요한 경우에는 orders를 미리 채워 둔다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserResponse {
    private UUID id;
    private String name;
    private String email;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    private List<OrderResponse> orders;

    /**
     * User → UserResponse 변환 (주문 미포함)
     */
    public static UserResponse fromUser(User user) {
        return fromUser(user, null);
    }

    /**
     * User → UserResponse 변환 (주문 포함 스냅샷)
     */
    public static UserResponse fromUser(User user, List<OrderResponse> orders) {
        return UserResponse.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .createdAt(user.getCreatedAt().atOffset(ZoneOffset.UTC))
                .updatedAt(user.getUpdatedAt().atOffset(ZoneOffset.UTC))
                .orders(orders)
                .build();
    }

    public boolean hasOrdersLoaded() {
        return orders != null;
    }
}
