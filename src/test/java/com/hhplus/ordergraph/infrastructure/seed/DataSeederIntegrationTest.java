package com.hhplus.ordergraph.infrastructure.seed;

import com.hhplus.ordergraph.infrastructure.persistence.order.OrderItemJpaRepository;
import com.hhplus.ordergraph.infrastructure.persistence.order.OrderJpaRepository;
import com.hhplus.ordergraph.infrastructure.persistence.user.UserJpaRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DataSeeder 통합 테스트
 *
 * seed 프로필은 애플리케이션 시작 시 한 번 시드를 적재한다.
 * 작은 규모(사용자 5명, 배치 2명)로 배치 경계와 재실행 시 초기화를 확인한다.
 */
@SpringBootTest(properties = {
        "seed.users=5",
        "seed.orders-per-user=2",
        "seed.items-per-order=3",
        "seed.batch-size=2"
})
@ActiveProfiles({"test", "seed"})
@DisplayName("DataSeeder 통합 테스트")
class DataSeederIntegrationTest {

    @Autowired
    private DataSeeder dataSeeder;

    @Autowired
    private UserJpaRepository userJpaRepository;

    @Autowired
    private OrderJpaRepository orderJpaRepository;

    @Autowired
    private OrderItemJpaRepository orderItemJpaRepository;

    @Test
    @DisplayName("시작 시 적재 - 사용자 × 주문 × 항목 수 일치")
    void testSeededCounts() {
        assertThat(userJpaRepository.count()).isEqualTo(5);
        assertThat(orderJpaRepository.count()).isEqualTo(10);
        assertThat(orderItemJpaRepository.count()).isEqualTo(30);
        assertThat(userJpaRepository.existsByEmail("seed-user-00005@example.com")).isTrue();
    }

    @Test
    @DisplayName("재실행 - 기존 데이터를 지우고 같은 규모로 다시 적재")
    void testReseedIsIdempotentInSize() {
        // When
        dataSeeder.seed();

        // Then
        assertThat(userJpaRepository.count()).isEqualTo(5);
        assertThat(orderJpaRepository.count()).isEqualTo(10);
        assertThat(orderItemJpaRepository.count()).isEqualTo(30);
    }
}
