package com.hhplus.ordergraph.infrastructure.persistence.user;

import com.hhplus.ordergraph.domain.user.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * User JPA Repository
 * Spring Data JPA를 통한 User 엔티티 영구 저장소
 */
public interface UserJpaRepository extends JpaRepository<User, UUID> {

    boolean existsByEmail(String email);

    List<User> findAllByIdIn(Collection<UUID> ids);

    /**
     * 사용자 단건 삭제 (JPQL bulk delete)
     *
     * SQL 생성:
     * DELETE FROM users WHERE id = ?
     *
     * - orders.user_id, order_items.order_id FK의 ON DELETE CASCADE로 하위 행도 삭제
     * - 영속성 컨텍스트를 거치지 않으므로 실행 후 clear
     *
     * @param userId 사용자 ID
     * @return 삭제된 행 수 (0이면 이미 없는 사용자)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM User u WHERE u.id = :userId")
    int deleteByIdInBulk(@Param("userId") UUID userId);
}
