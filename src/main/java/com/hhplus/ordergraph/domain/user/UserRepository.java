package com.hhplus.ordergraph.domain.user;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * User Repository Interface (Domain Layer - Port)
 */
public interface UserRepository {
    /**
     * 사용자 저장
     *
     * 즉시 flush하여 이메일 UNIQUE 제약 위반을 호출 시점에 드러낸다.
     *
     * @param user 저장할 사용자
     * @return 식별자가 부여된 사용자
     */
    User save(User user);

    Optional<User> findById(UUID userId);

    List<User> findAll();

    List<User> findAllByIdIn(Collection<UUID> userIds);

    boolean existsById(UUID userId);

    boolean existsByEmail(String email);

    /**
     * 사용자 삭제 (단일 DELETE 문)
     *
     * 주문과 주문 항목은 DB의 ON DELETE CASCADE로 같은 문장 안에서 삭제된다.
     *
     * @param userId 사용자 ID
     * @return 실제로 삭제된 행이 있으면 true
     */
    boolean deleteById(UUID userId);

    long count();
}
