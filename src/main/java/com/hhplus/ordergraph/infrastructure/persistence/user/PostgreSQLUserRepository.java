package com.hhplus.ordergraph.infrastructure.persistence.user;

import com.hhplus.ordergraph.domain.user.User;
import com.hhplus.ordergraph.domain.user.UserRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL 기반 User Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 *
 * Port(UserRepository) 인터페이스를 구현하면서 JpaRepository 기능 제공
 */
@Repository
public class PostgreSQLUserRepository implements UserRepository {

    private final UserJpaRepository userJpaRepository;

    public PostgreSQLUserRepository(UserJpaRepository userJpaRepository) {
        this.userJpaRepository = userJpaRepository;
    }

    @Override
    public User save(User user) {
        // ✅ saveAndFlush: UNIQUE(email) 위반을 커밋 시점이 아닌 호출 시점에 감지
        return userJpaRepository.saveAndFlush(user);
    }

    @Override
    public Optional<User> findById(UUID userId) {
        return userJpaRepository.findById(userId);
    }

    @Override
    public List<User> findAll() {
        return userJpaRepository.findAll();
    }

    @Override
    public List<User> findAllByIdIn(Collection<UUID> userIds) {
        if (userIds.isEmpty()) {
            return List.of();
        }
        return userJpaRepository.findAllByIdIn(userIds);
    }

    @Override
    public boolean existsById(UUID userId) {
        return userJpaRepository.existsById(userId);
    }

    @Override
    public boolean existsByEmail(String email) {
        return userJpaRepository.existsByEmail(email);
    }

    @Override
    public boolean deleteById(UUID userId) {
        return userJpaRepository.deleteByIdInBulk(userId) > 0;
    }

    @Override
    public long count() {
        return userJpaRepository.count();
    }
}
