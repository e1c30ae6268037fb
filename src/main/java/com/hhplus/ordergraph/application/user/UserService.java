package com.hhplus.ordergraph.application.user;

import com.hhplus.ordergraph.application.common.CommandValidator;
import com.hhplus.ordergraph.application.order.dto.OrderResponse;
import com.hhplus.ordergraph.application.user.dto.CreateUserCommand;
import com.hhplus.ordergraph.application.user.dto.UserResponse;
import com.hhplus.ordergraph.domain.order.OrderRepository;
import com.hhplus.ordergraph.domain.user.DuplicateEmailException;
import com.hhplus.ordergraph.domain.user.User;
import com.hhplus.ordergraph.domain.user.UserNotFoundException;
import com.hhplus.ordergraph.domain.user.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * UserService - 사용자 관리 서비스 (Application 계층)
 *
 * 역할:
 * - 사용자 생성 (입력 검증 + 이메일 중복 검사)
 * - 사용자 조회 (단건은 주문/주문 항목까지 함께 로드)
 * - 사용자 삭제 (삭제 전 스냅샷 반환, 주문과 주문 항목은 DB CASCADE)
 *
 * 이메일 중복:
 * - existsByEmail()로 먼저 검사하고
 * - 동시 요청으로 검사를 통과한 경우 UNIQUE 제약 위반을 DuplicateEmailException으로 변환
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final CommandValidator commandValidator;

    public UserService(UserRepository userRepository,
                       OrderRepository orderRepository,
                       CommandValidator commandValidator) {
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
        this.commandValidator = commandValidator;
    }

    /**
     * 사용자 생성
     *
     * @param command 이름, 이메일
     * @return 생성된 사용자 (id, 생성/수정 시각 포함)
     * @throws com.hhplus.ordergraph.common.exception.InvalidInputException 이름 길이 또는 이메일 형식 위반
     * @throws DuplicateEmailException 이미 사용 중인 이메일
     */
    @Transactional
    public UserResponse createUser(CreateUserCommand command) {
        CreateUserCommand trimmed = command == null ? null : command.trimmed();
        commandValidator.validate(trimmed);

        String email = trimmed.getEmail();
        if (userRepository.existsByEmail(email)) {
            throw new DuplicateEmailException(email);
        }

        User saved;
        try {
            saved = userRepository.save(User.createUser(trimmed.getName(), email));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateEmailException(email, e);
        }

        log.info("[UserService] 사용자 생성 완료: userId={}, email={}", saved.getId(), saved.getEmail());
        return UserResponse.fromUser(saved);
    }

    /**
     * 전체 사용자 조회 (주문은 필요할 때 배치 로딩)
     */
    @Transactional(readOnly = true)
    public List<UserResponse> findAll() {
        List<UserResponse> users = userRepository.findAll().stream()
                .map(UserResponse::fromUser)
                .collect(Collectors.toList());
        log.debug("[UserService] 전체 사용자 조회: count={}", users.size());
        return users;
    }

    /**
     * 사용자 단건 조회 (주문, 주문 항목 포함)
     *
     * @return 존재하지 않으면 Optional.empty()
     */
    @Transactional(readOnly = true)
    public Optional<UserResponse> findOne(UUID userId) {
        return userRepository.findById(userId)
                .map(user -> UserResponse.fromUser(user, loadOrderSnapshots(userId)));
    }

    /**
     * 여러 사용자 일괄 조회 (GraphQL 배치 로딩용)
     *
     * @return 사용자 ID → 사용자, 존재하지 않는 ID는 포함되지 않음
     */
    @Transactional(readOnly = true)
    public Map<UUID, UserResponse> findByIds(Collection<UUID> userIds) {
        return userRepository.findAllByIdIn(userIds).stream()
                .map(UserResponse::fromUser)
                .collect(Collectors.toMap(UserResponse::getId, Function.identity()));
    }

    /**
     * 사용자 삭제
     *
     * 삭제 전 사용자, 주문, 주문 항목 스냅샷을 만든 뒤 단일 DELETE 문을 실행한다.
     * 주문과 주문 항목은 FK의 ON DELETE CASCADE로 함께 삭제된다.
     * 조회 이후 다른 요청이 먼저 삭제해 0건이 삭제되면 UserNotFoundException.
     *
     * @return 삭제 직전 스냅샷
     */
    @Transactional
    public UserResponse deleteUser(UUID userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        UserResponse snapshot = UserResponse.fromUser(user, loadOrderSnapshots(userId));

        if (!userRepository.deleteById(userId)) {
            throw new UserNotFoundException(userId);
        }

        log.info("[UserService] 사용자 삭제 완료: userId={}, orders={}", userId, snapshot.getOrders().size());
        return snapshot;
    }

    private List<OrderResponse> loadOrderSnapshots(UUID userId) {
        return orderRepository.findAllWithItemsByUserId(userId).stream()
                .map(OrderResponse::fromOrderWithItems)
                .collect(Collectors.toList());
    }
}
