package com.hhplus.ordergraph.presentation.user;

import com.hhplus.ordergraph.application.order.OrderService;
import com.hhplus.ordergraph.application.order.dto.OrderResponse;
import com.hhplus.ordergraph.application.user.UserService;
import com.hhplus.ordergraph.application.user.dto.UserResponse;
import com.hhplus.ordergraph.presentation.user.mapper.UserMapper;
import com.hhplus.ordergraph.presentation.user.request.CreateUserInput;
import com.hhplus.ordergraph.presentation.user.request.DeleteUserInput;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.BatchMapping;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * UserController - 사용자 GraphQL 엔드포인트
 */
@Controller
public class UserController {

    private final UserService userService;
    private final OrderService orderService;
    private final UserMapper userMapper;

    public UserController(UserService userService, OrderService orderService, UserMapper userMapper) {
        this.userService = userService;
        this.orderService = orderService;
        this.userMapper = userMapper;
    }

    /**
     * query users
     */
    @QueryMapping
    public List<UserResponse> users() {
        return userService.findAll();
    }

    /**
     * query user(id) - 존재하지 않으면 null
     */
    @QueryMapping
    public UserResponse user(@Argument UUID id) {
        return userService.findOne(id).orElse(null);
    }

    /**
     * mutation createUser
     */
    @MutationMapping
    public UserResponse createUser(@Argument CreateUserInput input) {
        return userService.createUser(userMapper.toCreateUserCommand(input));
    }

    /**
     * mutation deleteUser - 삭제 직전 스냅샷 반환
     */
    @MutationMapping
    public UserResponse deleteUser(@Argument DeleteUserInput input) {
        return userService.deleteUser(input.getId());
    }

    /**
     * User.orders 배치 로딩
     *
     * 이미 주문을 담고 있는 사용자(단건 조회, 삭제 스냅샷)는 그대로 사용하고,
     * 나머지 사용자만 한 번의 쿼리로 조회한다.
     */
    @BatchMapping(typeName = "User", field = "orders")
    public Map<UserResponse, List<OrderResponse>> orders(List<UserResponse> users) {
        Set<UUID> userIdsToLoad = users.stream()
                .filter(user -> !user.hasOrdersLoaded())
                .map(UserResponse::getId)
                .collect(Collectors.toSet());

        Map<UUID, List<OrderResponse>> loaded = userIdsToLoad.isEmpty()
                ? Map.of()
                : orderService.findByUserIds(userIdsToLoad);

        Map<UserResponse, List<OrderResponse>> result = new LinkedHashMap<>();
        for (UserResponse user : users) {
            result.put(user, user.hasOrdersLoaded()
                    ? user.getOrders()
                    : loaded.getOrDefault(user.getId(), List.of()));
        }
        return result;
    }
}
