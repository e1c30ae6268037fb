package com.hhplus.ordergraph.presentation.user.mapper;

import com.hhplus.ordergraph.application.user.dto.CreateUserCommand;
import com.hhplus.ordergraph.presentation.user.request.CreateUserInput;
import org.springframework.stereotype.Component;

/**
 * UserMapper - GraphQL Input DTO → Application Command 변환
 */
@Component
public class UserMapper {

    public CreateUserCommand toCreateUserCommand(CreateUserInput input) {
        return CreateUserCommand.builder()
                .name(input.getName())
                .email(input.getEmail())
                .build();
    }
}
