package com.hhplus.ordergraph.presentation.user.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * 사용자 삭제 입력 (GraphQL DeleteUserInput)
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeleteUserInput {
    private UUID id;
}
