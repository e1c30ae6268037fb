package com.hhplus.ordergraph.application.user.dto;

import com.hhplus.ordergraph.domain.user.UserConstants;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 사용자 생성 커맨드 (Application layer)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateUserCommand {

    @NotBlank
    @Size(min = UserConstants.NAME_MIN_LENGTH, max = UserConstants.NAME_MAX_LENGTH)
    private String name;

    @NotBlank
    @Email
    @Size(max = UserConstants.EMAIL_MAX_LENGTH)
    private String email;

    /**
     * 앞뒤 공백을 제거한 커맨드. 길이 검증은 저장될 값 기준으로 한다.
     */
    public CreateUserCommand trimmed() {
        return new CreateUserCommand(
                name == null ? null : name.trim(),
                email == null ? null : email.trim());
    }
}
