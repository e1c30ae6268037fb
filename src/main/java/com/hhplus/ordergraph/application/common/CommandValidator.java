package com.hhplus.ordergraph.application.common;

import com.hhplus.ordergraph.common.exception.InvalidInputException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * CommandValidator - Application Command 검증 전담
 *
 * 책임:
 * - Command 객체의 Jakarta Bean Validation 제약 검사
 * - 위반 사항을 InvalidInputException 하나로 변환 (필드 경로 순으로 정렬된 메시지)
 *
 * 설계 원칙:
 * - 부수 효과 없음, 예외 발생으로 검증 실패 표현
 * - 저장소 조회가 필요한 검증(이메일 중복, 부모 존재)은 각 서비스가 담당
 */
@Component
public class CommandValidator {

    private final Validator validator;

    public CommandValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * @param command 검증할 Command
     * @throws InvalidInputException 제약 위반이 하나라도 있는 경우
     */
    public <T> void validate(T command) {
        if (command == null) {
            throw new InvalidInputException("요청 본문이 비어 있습니다");
        }

        Set<ConstraintViolation<T>> violations = validator.validate(command);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(violation -> violation.getPropertyPath() + ": " + violation.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new InvalidInputException(detail);
        }
    }
}
