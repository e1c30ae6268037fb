package com.hhplus.ordergraph.unit.application.common;

import com.hhplus.ordergraph.application.common.CommandValidator;
import com.hhplus.ordergraph.application.order.dto.CreateOrderCommand;
import com.hhplus.ordergraph.application.order.dto.OrderItemCommand;
import com.hhplus.ordergraph.application.user.dto.CreateUserCommand;
import com.hhplus.ordergraph.common.exception.InvalidInputException;
import jakarta.validation.Validation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CommandValidator 단위 테스트")
class CommandValidatorTest {

    private final CommandValidator commandValidator =
            new CommandValidator(Validation.buildDefaultValidatorFactory().getValidator());

    @Test
    @DisplayName("유효한 사용자 생성 커맨드 - 통과")
    void testValidUserCommand() {
        CreateUserCommand command = new CreateUserCommand("김철수", "kim@example.com");

        assertThatCode(() -> commandValidator.validate(command)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("이름 1자 - 101자 경계")
    void testNameLengthBoundary() {
        assertThatThrownBy(() -> commandValidator.validate(new CreateUserCommand("김", "kim@example.com")))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("name");
        assertThatThrownBy(() -> commandValidator.validate(new CreateUserCommand("a".repeat(101), "kim@example.com")))
                .isInstanceOf(InvalidInputException.class);
        assertThatCode(() -> commandValidator.validate(new CreateUserCommand("a".repeat(100), "kim@example.com")))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("이메일 형식 오류")
    void testInvalidEmail() {
        assertThatThrownBy(() -> commandValidator.validate(new CreateUserCommand("김철수", "not-an-email")))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("email");
    }

    @Test
    @DisplayName("주문 항목 없음 - 거부")
    void testEmptyOrderItems() {
        CreateOrderCommand command = CreateOrderCommand.builder()
                .userId(UUID.randomUUID())
                .status("pending")
                .totalCost(new BigDecimal("100.00"))
                .orderItems(List.of())
                .build();

        assertThatThrownBy(() -> commandValidator.validate(command))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("orderItems");
    }

    @Test
    @DisplayName("중첩 주문 항목의 필수 값 누락 - 경로 포함 메시지")
    void testNestedOrderItemViolation() {
        CreateOrderCommand command = CreateOrderCommand.builder()
                .userId(UUID.randomUUID())
                .totalCost(new BigDecimal("100.00"))
                .orderItems(Arrays.asList(new OrderItemCommand(1, BigDecimal.TEN), new OrderItemCommand(null, BigDecimal.TEN)))
                .build();

        assertThatThrownBy(() -> commandValidator.validate(command))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("orderItems[1].quantity");
    }

    @Test
    @DisplayName("null 커맨드 - 거부")
    void testNullCommand() {
        assertThatThrownBy(() -> commandValidator.validate(null))
                .isInstanceOf(InvalidInputException.class);
    }
}
