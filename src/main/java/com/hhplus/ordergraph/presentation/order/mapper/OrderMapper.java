package com.hhplus.ordergraph.presentation.order.mapper;

import com.hhplus.ordergraph.application.order.dto.CreateOrderCommand;
import com.hhplus.ordergraph.application.order.dto.CreateOrderItemCommand;
import com.hhplus.ordergraph.application.order.dto.OrderItemCommand;
import com.hhplus.ordergraph.presentation.order.request.CreateOrderInput;
import com.hhplus.ordergraph.presentation.order.request.CreateOrderItemInput;
import com.hhplus.ordergraph.presentation.order.request.OrderItemInput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - GraphQL Input DTO → Application Command 변환
 *
 * 아키텍처 원칙:
 * - Application layer는 GraphQL 입력 타입에 독립적 (자체 Command 사용)
 * - 값 검증은 Application layer의 CommandValidator가 담당하므로 여기서는 구조만 옮긴다
 */
@Component
public class OrderMapper {

    /**
     * CreateOrderInput → CreateOrderCommand
     */
    public CreateOrderCommand toCreateOrderCommand(CreateOrderInput input) {
        return CreateOrderCommand.builder()
                .userId(input.getUserId())
                .status(input.getStatus())
                .totalCost(input.getTotalCost())
                .orderItems(toOrderItemCommands(input.getOrderItems()))
                .build();
    }

    /**
     * CreateOrderItemInput → CreateOrderItemCommand
     */
    public CreateOrderItemCommand toCreateOrderItemCommand(CreateOrderItemInput input) {
        return CreateOrderItemCommand.builder()
                .orderId(input.getOrderId())
                .quantity(input.getQuantity())
                .unitPrice(input.getUnitPrice())
                .build();
    }

    private List<OrderItemCommand> toOrderItemCommands(List<OrderItemInput> inputs) {
        // 누락은 검증 단계에서 INVALID_INPUT으로 보고
        if (inputs == null) {
            return null;
        }
        return inputs.stream()
                .map(this::toOrderItemCommand)
                .collect(Collectors.toList());
    }

    private OrderItemCommand toOrderItemCommand(OrderItemInput input) {
        if (input == null) {
            return null;
        }
        return OrderItemCommand.builder()
                .quantity(input.getQuantity())
                .unitPrice(input.getUnitPrice())
                .build();
    }
}
