package com.hhplus.ordergraph.domain.order;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * OrderStatus ↔ 소문자 문자열 변환기
 *
 * PostgreSQL에서는 orders_status_enum 타입 컬럼에 바인딩되며
 * (JDBC URL의 stringtype=unspecified 필요), H2에서는 VARCHAR로 저장된다.
 */
@Converter
public class OrderStatusConverter implements AttributeConverter<OrderStatus, String> {

    @Override
    public String convertToDatabaseColumn(OrderStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public OrderStatus convertToEntityAttribute(String value) {
        return value == null ? null : OrderStatus.fromValue(value);
    }
}
