package com.hhplus.ordergraph.infrastructure.config.graphql;

import graphql.scalars.ExtendedScalars;
import graphql.schema.idl.RuntimeWiring;
import org.springframework.graphql.execution.RuntimeWiringConfigurer;
import org.springframework.stereotype.Component;

/**
 * GraphQL 커스텀 스칼라 등록
 *
 * - DateTime: OffsetDateTime ↔ ISO-8601 문자열 (UTC)
 * - BigDecimal: 금액 (총액, 단가)
 */
@Component
public class GraphQlScalarConfigurer implements RuntimeWiringConfigurer {

    @Override
    public void configure(RuntimeWiring.Builder builder) {
        builder.scalar(ExtendedScalars.DateTime)
                .scalar(ExtendedScalars.GraphQLBigDecimal);
    }
}
