package com.hhplus.ordergraph.infrastructure.seed;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 시드 데이터 규모 설정 (seed.*)
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "seed")
public class SeedProperties {

    @Min(0)
    private int users = 1000;

    @Min(0)
    private int ordersPerUser = 10;

    @Min(0)
    private int itemsPerOrder = 3;

    /**
     * 한 트랜잭션에서 처리할 사용자 수
     */
    @Min(1)
    private int batchSize = 1000;
}
