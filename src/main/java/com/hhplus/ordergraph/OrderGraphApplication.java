package com.hhplus.ordergraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Order Graph 애플리케이션 메인 클래스
 *
 * 사용자, 주문, 주문 항목을 GraphQL(/graphql)로 제공한다.
 */
@SpringBootApplication
public class OrderGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderGraphApplication.class, args);
    }

}
