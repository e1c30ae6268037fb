package com.hhplus.ordergraph.infrastructure.config.database;

import com.hhplus.ordergraph.infrastructure.config.P6SpyPrettySqlFormatter;
import com.p6spy.engine.spy.P6SpyOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * P6Spy 설정 클래스
 *
 * local, test 프로필에서 SQL 로그 포맷을 P6SpyPrettySqlFormatter로 교체한다.
 * 그 밖의 프로필에서는 p6spy-spring-boot-starter 기본 한 줄 포맷을 사용한다.
 */
@Configuration
@Profile({"local", "test"})
public class P6SpyConfig {

    @PostConstruct
    public void registerMessageFormat() {
        P6SpyOptions.getActiveInstance().setLogMessageFormat(P6SpyPrettySqlFormatter.class.getName());
    }
}
