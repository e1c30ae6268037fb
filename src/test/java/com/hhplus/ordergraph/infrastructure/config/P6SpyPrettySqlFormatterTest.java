package com.hhplus.ordergraph.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("P6SpyPrettySqlFormatter 테스트")
class P6SpyPrettySqlFormatterTest {

    private final P6SpyPrettySqlFormatter formatter = new P6SpyPrettySqlFormatter();

    @Test
    @DisplayName("SQL 문장 - 여러 줄로 포매팅하고 카테고리/실행 시간 포함")
    void testFormatStatement() {
        String message = formatter.formatMessage(1, "now", 3, "statement",
                "select * from users where id=?", "select * from users where id='a'", "jdbc:h2:mem:test");

        assertThat(message)
                .contains("Category   : statement")
                .contains("Elapsed    : 3ms")
                .contains("users")
                .contains("'a'");
    }

    @Test
    @DisplayName("SQL 없는 이벤트 (commit) - 한 줄 요약")
    void testFormatCommit() {
        String message = formatter.formatMessage(7, "now", 0, "commit", "", "", "jdbc:h2:mem:test");

        assertThat(message).isEqualTo("[P6Spy] connection=7 category=commit elapsed=0ms");
    }

    @Test
    @DisplayName("DDL - DDL 포매터 사용")
    void testFormatDdl() {
        String formatted = formatter.formatSql("create table users (id uuid not null, primary key (id))");

        assertThat(formatted).contains("create table users");
    }
}
