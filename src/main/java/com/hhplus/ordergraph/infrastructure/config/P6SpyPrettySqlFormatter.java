package com.hhplus.ordergraph.infrastructure.config;

import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy 로그 포맷 커스터마이징 클래스
 *
 * 바인딩 값이 채워진 SQL을 여러 줄로 포매팅하여 로깅한다.
 * DDL은 FormatStyle.DDL, 그 밖의 문장은 FormatStyle.BASIC으로 포매팅한다.
 * commit/rollback처럼 SQL이 없는 이벤트는 카테고리만 한 줄로 남긴다.
 */
public class P6SpyPrettySqlFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(
        int connectionId,
        String now,
        long elapsed,
        String category,
        String prepared,
        String sql,
        String url
    ) {
        if (sql == null || sql.isBlank()) {
            return String.format("[P6Spy] connection=%d category=%s elapsed=%dms", connectionId, category, elapsed);
        }
        return buildLogMessage(connectionId, formatSql(sql), elapsed, category);
    }

    /**
     * @param sql 바인딩 값이 채워진 SQL
     * @return 포매팅된 SQL, 포매팅에 실패하면 원본
     */
    String formatSql(String sql) {
        String trimmed = sql.trim();
        try {
            if (isDdl(trimmed)) {
                return FormatStyle.DDL.getFormatter().format(trimmed);
            }
            return FormatStyle.BASIC.getFormatter().format(trimmed);
        } catch (RuntimeException e) {
            return trimmed;
        }
    }

    private boolean isDdl(String sql) {
        String lower = sql.toLowerCase(Locale.ROOT);
        return lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("comment");
    }

    private String buildLogMessage(int connectionId, String sql, long elapsed, String category) {
        StringBuilder sb = new StringBuilder();

        sb.append("\n");
        sb.append("==================== order-graph SQL ====================\n");
        sb.append("Connection : ").append(connectionId).append("\n");
        sb.append("Category   : ").append(category).append("\n");
        sb.append("Elapsed    : ").append(elapsed).append("ms\n");
        sb.append("SQL        :").append(sql).append("\n");
        sb.append("=========================================================\n");

        return sb.toString();
    }
}
