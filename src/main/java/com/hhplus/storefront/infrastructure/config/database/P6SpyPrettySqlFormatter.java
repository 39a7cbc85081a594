package com.hhplus.storefront.infrastructure.config.database;

import com.p6spy.engine.logging.Category;
import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy 로그 포맷
 *
 * 바인딩 값이 채워진 SQL을 Hibernate 포매터로 정리해 출력한다.
 * DDL은 FormatStyle.DDL, 나머지 SQL은 BASIC으로 포매팅하고,
 * commit/rollback처럼 SQL이 없는 이벤트는 한 줄로 남긴다.
 */
public class P6SpyPrettySqlFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(int connectionId,
                                String now,
                                long elapsed,
                                String category,
                                String prepared,
                                String sql,
                                String url) {
        if (sql == null || sql.isBlank()) {
            return String.format("[P6Spy] connection=%d category=%s elapsed=%dms", connectionId, category, elapsed);
        }
        String formatted = Category.STATEMENT.getName().equals(category) ? format(sql) : sql.trim();
        return String.format("[P6Spy] connection=%d category=%s elapsed=%dms%n%s", connectionId, category, elapsed, formatted);
    }

    private String format(String sql) {
        String normalized = sql.trim().replaceAll("\\s+", " ");
        String lower = normalized.toLowerCase(Locale.ROOT);
        if (lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("comment")) {
            return FormatStyle.DDL.getFormatter().format(normalized);
        }
        return FormatStyle.BASIC.getFormatter().format(normalized);
    }
}
