package com.guardsql.dialect;

import com.guardsql.util.DbTypeNormalizer;

/**
 * Maps a normalized dbType to its {@link Dialect}.
 */
public final class Dialects {

    private Dialects() {
    }

    public static Dialect forType(String dbType) {
        String normalized = DbTypeNormalizer.normalize(dbType);
        if ("postgres".equals(normalized)) {
            return new PostgresDialect();
        }
        if ("sqlite".equals(normalized)) {
            return new SqliteDialect();
        }
        throw new IllegalArgumentException("Unsupported database type: " + dbType);
    }
}
