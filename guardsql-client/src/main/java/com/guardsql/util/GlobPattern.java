package com.guardsql.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case-insensitive glob with {@code *} and {@code ?} wildcards.
 */
public final class GlobPattern {
    private final String source;
    private final Pattern regex;

    private GlobPattern(String source, Pattern regex) {
        this.source = source;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        StringBuilder sb = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*') {
                sb.append(".*");
            } else if (c == '?') {
                sb.append('.');
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return new GlobPattern(glob, Pattern.compile(sb.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public boolean matches(String value) {
        return value != null && regex.matcher(value).matches();
    }

    /**
     * Translate to a SQL LIKE pattern (used for catalog queries).
     *
     * @return LIKE pattern, lowercased
     */
    public String toSqlLike() {
        return source.replace("%", "\\%").replace("_", "\\_")
                .replace('*', '%').replace('?', '_')
                .toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return source;
    }
}
