package com.guardsql.service;

import java.util.Locale;

/**
 * Recognizes transaction-boundary statements that the client performs through JDBC.
 */
public final class StatementClassifier {

    public enum Kind {
        COMMIT,
        ROLLBACK,
        OTHER
    }

    private StatementClassifier() {
    }

    /**
     * Classify a statement by its leading words, ignoring leading comments and whitespace.
     * {@code ROLLBACK TO SAVEPOINT}, {@code COMMIT PREPARED} and similar forms are OTHER.
     *
     * @param sql statement text without its terminator
     * @return statement kind
     */
    public static Kind classify(String sql) {
        if (sql == null) {
            return Kind.OTHER;
        }
        String[] words = stripLeadingComments(sql).trim().replaceAll(";+\\s*$", "")
                .toUpperCase(Locale.ROOT).split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) {
            return Kind.OTHER;
        }
        String first = words[0];
        boolean plain = words.length == 1
                || (words.length == 2 && ("WORK".equals(words[1]) || "TRANSACTION".equals(words[1])));
        if (!plain) {
            return Kind.OTHER;
        }
        switch (first) {
            case "COMMIT":
            case "END":
                return Kind.COMMIT;
            case "ROLLBACK":
            case "ABORT":
                return Kind.ROLLBACK;
            default:
                return Kind.OTHER;
        }
    }

    static String stripLeadingComments(String sql) {
        String s = sql;
        while (true) {
            String t = s.stripLeading();
            if (t.startsWith("--")) {
                int nl = t.indexOf('\n');
                s = nl < 0 ? "" : t.substring(nl + 1);
            } else if (t.startsWith("/*")) {
                int end = t.indexOf("*/");
                s = end < 0 ? "" : t.substring(end + 2);
            } else {
                return t;
            }
        }
    }
}
