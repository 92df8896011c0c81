package com.guardsql.parser;

import com.guardsql.error.InputException;

import java.util.Optional;

/**
 * Parses a single terminated statement: {@code SQL;} or {@code SQL \g[xjovz][set] [arg]}.
 */
public final class QueryModifierParser {
    static final String MODIFIER_CHARS = "xjovz";
    static final String EXPECTED_FORM = "\\g[x][j][o][v][z][set] [path|prefix]";

    private QueryModifierParser() {
    }

    /**
     * Parsed statement with its modifiers.
     */
    public static final class ParsedQuery {
        private final String sql;
        private final QueryModifiers modifiers;

        public ParsedQuery(String sql, QueryModifiers modifiers) {
            this.sql = sql;
            this.modifiers = modifiers;
        }

        public String getSql() {
            return sql;
        }

        public QueryModifiers getModifiers() {
            return modifiers;
        }
    }

    /**
     * Parse one statement.
     *
     * @param input statement text, including its terminator
     * @return parsed query, empty if the input carries no valid terminator
     * @throws InputException if the {@code o} modifier is given without a path
     */
    public static Optional<ParsedQuery> parse(String input) {
        String text = input.trim();
        if (text.endsWith(";")) {
            String sql = text;
            while (sql.endsWith(";")) {
                sql = sql.substring(0, sql.length() - 1);
            }
            return Optional.of(new ParsedQuery(sql.trim(), QueryModifiers.none()));
        }

        int bs = InputParser.findStatementEnd(text);
        if (bs <= 0 || text.charAt(bs) != '\\') {
            return Optional.empty();
        }
        String sql = text.substring(0, bs).trim();
        String mod = text.substring(bs);
        if (mod.length() < 2 || (mod.charAt(1) != 'g' && mod.charAt(1) != 'G')) {
            return Optional.empty();
        }

        QueryModifiers modifiers = new QueryModifiers();
        int pos = 2;
        while (pos < mod.length() && MODIFIER_CHARS.indexOf(mod.charAt(pos)) >= 0) {
            switch (mod.charAt(pos)) {
                case 'x':
                    modifiers.setExpanded(true);
                    break;
                case 'j':
                    modifiers.setJson(true);
                    break;
                case 'v':
                    modifiers.setVerbatim(true);
                    break;
                case 'z':
                    modifiers.setZero(true);
                    break;
                default:
                    // 'o': path is bound below
                    modifiers.setOutputFile("");
                    break;
            }
            pos++;
        }
        boolean hasOutput = modifiers.getOutputFile() != null;
        boolean hasSet = mod.startsWith("set", pos);
        if (hasSet) {
            pos += 3;
        }

        String rest = mod.substring(pos);
        String arg = null;
        if (!rest.isEmpty()) {
            if (!(hasSet || hasOutput) || !Character.isWhitespace(rest.charAt(0))) {
                return Optional.empty();
            }
            arg = rest.trim();
            if (arg.isEmpty()) {
                arg = null;
            }
        }

        if (hasOutput) {
            if (arg == null) {
                throw InputException.badArgument(mod.trim(), "\\go <path>");
            }
            modifiers.setOutputFile(arg);
        } else if (hasSet) {
            modifiers.setVarSet(true);
            modifiers.setVarPrefix(arg);
        }
        return Optional.of(new ParsedQuery(sql, modifiers));
    }
}
