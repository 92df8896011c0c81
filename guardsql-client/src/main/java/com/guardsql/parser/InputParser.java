package com.guardsql.parser;

import com.guardsql.error.InputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Splits an input buffer into metacommands and terminated statements.
 *
 * <p>A statement ends at a {@code ;} or a {@code \g} modifier sequence found outside quotes and
 * {@code --} comments. A line starting with a backslash is a metacommand running to end of line.
 * Text without a terminator is returned as the remainder so the caller keeps buffering.
 */
public final class InputParser {

    private InputParser() {
    }

    /**
     * Parse an input buffer.
     *
     * @param input accumulated input
     * @param expandedDefault whether the session displays results expanded by default
     * @return parsed items and remainder
     */
    public static ParsedInput parse(String input, boolean expandedDefault) {
        List<InputItem> items = new ArrayList<>();
        String remaining = input == null ? "" : input.trim();
        List<String> pending = new ArrayList<>();

        while (!remaining.isEmpty()) {
            remaining = remaining.trim();
            if (remaining.isEmpty()) {
                break;
            }

            String firstLine = firstLine(remaining);
            if (stripComment(firstLine) == null) {
                remaining = afterFirstLine(remaining);
                continue;
            }

            if (remaining.startsWith("\\") && !isModifierStart(remaining, 0)) {
                String line = stripComment(firstLine);
                items.add(parseMetacommandLine(line));
                remaining = afterFirstLine(remaining);
                continue;
            }

            int end = findStatementEnd(remaining);
            if (end < 0) {
                // Metacommand lines inside an unterminated statement run now; the SQL stays buffered.
                remaining = extractTrailingMetacommands(remaining, items, pending);
                break;
            }

            if (remaining.charAt(end) == ';') {
                String text = remaining.substring(0, end + 1);
                String sql = remaining.substring(0, end).trim();
                if (!sql.isEmpty()) {
                    QueryModifiers modifiers = QueryModifiers.none();
                    modifiers.setExpanded(expandedDefault);
                    items.add(InputItem.query(text, sql, modifiers));
                }
                remaining = skipTrailingComment(remaining.substring(end + 1));
                continue;
            }

            int lineEnd = remaining.indexOf('\n', end);
            String text = lineEnd < 0 ? remaining : remaining.substring(0, lineEnd);
            remaining = lineEnd < 0 ? "" : remaining.substring(lineEnd + 1);
            items.add(parseTerminatedQuery(text.trim(), expandedDefault));
        }

        StringBuilder remainder = new StringBuilder();
        for (String p : pending) {
            remainder.append(p);
        }
        return new ParsedInput(items, remainder.toString().trim());
    }

    /**
     * Remove a trailing {@code --} comment from a line.
     *
     * @param line input line
     * @return stripped line, or null if nothing but whitespace and comment remains
     */
    public static String stripComment(String line) {
        boolean inSingle = false;
        boolean inDouble = false;
        int cut = line.length();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (c == '-' && !inSingle && !inDouble && i + 1 < line.length() && line.charAt(i + 1) == '-') {
                cut = i;
                break;
            }
        }
        String stripped = line.substring(0, cut).trim();
        return stripped.isEmpty() ? null : stripped;
    }

    private static InputItem parseMetacommandLine(String line) {
        try {
            return InputItem.metacommand(MetacommandParser.parse(line));
        } catch (InputException e) {
            return InputItem.invalid(line, e);
        }
    }

    private static InputItem parseTerminatedQuery(String text, boolean expandedDefault) {
        try {
            Optional<QueryModifierParser.ParsedQuery> parsed = QueryModifierParser.parse(text);
            if (parsed.isEmpty()) {
                int bs = text.lastIndexOf("\\");
                String token = bs < 0 ? text : text.substring(bs);
                return InputItem.invalid(text,
                        InputException.badArgument(token, QueryModifierParser.EXPECTED_FORM));
            }
            QueryModifiers modifiers = parsed.get().getModifiers();
            if (expandedDefault) {
                modifiers.setExpanded(true);
            }
            return InputItem.query(text, parsed.get().getSql(), modifiers);
        } catch (InputException e) {
            return InputItem.invalid(text, e);
        }
    }

    /**
     * Find the index of the first {@code ;} or {@code \g} outside quotes and comments.
     *
     * @param text statement text
     * @return index, or -1 if unterminated
     */
    static int findStatementEnd(String text) {
        boolean inSingle = false;
        boolean inDouble = false;
        boolean inComment = false;
        char prev = '\0';
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inComment) {
                if (c == '\n') {
                    inComment = false;
                }
            } else if (c == '-' && prev == '-' && !inSingle && !inDouble) {
                inComment = true;
            } else if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            } else if (!inSingle && !inDouble) {
                if (c == ';') {
                    return i;
                }
                if (c == '\\' && isModifierStart(text, i)) {
                    return i;
                }
            }
            prev = inComment ? '\0' : c;
        }
        return -1;
    }

    private static boolean isModifierStart(String text, int i) {
        return i + 1 < text.length() && (text.charAt(i + 1) == 'g' || text.charAt(i + 1) == 'G')
                && text.startsWith("\\", i);
    }

    private static String extractTrailingMetacommands(String remaining, List<InputItem> items, List<String> pending) {
        String[] lines = remaining.split("\n", -1);
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.startsWith("\\") && !isModifierStart(trimmed, 0)) {
                String stripped = stripComment(trimmed);
                if (stripped != null) {
                    items.add(parseMetacommandLine(stripped));
                }
            } else {
                pending.add(line + "\n");
            }
        }
        return "";
    }

    private static String skipTrailingComment(String rest) {
        int nl = rest.indexOf('\n');
        String line = nl < 0 ? rest : rest.substring(0, nl);
        if (stripComment(line) == null) {
            return nl < 0 ? "" : rest.substring(nl + 1);
        }
        return rest;
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl);
    }

    private static String afterFirstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? "" : text.substring(nl + 1);
    }
}
