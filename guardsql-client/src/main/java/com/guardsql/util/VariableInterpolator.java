package com.guardsql.util;

import com.guardsql.error.InputException;
import com.guardsql.model.VariableStore;

/**
 * Replaces {@code ${name}} tokens with bound variable values.
 *
 * <p>Interpolation is textual and runs once: substituted values are never re-scanned.
 * {@code ${{name}}} drops one brace layer and yields the literal {@code ${name}}; longer brace
 * runs behave the same way. Text inside {@code --} comments is copied untouched.
 */
public final class VariableInterpolator {

    private VariableInterpolator() {
    }

    /**
     * Interpolate variables into the given text.
     *
     * @param text query text
     * @param vars variable store
     * @return interpolated text
     * @throws InputException if a referenced variable is not set
     */
    public static String interpolate(String text, VariableStore vars) {
        if (text == null || text.indexOf('$') < 0) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.length());
        boolean inSingle = false;
        boolean inDouble = false;
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);

            if (!inSingle && !inDouble && c == '-' && i + 1 < n && text.charAt(i + 1) == '-') {
                int end = text.indexOf('\n', i);
                end = end < 0 ? n : end;
                out.append(text, i, end);
                i = end;
                continue;
            }
            if (c == '\'' && !inDouble) {
                inSingle = !inSingle;
            } else if (c == '"' && !inSingle) {
                inDouble = !inDouble;
            }

            if (c == '$' && i + 1 < n && text.charAt(i + 1) == '{') {
                int consumed = substitute(text, i, vars, out);
                if (consumed > 0) {
                    i += consumed;
                    continue;
                }
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Handle one {@code $\{...\}} token starting at {@code start}.
     *
     * @return characters consumed, or 0 if the token is not closed
     */
    private static int substitute(String text, int start, VariableStore vars, StringBuilder out) {
        int braces = 0;
        int p = start + 1;
        while (p < text.length() && text.charAt(p) == '{') {
            braces++;
            p++;
        }

        String closing = "}".repeat(braces);
        int close = text.indexOf(closing, p);
        if (close < 0) {
            return 0;
        }
        int newline = text.indexOf('\n', p);
        if (newline >= 0 && newline < close) {
            return 0;
        }

        String inner = text.substring(p, close);
        int consumed = close + braces - start;
        if (braces == 1) {
            String name = inner.trim();
            String value = vars.get(name)
                    .orElseThrow(() -> new InputException("Variable '" + name + "' is not set"));
            out.append(value);
        } else {
            String layer = "{".repeat(braces - 1);
            out.append('$').append(layer).append(inner).append("}".repeat(braces - 1));
        }
        return consumed;
    }
}
