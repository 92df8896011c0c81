package com.guardsql.model;

import com.guardsql.error.InputException;

import java.util.Locale;
import java.util.function.Function;

/**
 * Terminal colour theme selected with {@code --theme}.
 */
public enum Theme {
    LIGHT,
    DARK,
    AUTO;

    public static Theme parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw InputException.badArgument(value, "--theme=light|dark|auto");
        }
    }

    /**
     * Resolve {@link #AUTO} from the {@code COLORFGBG} convention ({@code fg;bg}, background last).
     * Dark is assumed when the variable is missing or unreadable.
     *
     * @param env environment lookup
     * @return LIGHT or DARK
     */
    public Theme resolve(Function<String, String> env) {
        if (this != AUTO) {
            return this;
        }
        String colors = env.apply("COLORFGBG");
        if (colors == null || colors.isBlank()) {
            return DARK;
        }
        String background = colors.substring(colors.lastIndexOf(';') + 1).trim();
        try {
            int bg = Integer.parseInt(background);
            return bg == 7 || bg >= 9 ? LIGHT : DARK;
        } catch (NumberFormatException e) {
            return DARK;
        }
    }
}
