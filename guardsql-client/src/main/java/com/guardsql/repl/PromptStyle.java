package com.guardsql.repl;

import com.guardsql.model.Theme;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/**
 * Colours the write-state label of the prompt for a resolved theme.
 */
class PromptStyle {
    private final AttributedStyle write;
    private final AttributedStyle active;
    private final AttributedStyle failed;

    PromptStyle(Theme theme) {
        // Bright colours vanish on light backgrounds.
        int bright = theme == Theme.LIGHT ? 0 : AttributedStyle.BRIGHT;
        this.write = AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN + bright);
        this.active = AttributedStyle.BOLD.foreground(
                (theme == Theme.LIGHT ? AttributedStyle.BLUE : AttributedStyle.CYAN) + bright);
        this.failed = AttributedStyle.BOLD.foreground(AttributedStyle.RED + bright);
    }

    AttributedStyle styleFor(String label) {
        switch (label) {
            case "write":
                return write;
            case "write*":
                return active;
            case "write!":
                return failed;
            default:
                return AttributedStyle.DEFAULT;
        }
    }

    /**
     * Build the prompt text.
     *
     * @param label state label
     * @param fresh true when no statement is being continued
     * @return styled prompt
     */
    AttributedString prompt(String label, boolean fresh) {
        return new AttributedStringBuilder()
                .append("guardsql(")
                .styled(styleFor(label), label)
                .append(fresh ? ")=> " : ")-> ")
                .toAttributedString();
    }
}
