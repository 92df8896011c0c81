package com.guardsql.repl;

import com.guardsql.model.Theme;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

class PromptStyleTest {

    @Test
    void promptTextFollowsContinuation() {
        PromptStyle style = new PromptStyle(Theme.DARK);

        assertEquals("guardsql(ro)=> ", style.prompt("ro", true).toString());
        assertEquals("guardsql(write*)-> ", style.prompt("write*", false).toString());
    }

    @Test
    void writeStatesAreColouredReadOnlyIsNot() {
        PromptStyle style = new PromptStyle(Theme.DARK);
        AttributedString prompt = style.prompt("write!", true);

        assertEquals(style.styleFor("write!"), prompt.styleAt("guardsql(".length()));
        assertEquals(AttributedStyle.DEFAULT, style.styleFor("ro"));
        assertNotEquals(AttributedStyle.DEFAULT, style.styleFor("write"));
        assertNotEquals(style.styleFor("write"), style.styleFor("write*"));
    }

    @Test
    void lightThemeAvoidsBrightColours() {
        assertEquals(AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN),
                new PromptStyle(Theme.LIGHT).styleFor("write"));
        assertEquals(AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN + AttributedStyle.BRIGHT),
                new PromptStyle(Theme.DARK).styleFor("write"));
    }
}
