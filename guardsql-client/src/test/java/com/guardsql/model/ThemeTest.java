package com.guardsql.model;

import com.guardsql.error.InputException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ThemeTest {

    @Test
    void parsesCaseInsensitively() {
        assertEquals(Theme.LIGHT, Theme.parse("Light"));
        assertEquals(Theme.DARK, Theme.parse("DARK"));
        assertEquals(Theme.AUTO, Theme.parse(null));
        assertThrows(InputException.class, () -> Theme.parse("neon"));
    }

    @Test
    void explicitThemesResolveToThemselves() {
        assertEquals(Theme.LIGHT, Theme.LIGHT.resolve(Map.of("COLORFGBG", "15;0")::get));
        assertEquals(Theme.DARK, Theme.DARK.resolve(Map.of("COLORFGBG", "0;15")::get));
    }

    @Test
    void autoReadsTerminalBackground() {
        assertEquals(Theme.LIGHT, Theme.AUTO.resolve(Map.of("COLORFGBG", "0;15")::get));
        assertEquals(Theme.LIGHT, Theme.AUTO.resolve(Map.of("COLORFGBG", "0;default;7")::get));
        assertEquals(Theme.DARK, Theme.AUTO.resolve(Map.of("COLORFGBG", "15;0")::get));
        assertEquals(Theme.DARK, Theme.AUTO.resolve(Map.of("COLORFGBG", "15;default")::get));
        assertEquals(Theme.DARK, Theme.AUTO.resolve(name -> null));
    }
}
