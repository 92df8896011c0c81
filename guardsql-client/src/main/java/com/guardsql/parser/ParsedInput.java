package com.guardsql.parser;

import java.util.List;

/**
 * Result of parsing an input buffer: complete items in submission order, plus the unterminated
 * remainder that must stay buffered.
 */
public final class ParsedInput {
    private final List<InputItem> items;
    private final String remainder;

    public ParsedInput(List<InputItem> items, String remainder) {
        this.items = List.copyOf(items);
        this.remainder = remainder;
    }

    public List<InputItem> getItems() {
        return items;
    }

    public String getRemainder() {
        return remainder;
    }

    public boolean isIncomplete() {
        return !remainder.isEmpty();
    }
}
