package com.guardsql.parser;

import com.guardsql.error.InputException;

/**
 * One complete unit of input: a metacommand, a query, or an input error.
 */
public final class InputItem {

    public enum Type {
        METACOMMAND, QUERY, INVALID
    }

    private final Type type;
    private final String text;
    private final Metacommand metacommand;
    private final String sql;
    private final QueryModifiers modifiers;
    private final InputException error;

    private InputItem(Type type, String text, Metacommand metacommand, String sql, QueryModifiers modifiers,
                      InputException error) {
        this.type = type;
        this.text = text;
        this.metacommand = metacommand;
        this.sql = sql;
        this.modifiers = modifiers;
        this.error = error;
    }

    public static InputItem metacommand(Metacommand metacommand) {
        return new InputItem(Type.METACOMMAND, metacommand.getText(), metacommand, null, null, null);
    }

    public static InputItem query(String text, String sql, QueryModifiers modifiers) {
        return new InputItem(Type.QUERY, text, null, sql, modifiers, null);
    }

    public static InputItem invalid(String text, InputException error) {
        return new InputItem(Type.INVALID, text, null, null, null, error);
    }

    public Type getType() {
        return type;
    }

    /**
     * Exact source text of this item, terminator and modifiers included.
     *
     * @return source text
     */
    public String getText() {
        return text;
    }

    public Metacommand getMetacommand() {
        return metacommand;
    }

    public String getSql() {
        return sql;
    }

    public QueryModifiers getModifiers() {
        return modifiers;
    }

    public InputException getError() {
        return error;
    }
}
