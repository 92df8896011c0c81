package com.guardsql.parser;

import com.guardsql.error.InputException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses one backslash command line into a {@link Metacommand}.
 *
 * <p>Command names are matched case-insensitively. Unknown names and malformed arguments raise
 * {@link InputException} naming the offending token and the expected form.
 */
public final class MetacommandParser {
    static final String DEFAULT_LIST_PATTERN = "public.*";

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private MetacommandParser() {
    }

    /**
     * Parse a metacommand line.
     *
     * @param line line starting with a backslash
     * @return metacommand
     * @throws InputException on unknown commands or malformed arguments
     */
    public static Metacommand parse(String line) {
        String text = line.trim();
        if (!text.startsWith("\\")) {
            throw new InputException("Not a metacommand: " + text);
        }

        String body = text.substring(1);
        int ws = indexOfWhitespace(body);
        String word = ws < 0 ? body : body.substring(0, ws);
        String rest = ws < 0 ? "" : body.substring(ws).trim();

        String base = word.toLowerCase(Locale.ROOT);
        boolean plus = false;
        boolean bang = false;
        while (base.endsWith("+") || base.endsWith("!")) {
            if (base.endsWith("+")) {
                plus = true;
            } else {
                bang = true;
            }
            base = base.substring(0, base.length() - 1);
        }

        Metacommand.MetacommandBuilder b = Metacommand.builder().text(text);
        switch (base) {
            case "q":
            case "quit":
                noArgs(word, rest);
                return b.kind(Metacommand.Kind.QUIT).build();
            case "?":
            case "help":
                return b.kind(Metacommand.Kind.HELP).build();
            case "x":
                noArgs(word, rest);
                return b.kind(Metacommand.Kind.EXPANDED_TOGGLE).build();
            case "w":
            case "write":
                noArgs(word, rest);
                return b.kind(Metacommand.Kind.WRITE_TOGGLE).build();
            case "r":
            case "redact":
                noArgs(word, rest);
                return b.kind(Metacommand.Kind.REDACT_TOGGLE).build();
            case "e":
            case "edit":
                return b.kind(Metacommand.Kind.EDIT).path(rest.isEmpty() ? null : rest).build();
            case "i":
            case "include":
                return parseInclude(b, rest);
            case "o":
            case "output":
                return b.kind(Metacommand.Kind.OUTPUT).path(rest.isEmpty() ? null : rest).build();
            case "debug":
                if (!rest.isEmpty() && !"state".equalsIgnoreCase(rest)) {
                    throw InputException.badArgument(rest, "\\debug [state]");
                }
                return b.kind(Metacommand.Kind.DEBUG).debugWhat(rest.isEmpty() ? null : "state").build();
            case "set":
                return parseAssignment(b.kind(Metacommand.Kind.SET), rest, "\\set <name> <value>");
            case "default":
                return parseAssignment(b.kind(Metacommand.Kind.DEFAULT), rest, "\\default <name> <value>");
            case "unset":
                return b.kind(Metacommand.Kind.UNSET).name(singleName(rest, "\\unset <name>")).build();
            case "get":
                return b.kind(Metacommand.Kind.GET).name(singleName(rest, "\\get <name>")).build();
            case "vars":
                return b.kind(Metacommand.Kind.VARS).pattern(rest.isEmpty() ? null : rest).build();
            case "snip":
                return parseSnippet(b, rest);
            case "d":
                if (rest.isEmpty()) {
                    throw InputException.badArgument(word, "\\d[+][!] <name>");
                }
                return b.kind(Metacommand.Kind.DESCRIBE).name(rest).detail(plus).sameConnection(bang).build();
            case "list":
                return parseList(b, rest, plus, bang);
            case "dt":
                return listAlias(b, Metacommand.ListKind.TABLE, rest, plus, bang);
            case "di":
                return listAlias(b, Metacommand.ListKind.INDEX, rest, plus, bang);
            case "df":
                return listAlias(b, Metacommand.ListKind.FUNCTION, rest, plus, bang);
            case "dv":
                return listAlias(b, Metacommand.ListKind.VIEW, rest, plus, bang);
            case "dn":
                return listAlias(b, Metacommand.ListKind.SCHEMA, rest, plus, bang);
            case "ds":
                return listAlias(b, Metacommand.ListKind.SEQUENCE, rest, plus, bang);
            case "re":
            case "result":
                return parseResult(b, rest);
            case "copy":
                return b.kind(Metacommand.Kind.COPY).value(rest).build();
            default:
                throw new InputException("Unknown metacommand '\\" + word + "'. Type \\? for help.");
        }
    }

    private static void noArgs(String word, String rest) {
        if (!rest.isEmpty()) {
            throw InputException.badArgument(rest, "\\" + word + " (no arguments)");
        }
    }

    private static Metacommand parseInclude(Metacommand.MetacommandBuilder b, String rest) {
        List<String> tokens = tokens(rest);
        if (tokens.isEmpty()) {
            throw InputException.badArgument("\\i", "\\i <file> [name=value ...]");
        }
        b.kind(Metacommand.Kind.INCLUDE).path(tokens.get(0));
        addBindings(b, tokens.subList(1, tokens.size()));
        return b.build();
    }

    private static Metacommand parseAssignment(Metacommand.MetacommandBuilder b, String rest, String expected) {
        int ws = indexOfWhitespace(rest);
        if (rest.isEmpty() || ws < 0) {
            throw InputException.badArgument(rest.isEmpty() ? "(nothing)" : rest, expected);
        }
        String name = rest.substring(0, ws);
        String value = rest.substring(ws).trim();
        if (!NAME.matcher(name).matches()) {
            throw InputException.badArgument(name, expected);
        }
        return b.name(name).value(value).build();
    }

    private static String singleName(String rest, String expected) {
        if (rest.isEmpty() || !NAME.matcher(rest).matches()) {
            throw InputException.badArgument(rest.isEmpty() ? "(nothing)" : rest, expected);
        }
        return rest;
    }

    private static Metacommand parseSnippet(Metacommand.MetacommandBuilder b, String rest) {
        String expected = "\\snip save <name> | \\snip run <name> [name=value ...]";
        List<String> tokens = tokens(rest);
        if (tokens.size() < 2) {
            throw InputException.badArgument(rest.isEmpty() ? "(nothing)" : rest, expected);
        }
        String sub = tokens.get(0).toLowerCase(Locale.ROOT);
        String name = tokens.get(1);
        if (!NAME.matcher(name).matches() || name.startsWith(".")) {
            throw InputException.badArgument(name, "a snippet name of letters, digits, '_', '-' or '.'");
        }
        if ("save".equals(sub)) {
            if (tokens.size() > 2) {
                throw InputException.badArgument(tokens.get(2), "\\snip save <name>");
            }
            return b.kind(Metacommand.Kind.SNIPPET_SAVE).name(name).build();
        }
        if ("run".equals(sub)) {
            b.kind(Metacommand.Kind.SNIPPET_RUN).name(name);
            addBindings(b, tokens.subList(2, tokens.size()));
            return b.build();
        }
        throw InputException.badArgument(tokens.get(0), expected);
    }

    private static Metacommand parseList(Metacommand.MetacommandBuilder b, String rest, boolean plus, boolean bang) {
        String expected = "\\list[+][!] table|index|function|view|schema|sequence [pattern]";
        List<String> tokens = tokens(rest);
        if (tokens.isEmpty() || tokens.size() > 2) {
            throw InputException.badArgument(rest.isEmpty() ? "(nothing)" : rest, expected);
        }
        Metacommand.ListKind kind;
        try {
            kind = Metacommand.ListKind.valueOf(tokens.get(0).toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw InputException.badArgument(tokens.get(0), expected);
        }
        return b.kind(Metacommand.Kind.LIST)
                .listKind(kind)
                .pattern(tokens.size() > 1 ? tokens.get(1) : DEFAULT_LIST_PATTERN)
                .detail(plus)
                .sameConnection(bang)
                .build();
    }

    private static Metacommand listAlias(Metacommand.MetacommandBuilder b, Metacommand.ListKind kind, String rest,
                                         boolean plus, boolean bang) {
        List<String> tokens = tokens(rest);
        if (tokens.size() > 1) {
            throw InputException.badArgument(tokens.get(1), "at most one pattern");
        }
        return b.kind(Metacommand.Kind.LIST)
                .listKind(kind)
                .pattern(tokens.isEmpty() ? DEFAULT_LIST_PATTERN : tokens.get(0))
                .detail(plus)
                .sameConnection(bang)
                .build();
    }

    private static Metacommand parseResult(Metacommand.MetacommandBuilder b, String rest) {
        String expected = "\\re list[+] [limit] | \\re show [n=N] [format=F] [to=PATH] [only=a,b] [limit=N] [offset=N]";
        List<String> tokens = tokens(rest);
        if (tokens.isEmpty()) {
            throw InputException.badArgument("\\re", expected);
        }
        String sub = tokens.get(0).toLowerCase(Locale.ROOT);
        if ("list".equals(sub) || "list+".equals(sub)) {
            b.kind(Metacommand.Kind.RESULT_LIST).detail(sub.endsWith("+"));
            if (tokens.size() > 2) {
                throw InputException.badArgument(tokens.get(2), "\\re list[+] [limit]");
            }
            if (tokens.size() == 2) {
                b.limit(parseCount(tokens.get(1), "\\re list[+] [limit]"));
            }
            return b.build();
        }
        if ("show".equals(sub)) {
            Metacommand.ResultShowOptions.ResultShowOptionsBuilder show = Metacommand.ResultShowOptions.builder();
            for (String token : tokens.subList(1, tokens.size())) {
                int eq = token.indexOf('=');
                if (eq < 0) {
                    show.index(parseCount(token, "n=N"));
                    continue;
                }
                String key = token.substring(0, eq).toLowerCase(Locale.ROOT);
                String value = token.substring(eq + 1);
                switch (key) {
                    case "n":
                        show.index(parseCount(value, "n=N"));
                        break;
                    case "format":
                        show.format(value.toLowerCase(Locale.ROOT));
                        break;
                    case "to":
                        if (value.isEmpty()) {
                            throw InputException.badArgument(token, "to=PATH");
                        }
                        show.to(value);
                        break;
                    case "only":
                        Arrays.stream(value.split(","))
                                .map(String::trim)
                                .filter(s -> !s.isEmpty())
                                .forEach(show::column);
                        break;
                    case "limit":
                        show.limit(parseCount(value, "limit=N"));
                        break;
                    case "offset":
                        show.offset(parseCount(value, "offset=N"));
                        break;
                    default:
                        throw InputException.badArgument(token, expected);
                }
            }
            return b.kind(Metacommand.Kind.RESULT_SHOW).show(show.build()).build();
        }
        throw InputException.badArgument(tokens.get(0), expected);
    }

    private static void addBindings(Metacommand.MetacommandBuilder b, List<String> tokens) {
        for (String token : tokens) {
            int eq = token.indexOf('=');
            if (eq <= 0) {
                throw InputException.badArgument(token, "name=value");
            }
            b.binding(token.substring(0, eq), token.substring(eq + 1));
        }
    }

    private static int parseCount(String token, String expected) {
        try {
            int value = Integer.parseInt(token);
            if (value < 0) {
                throw InputException.badArgument(token, expected);
            }
            return value;
        } catch (NumberFormatException e) {
            throw InputException.badArgument(token, expected);
        }
    }

    private static List<String> tokens(String rest) {
        List<String> out = new ArrayList<>();
        for (String t : rest.trim().split("\\s+")) {
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return out;
    }

    private static int indexOfWhitespace(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
