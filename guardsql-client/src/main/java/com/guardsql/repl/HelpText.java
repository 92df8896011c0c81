package com.guardsql.repl;

import java.util.List;

/**
 * Text printed by {@code \?}.
 */
public final class HelpText {

    /** Metacommand names offered by completion. */
    public static final List<String> COMMANDS = List.of(
            "\\q", "\\?", "\\help", "\\x", "\\W", "\\R", "\\e", "\\i", "\\o", "\\debug",
            "\\set", "\\default", "\\unset", "\\get", "\\vars", "\\snip",
            "\\d", "\\list", "\\dt", "\\di", "\\df", "\\dv", "\\dn", "\\ds", "\\re");

    public static final String TEXT = String.join("\n",
            "General",
            "  \\q                      quit (refused while a transaction is open)",
            "  \\? | \\help              show this help",
            "  \\x                      toggle expanded display",
            "  \\W                      toggle write mode (asks for a justification)",
            "  \\R                      toggle redaction of configured columns",
            "  \\debug [state]          show session diagnostics",
            "",
            "Input",
            "  \\e [FILE]               edit the query buffer or FILE in $EDITOR",
            "  \\i FILE [k=v ...]       run FILE with temporary variable bindings",
            "  \\o [FILE]               send results to FILE; no argument returns to the terminal",
            "",
            "Variables",
            "  \\set NAME VALUE         set a variable, used as ${NAME}",
            "  \\default NAME VALUE     set a variable unless it is already set",
            "  \\unset NAME             remove a variable",
            "  \\get NAME               print a variable",
            "  \\vars [PATTERN]         list variables",
            "",
            "Snippets",
            "  \\snip save NAME         save the last query",
            "  \\snip run NAME [k=v]    run a saved snippet",
            "",
            "Catalog (add + for detail, ! to use the session connection)",
            "  \\d NAME                 describe a table, view or sequence",
            "  \\list KIND [PATTERN]    KIND is table|index|function|view|schema|sequence",
            "  \\dt \\di \\df \\dv \\dn \\ds  shorthands for \\list",
            "",
            "Results",
            "  \\re list[+] [LIMIT]     list past results",
            "  \\re show [n=N] [format=F] [to=PATH] [only=a,b] [limit=N] [offset=N]",
            "                          formats: table expanded json json-line csv excel sqlite",
            "",
            "Query terminators",
            "  ;                       run",
            "  \\g[x][j][o][v][z][set] [ARG]",
            "                          x expanded, j json, o write to file ARG, v no ${} expansion,",
            "                          z no output, set store the single row in variables (prefix ARG)",
            "");

    private HelpText() {
    }
}
