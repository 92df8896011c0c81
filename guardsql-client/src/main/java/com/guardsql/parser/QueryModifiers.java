package com.guardsql.parser;

import com.guardsql.render.OutputFormat;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Independent flags attached to a query by its terminator ({@code ;} or {@code \g...}).
 *
 * <p>Combination rules:
 * <ul>
 *   <li>json with expanded renders one pretty-printed JSON array</li>
 *   <li>json alone renders one compact object per line</li>
 *   <li>suppressed output still captures variables when {@code set} is present</li>
 *   <li>output-to-file takes the argument slot, so it disables variable capture</li>
 * </ul>
 */
@Data
@NoArgsConstructor
public class QueryModifiers {
    private boolean execute = true;
    private boolean expanded;
    private boolean json;
    private boolean verbatim;
    private boolean zero;
    private String outputFile;
    private boolean varSet;
    private String varPrefix;

    public static QueryModifiers none() {
        return new QueryModifiers();
    }

    public boolean isPrettyJson() {
        return json && expanded;
    }

    public boolean hasOutputFile() {
        return outputFile != null;
    }

    /**
     * Resolve the display format from the flag set.
     *
     * @return format
     */
    public OutputFormat format() {
        if (json) {
            return expanded ? OutputFormat.JSON_ARRAY : OutputFormat.JSON_LINE;
        }
        return expanded ? OutputFormat.EXPANDED : OutputFormat.TABLE;
    }

    /**
     * Render the flags back in the {@code \g} terminator syntax.
     *
     * @return terminator text, {@code ;} when no flag is set
     */
    public String toTerminator() {
        StringBuilder sb = new StringBuilder();
        if (expanded) {
            sb.append('x');
        }
        if (json) {
            sb.append('j');
        }
        if (verbatim) {
            sb.append('v');
        }
        if (zero) {
            sb.append('z');
        }
        if (outputFile != null) {
            sb.append('o');
        }
        if (varSet && outputFile == null) {
            sb.append("set");
        }
        if (sb.length() == 0) {
            return ";";
        }
        sb.insert(0, "\\g");
        if (outputFile != null) {
            sb.append(' ').append(outputFile);
        } else if (varSet && varPrefix != null) {
            sb.append(' ').append(varPrefix);
        }
        return sb.toString();
    }
}
