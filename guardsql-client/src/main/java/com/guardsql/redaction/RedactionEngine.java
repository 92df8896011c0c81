package com.guardsql.redaction;

import com.guardsql.api.ExecuteResponse;
import com.guardsql.config.GuardsqlProperties;
import com.guardsql.render.ResultTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces the values of configured columns with {@value #REDACTED}.
 */
@Slf4j
@Component
public class RedactionEngine {
    public static final String REDACTED = "[redacted]";
    public static final String UNAVAILABLE = "Redaction mode is not available (no redactions configured).";

    private final List<RedactionRule> rules;

    @Autowired
    public RedactionEngine(GuardsqlProperties properties) {
        this(parse(properties.getRedactions()));
    }

    public RedactionEngine(List<RedactionRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    private static List<RedactionRule> parse(List<String> texts) {
        List<RedactionRule> out = new ArrayList<>();
        for (String text : texts) {
            out.add(RedactionRule.parse(text));
        }
        return out;
    }

    public boolean isAvailable() {
        return !rules.isEmpty();
    }

    public List<RedactionRule> getRules() {
        return rules;
    }

    /**
     * Find the rule covering a column. When several rules match, the first declared one is used.
     *
     * @param column result column
     * @return matching rule, or null
     */
    RedactionRule ruleFor(ExecuteResponse.ColumnDefinition column) {
        RedactionRule chosen = null;
        for (RedactionRule rule : rules) {
            if (!rule.matches(column)) {
                continue;
            }
            if (chosen == null) {
                chosen = rule;
            } else {
                log.warn("Several redaction rules match column {}: using {}, also matched {}",
                        column.getName(), chosen, rule);
            }
        }
        return chosen;
    }

    /**
     * Return a copy of the table with covered columns redacted.
     *
     * @param table result
     * @return redacted result, or the same table when nothing matched
     */
    public ResultTable apply(ResultTable table) {
        List<String> covered = new ArrayList<>();
        for (ExecuteResponse.ColumnDefinition column : table.getColumns()) {
            if (ruleFor(column) != null) {
                covered.add(column.getName());
            }
        }
        if (covered.isEmpty()) {
            return table;
        }
        List<Map<String, Object>> rows = new ArrayList<>(table.getRows().size());
        for (Map<String, Object> row : table.getRows()) {
            Map<String, Object> copy = new LinkedHashMap<>(row);
            for (String name : covered) {
                copy.put(name, REDACTED);
            }
            rows.add(copy);
        }
        return new ResultTable(table.getColumns(), rows);
    }
}
