package com.guardsql.config;

import com.guardsql.audit.AuditQuery;
import com.guardsql.error.InputException;
import com.guardsql.model.Theme;
import lombok.Builder;
import lombok.Data;
import org.springframework.boot.ApplicationArguments;

import java.util.List;

/**
 * Command-line surface of the standalone client.
 *
 * <pre>
 * guardsql [--write] [--theme=light|dark|auto] [--audit-path=DIR] TARGET
 * guardsql --audit-export [--limit=N] [--first] [--since=TS] [--until=TS] [--pattern=REGEX]
 *          [--orphans] [--plain] [--audit-path=DIR]
 * </pre>
 */
@Data
@Builder
public class CliOptions {
    private String target;
    private boolean write;
    private Theme theme;
    private String auditPath;

    /** Print audit entries instead of starting a session. */
    private boolean auditExport;
    private AuditQuery exportQuery;
    private boolean plain;

    /**
     * Read options from Spring Boot's parsed arguments.
     *
     * @param args application arguments
     * @param properties configured defaults
     * @return options
     */
    public static CliOptions from(ApplicationArguments args, GuardsqlProperties properties) {
        if (args.containsOption("audit-export")) {
            return CliOptions.builder()
                    .auditExport(true)
                    .exportQuery(exportQuery(args))
                    .plain(args.containsOption("plain"))
                    .theme(Theme.parse(properties.getTheme()))
                    .auditPath(first(args, "audit-path", properties.getAudit().getPath()))
                    .build();
        }

        List<String> positional = args.getNonOptionArgs();
        if (positional.size() > 1) {
            throw new InputException("Expected one connection target, got " + positional);
        }
        String target = positional.isEmpty() ? System.getenv("PGDATABASE") : positional.get(0);
        if (target == null || target.isBlank()) {
            throw new InputException("Missing connection target (database name, URL or SQLite file)");
        }

        Theme theme = Theme.parse(first(args, "theme", properties.getTheme()));

        return CliOptions.builder()
                .target(target)
                .write(args.containsOption("write"))
                .theme(theme)
                .auditPath(first(args, "audit-path", properties.getAudit().getPath()))
                .build();
    }

    private static AuditQuery exportQuery(ApplicationArguments args) {
        AuditQuery.AuditQueryBuilder query = AuditQuery.builder()
                .first(args.containsOption("first"))
                .orphans(args.containsOption("orphans"))
                .since(first(args, "since", null))
                .until(first(args, "until", null))
                .pattern(first(args, "pattern", null));
        String limit = first(args, "limit", null);
        if (limit != null) {
            try {
                int value = Integer.parseInt(limit);
                if (value < 0) {
                    throw InputException.badArgument(limit, "--limit=N (0 for all)");
                }
                query.limit(value);
            } catch (NumberFormatException e) {
                throw InputException.badArgument(limit, "--limit=N (0 for all)");
            }
        }
        return query.build();
    }

    private static String first(ApplicationArguments args, String name, String fallback) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0) == null) {
            return fallback;
        }
        return values.get(0);
    }
}
