package com.guardsql.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code application.yml} under the {@code guardsql} prefix.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "guardsql")
public class GuardsqlProperties {

    /** Directory holding the audit store, snippets and line history. */
    @NotBlank
    private String dataDir = System.getProperty("user.home") + "/.local/state/guardsql";

    /** light | dark | auto */
    private String theme = "auto";

    @Valid
    private Pool pool = new Pool();

    @Valid
    private Execute execute = new Execute();

    @Valid
    private History history = new History();

    @Valid
    private Audit audit = new Audit();

    @Valid
    private SchemaCache schemaCache = new SchemaCache();

    @Valid
    private Repl repl = new Repl();

    /** Redaction rules as {@code schema.table.column}. */
    private List<String> redactions = new ArrayList<>();

    public Path dataPath() {
        return Path.of(dataDir);
    }

    public Path snippetsPath() {
        return dataPath().resolve("snippets");
    }

    @Data
    public static class Pool {
        @Min(2)
        private int maximumSize = 4;
        @Min(0)
        private int minimumIdle = 1;
        @Min(250)
        private int connectionTimeoutMs = 10000;
    }

    @Data
    public static class Execute {
        @Min(0)
        private int fetchSize = 500;
        @Min(0)
        private int queryTimeoutMs = 0;
        /** Results longer than this are truncated on screen. */
        @Min(1)
        private int displayRowLimit = 50;
        @Min(1)
        private int displayTruncatedRows = 30;
        /** Show a progress line once a query runs this long. */
        @Min(0)
        private int progressAfterMs = 1000;
    }

    @Data
    public static class History {
        @Min(0)
        private long maxBytes = 1024L * 1024 * 1024;
    }

    @Data
    public static class Audit {
        /** Overrides {@code <dataDir>} for the audit store. */
        private String path;
        @Min(0)
        private long cullThresholdBytes = 100L * 1024 * 1024;
        @Min(0)
        private long cullTargetBytes = 90L * 1024 * 1024;
        @Min(1)
        private int cullBatch = 100;
        @Min(0)
        private int busyTimeoutMs = 5000;
    }

    @Data
    public static class SchemaCache {
        private boolean enabled = false;
        @Min(1000)
        private int queryTimeoutMs = 12000;
        @Min(0)
        private int ttlSeconds = 300;
    }

    @Data
    public static class Repl {
        private boolean enabled = true;
    }
}
