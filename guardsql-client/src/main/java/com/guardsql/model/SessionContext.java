package com.guardsql.model;

import lombok.Data;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Per-session state threaded through every operation.
 */
@Data
public class SessionContext {
    /** Tags every audit entry written by this process instance. */
    private final String instanceId = UUID.randomUUID().toString();
    private final VariableStore variables = new VariableStore();
    private final JustificationHistory justificationHistory = new JustificationHistory();

    private boolean writeMode;
    private String justification;
    /** Last status observed by the monitor connection. */
    private TransactionStatus observedStatus = TransactionStatus.NONE;
    /** A statement failed in write mode since the last commit or rollback. */
    private boolean failedSinceBoundary;

    private boolean expanded;
    private boolean redact;
    /** {@code \o} target, null for the terminal. */
    private Path outputPath;

    /** Exact text of the last executed query, for {@code \snip save}. */
    private String lastQueryText;

    private String dbUser = "";
    private String sysUser = System.getProperty("user.name", "");
    private Theme theme = Theme.AUTO;
}
