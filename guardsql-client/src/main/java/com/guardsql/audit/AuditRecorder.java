package com.guardsql.audit;

import com.guardsql.config.GuardsqlProperties;
import com.guardsql.error.GuardsqlException;
import com.guardsql.model.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Appends every accepted input of this session to the audit store.
 * A failed append is logged and never interrupts the session.
 */
@Slf4j
@Component
public class AuditRecorder implements AutoCloseable {
    private final SessionContext context;
    private final GuardsqlProperties properties;
    private AuditLog auditLog;

    public AuditRecorder(SessionContext context, GuardsqlProperties properties) {
        this.context = context;
        this.properties = properties;
    }

    /**
     * Open the store under the given directory, or the configured one when null.
     *
     * @param dir audit directory override
     */
    public synchronized void open(Path dir) {
        if (auditLog != null) {
            return;
        }
        auditLog = AuditLog.open(dir != null ? dir : auditDir(properties), properties.getAudit());
    }

    public static Path auditDir(GuardsqlProperties properties) {
        String override = properties.getAudit().getPath();
        return override != null && !override.isBlank() ? Path.of(override) : properties.dataPath();
    }

    /**
     * Record one input and its outcome.
     *
     * @param text exact input text
     * @param outcome outcome string
     */
    public synchronized void record(String text, String outcome) {
        if (auditLog == null) {
            log.warn("Audit store not open, entry dropped: instance_id={}", context.getInstanceId());
            return;
        }
        AuditEntry entry = AuditEntry.builder()
                .instanceId(context.getInstanceId())
                .query(text)
                .outcome(outcome)
                .dbUser(context.getDbUser())
                .sysUser(context.getSysUser())
                .writemode(context.isWriteMode())
                .justification(context.isWriteMode() ? context.getJustification() : null)
                .build();
        try {
            auditLog.append(entry);
        } catch (GuardsqlException e) {
            log.warn("Audit append failed: instance_id={}, error={}", context.getInstanceId(), e.getMessage());
        }
    }

    AuditLog getAuditLog() {
        return auditLog;
    }

    @Override
    public synchronized void close() {
        if (auditLog != null) {
            auditLog.close();
            auditLog = null;
        }
    }
}
