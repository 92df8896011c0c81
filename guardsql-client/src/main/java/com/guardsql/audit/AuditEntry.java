package com.guardsql.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One accepted input and its outcome.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {
    public static final String OK = "OK";
    public static final String CANCELLED = "CANCELLED";

    /** Epoch microseconds, unique within the store; assigned on append. */
    private long ts;
    private String instanceId;
    private String query;
    private String outcome;
    private String dbUser;
    private String sysUser;
    private boolean writemode;
    /** Set only when the entry was written in write mode. */
    private String justification;

    public static String errorOutcome(String kind, String message) {
        return "ERROR: " + kind + ": " + message;
    }
}
