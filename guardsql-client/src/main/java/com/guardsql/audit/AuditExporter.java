package com.guardsql.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardsql.error.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Writes audit entries as JSON lines or plain text.
 */
@Slf4j
@Component
public class AuditExporter {
    private final ObjectMapper objectMapper;

    public AuditExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Export entries from the main store, or from every orphaned store when asked.
     *
     * @param dir audit directory
     * @param query filters
     * @param plain plain text instead of JSON lines
     * @param out destination
     * @return number of entries written
     * @throws IOException on write failures
     */
    public int export(Path dir, AuditQuery query, boolean plain, OutputStream out) throws IOException {
        int count = 0;
        if (query.isOrphans()) {
            List<Path> orphans = AuditLog.findOrphans(dir);
            if (orphans.isEmpty()) {
                log.info("No orphaned audit stores found: dir={}", dir);
            }
            for (Path orphan : orphans) {
                log.info("Reading orphaned audit store: path={}", orphan);
                try (AuditLog audit = AuditLog.openReadOnly(orphan)) {
                    count += write(audit.query(query), plain, out);
                } catch (PersistenceException e) {
                    log.warn("Skipping unreadable orphan: path={}, error={}", orphan, e.getMessage());
                }
            }
        } else {
            try (AuditLog audit = AuditLog.openReadOnly(dir.resolve(AuditLog.MAIN_DB))) {
                count += write(audit.query(query), plain, out);
            }
        }
        out.flush();
        return count;
    }

    int write(List<AuditEntry> entries, boolean plain, OutputStream out) throws IOException {
        for (AuditEntry entry : entries) {
            String line = plain ? toPlain(entry) : objectMapper.writeValueAsString(toJson(entry));
            out.write(line.getBytes(StandardCharsets.UTF_8));
            out.write('\n');
        }
        return entries.size();
    }

    ObjectNode toJson(AuditEntry entry) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("ts", formatTs(entry.getTs()));
        node.put("instance_id", entry.getInstanceId());
        node.put("query", entry.getQuery());
        node.put("outcome", entry.getOutcome());
        node.put("db_user", entry.getDbUser());
        node.put("sys_user", entry.getSysUser());
        node.put("writemode", entry.isWritemode());
        if (entry.getJustification() != null) {
            node.put("justification", entry.getJustification());
        } else {
            node.putNull("justification");
        }
        return node;
    }

    static String toPlain(AuditEntry entry) {
        StringBuilder sb = new StringBuilder();
        sb.append(formatTs(entry.getTs())).append(' ')
                .append(entry.getSysUser()).append('/').append(entry.getDbUser());
        if (entry.isWritemode()) {
            sb.append(" [write: ").append(entry.getJustification()).append(']');
        }
        sb.append(' ').append(entry.getOutcome()).append('\n');
        for (String line : entry.getQuery().split("\n", -1)) {
            sb.append("    ").append(line).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    static String formatTs(long micros) {
        Instant instant = Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
