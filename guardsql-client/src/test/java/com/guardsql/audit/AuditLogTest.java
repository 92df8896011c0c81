package com.guardsql.audit;

import com.guardsql.config.GuardsqlProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditLogTest {
    @TempDir
    Path dir;

    private static AuditEntry entry(String instance, String query) {
        return AuditEntry.builder()
                .instanceId(instance)
                .query(query)
                .outcome(AuditEntry.OK)
                .dbUser("app")
                .sysUser("ops")
                .build();
    }

    private static AuditQuery all() {
        return AuditQuery.builder().limit(0).build();
    }

    @Test
    void concurrentWritersShareOneOrderedStore() {
        GuardsqlProperties.Audit settings = new GuardsqlProperties.Audit();
        try (AuditLog a = AuditLog.open(dir, settings); AuditLog b = AuditLog.open(dir, settings)) {
            for (int i = 0; i < 20; i++) {
                a.append(entry("a", "SELECT " + i + ";"));
                b.append(entry("b", "SELECT " + i + ";"));
            }

            List<AuditEntry> entries = a.query(all());
            assertEquals(40, entries.size());
            Set<Long> timestamps = new HashSet<>();
            long previous = Long.MIN_VALUE;
            for (AuditEntry e : entries) {
                assertTrue(e.getTs() > previous);
                previous = e.getTs();
                timestamps.add(e.getTs());
            }
            assertEquals(40, timestamps.size());
            List<String> fromA = entries.stream().filter(e -> "a".equals(e.getInstanceId()))
                    .map(AuditEntry::getQuery).collect(Collectors.toList());
            assertEquals("SELECT 0;", fromA.get(0));
            assertEquals("SELECT 19;", fromA.get(19));
        }
    }

    @Test
    void justificationOnlyInWriteMode() {
        try (AuditLog log = AuditLog.open(dir, new GuardsqlProperties.Audit())) {
            log.append(entry("x", "SELECT 1;").toBuilder().justification("ignored").build());
            log.append(entry("x", "DELETE FROM t;").toBuilder().writemode(true).justification("ticket 7").build());

            List<AuditEntry> entries = log.query(all());
            assertNull(entries.get(0).getJustification());
            assertFalse(entries.get(0).isWritemode());
            assertEquals("ticket 7", entries.get(1).getJustification());
            assertTrue(entries.get(1).isWritemode());
        }
    }

    @Test
    void limitPatternAndOrdering() {
        try (AuditLog log = AuditLog.open(dir, new GuardsqlProperties.Audit())) {
            for (int i = 0; i < 5; i++) {
                log.append(entry("x", "SELECT " + i + ";"));
            }
            log.append(entry("x", "UPDATE t SET a = 1;"));

            List<AuditEntry> newest = log.query(AuditQuery.builder().limit(2).build());
            assertEquals(List.of("SELECT 4;", "UPDATE t SET a = 1;"),
                    newest.stream().map(AuditEntry::getQuery).collect(Collectors.toList()));

            List<AuditEntry> oldest = log.query(AuditQuery.builder().limit(2).first(true).build());
            assertEquals(List.of("SELECT 0;", "SELECT 1;"),
                    oldest.stream().map(AuditEntry::getQuery).collect(Collectors.toList()));

            List<AuditEntry> updates = log.query(AuditQuery.builder().limit(0).pattern("^UPDATE").build());
            assertEquals(1, updates.size());

            List<AuditEntry> future = log.query(AuditQuery.builder().since("2999-01-01").build(), ZoneOffset.UTC);
            assertTrue(future.isEmpty());
        }
    }

    @Test
    void unreadableStoreIsMovedAside() throws IOException {
        Files.createDirectories(dir);
        Files.write(dir.resolve(AuditLog.MAIN_DB), "x".repeat(4096).getBytes());

        try (AuditLog log = AuditLog.open(dir, new GuardsqlProperties.Audit())) {
            log.append(entry("x", "SELECT 1;"));
            assertEquals(1, log.query(all()).size());
        }
        List<Path> orphans = AuditLog.findOrphans(dir);
        assertEquals(1, orphans.size());
        assertTrue(orphans.get(0).getFileName().toString().startsWith(AuditLog.ORPHAN_PREFIX));
        assertEquals("x".repeat(4096), Files.readString(orphans.get(0)));
    }

    @Test
    void oversizedStoreIsCulledOnOpen() {
        try (AuditLog log = AuditLog.open(dir, new GuardsqlProperties.Audit())) {
            for (int i = 0; i < 50; i++) {
                log.append(entry("x", "SELECT '" + "y".repeat(200) + "';"));
            }
        }
        GuardsqlProperties.Audit tiny = new GuardsqlProperties.Audit();
        tiny.setCullThresholdBytes(1);
        tiny.setCullTargetBytes(1);
        tiny.setCullBatch(10);

        try (AuditLog log = AuditLog.open(dir, tiny)) {
            assertTrue(log.query(all()).isEmpty());
        }
    }

    @Test
    void cullKeepsNewestEntriesAndStopsNearTarget() throws IOException {
        String padding = "z".repeat(1000);
        try (AuditLog log = AuditLog.open(dir, new GuardsqlProperties.Audit())) {
            for (int i = 0; i < 2000; i++) {
                log.append(entry("x", "SELECT " + i + " /* " + padding + " */;"));
            }
        }
        long sizeBefore = Files.size(dir.resolve(AuditLog.MAIN_DB));
        GuardsqlProperties.Audit settings = new GuardsqlProperties.Audit();
        settings.setCullThresholdBytes(sizeBefore - 1);
        settings.setCullTargetBytes(sizeBefore * 9 / 10);

        try (AuditLog log = AuditLog.open(dir, settings)) {
            assertTrue(log.storeSize() <= settings.getCullTargetBytes());
            List<AuditEntry> left = log.query(all());
            assertTrue(left.size() < 2000);
            assertTrue(left.size() > 1500, "culled far past the target: " + left.size() + " left");
            assertTrue(left.get(left.size() - 1).getQuery().startsWith("SELECT 1999 "));
            assertTrue(left.get(0).getQuery().startsWith("SELECT " + (2000 - left.size()) + " "));
        }
    }

    @Test
    void timestampForms() {
        assertEquals(0L, AuditQuery.toMicros(AuditQuery.parseTimestamp("1970-01-01T00:00:00Z", ZoneOffset.UTC)));
        assertEquals(1_000_000L,
                AuditQuery.toMicros(AuditQuery.parseTimestamp("1970-01-01 00:00:01", ZoneOffset.UTC)));
        assertEquals(86_400_000_000L,
                AuditQuery.toMicros(AuditQuery.parseTimestamp("1970-01-02", ZoneOffset.UTC)));
        assertEquals(32_503_680_000_000_000L,
                AuditQuery.toMicros(AuditQuery.parseTimestamp("3000-01-01", ZoneOffset.UTC)));
        assertEquals(Long.MAX_VALUE, AuditQuery.toMicros(Instant.MAX));
        assertEquals(Long.MIN_VALUE, AuditQuery.toMicros(Instant.MIN));
    }

    @Test
    void boundsBeyondYear2262SelectByRange() {
        try (AuditLog log = AuditLog.open(dir, new GuardsqlProperties.Audit())) {
            log.append(entry("x", "SELECT 1;"));

            assertTrue(log.query(AuditQuery.builder().since("2300-01-01").build(), ZoneOffset.UTC).isEmpty());
            assertEquals(1, log.query(AuditQuery.builder().until("9999-12-31 23:59:59").build(), ZoneOffset.UTC).size());
        }
    }
}
