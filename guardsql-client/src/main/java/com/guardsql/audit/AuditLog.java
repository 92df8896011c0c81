package com.guardsql.audit;

import com.guardsql.config.GuardsqlProperties;
import com.guardsql.error.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.ZoneId;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Append-only audit store shared by every running client on the machine.
 *
 * <p>Entries live in a SQLite database in WAL mode; SQLite's file locking serializes writers
 * across processes. Culling and compaction also take an exclusive lock on {@code audit.lock},
 * acquired with {@code tryLock} so maintenance is skipped rather than waited for.
 */
@Slf4j
public class AuditLog implements AutoCloseable {
    public static final String MAIN_DB = "audit.db";
    static final String LOCK_FILE = "audit.lock";
    static final String ORPHAN_PREFIX = "audit-orphaned-";
    static final String DB_SUFFIX = ".db";
    /** SQLITE_CONSTRAINT */
    private static final int CONSTRAINT = 19;
    /** SQLITE_CORRUPT */
    private static final int CORRUPT = 11;
    /** SQLITE_NOTADB */
    private static final int NOTADB = 26;
    private static final int MAX_INSERT_ATTEMPTS = 1000;

    private final Path dir;
    private final Path path;
    private final GuardsqlProperties.Audit settings;
    private final Connection conn;
    private final boolean readOnly;
    private long lastTs;

    private AuditLog(Path dir, Path path, GuardsqlProperties.Audit settings, Connection conn, boolean readOnly) {
        this.dir = dir;
        this.path = path;
        this.settings = settings;
        this.conn = conn;
        this.readOnly = readOnly;
    }

    /**
     * Open the main store in a directory, creating it if needed. A store that cannot be opened is
     * renamed aside as an orphan and replaced by a fresh one.
     *
     * @param dir audit directory
     * @param settings audit settings
     * @return open audit log
     * @throws PersistenceException if no usable store can be created
     */
    public static AuditLog open(Path dir, GuardsqlProperties.Audit settings) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create audit directory " + dir + ": " + e.getMessage(), e);
        }
        Path path = dir.resolve(MAIN_DB);
        Connection conn;
        try {
            conn = openStore(path, settings, false);
        } catch (SQLException e) {
            if (!isCorruption(e)) {
                throw new PersistenceException("Cannot open audit store " + path + ": " + e.getMessage(), e);
            }
            Path orphan = orphanAside(path);
            log.warn("Audit store unreadable, moved aside: path={}, orphan={}, error={}", path, orphan, e.getMessage());
            try {
                conn = openStore(path, settings, false);
            } catch (SQLException retry) {
                throw new PersistenceException("Cannot create audit store " + path + ": " + retry.getMessage(), retry);
            }
        }
        AuditLog audit = new AuditLog(dir, path, settings, conn, false);
        try {
            audit.cullIfOversize();
        } catch (SQLException | IOException | RuntimeException e) {
            log.warn("Audit cull failed: path={}, error={}", path, e.getMessage());
        }
        log.info("Audit store opened: path={}", path);
        return audit;
    }

    /**
     * Open an existing store file for reading only.
     *
     * @param file store file
     * @return audit log
     */
    public static AuditLog openReadOnly(Path file) {
        if (!Files.exists(file)) {
            throw new PersistenceException("Audit store " + file + " does not exist");
        }
        try {
            return new AuditLog(file.getParent(), file, new GuardsqlProperties.Audit(),
                    openStore(file, new GuardsqlProperties.Audit(), true), true);
        } catch (SQLException e) {
            throw new PersistenceException("Cannot open audit store " + file + ": " + e.getMessage(), e);
        }
    }

    private static Connection openStore(Path path, GuardsqlProperties.Audit settings, boolean readOnly)
            throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(settings.getBusyTimeoutMs());
        if (readOnly) {
            config.setReadOnly(true);
        } else {
            config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        }
        Connection conn = config.createConnection("jdbc:sqlite:" + path.toAbsolutePath());
        try {
            try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("PRAGMA quick_check")) {
                String result = rs.next() ? rs.getString(1) : null;
                if (!"ok".equalsIgnoreCase(result)) {
                    throw new SQLException("integrity check failed: " + result, null, CORRUPT);
                }
            }
            if (!readOnly) {
                try (Statement st = conn.createStatement()) {
                    for (String ddl : SqlLoader.statements("schema")) {
                        st.execute(ddl);
                    }
                }
            }
            return conn;
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
    }

    static boolean isCorruption(SQLException e) {
        String message = e.getMessage() != null ? e.getMessage() : "";
        return e.getErrorCode() == CORRUPT || e.getErrorCode() == NOTADB
                || message.contains("SQLITE_CORRUPT") || message.contains("SQLITE_NOTADB");
    }

    private static Path orphanAside(Path path) {
        Path orphan = path.resolveSibling(ORPHAN_PREFIX + UUID.randomUUID() + DB_SUFFIX);
        try {
            Files.move(path, orphan);
            Files.deleteIfExists(path.resolveSibling(path.getFileName() + "-wal"));
            Files.deleteIfExists(path.resolveSibling(path.getFileName() + "-shm"));
        } catch (IOException e) {
            throw new PersistenceException("Cannot move unreadable audit store " + path + " aside: " + e.getMessage(), e);
        }
        return orphan;
    }

    /**
     * Append an entry, assigning it a timestamp unique within the store.
     *
     * @param entry entry; its {@code ts} is ignored
     * @return assigned timestamp in epoch microseconds
     */
    public synchronized long append(AuditEntry entry) {
        long ts = Math.max(nowMicros(), lastTs + 1);
        try (PreparedStatement insert = conn.prepareStatement(SqlLoader.load("insert"))) {
            for (int attempt = 0; attempt < MAX_INSERT_ATTEMPTS; attempt++, ts++) {
                insert.setLong(1, ts);
                insert.setString(2, entry.getInstanceId());
                insert.setString(3, entry.getQuery());
                insert.setString(4, entry.getOutcome());
                insert.setString(5, nullToEmpty(entry.getDbUser()));
                insert.setString(6, nullToEmpty(entry.getSysUser()));
                insert.setInt(7, entry.isWritemode() ? 1 : 0);
                insert.setString(8, entry.isWritemode() ? entry.getJustification() : null);
                try {
                    insert.executeUpdate();
                    lastTs = ts;
                    return ts;
                } catch (SQLException e) {
                    if (!isConflict(e)) {
                        throw e;
                    }
                }
            }
            throw new PersistenceException("No free audit timestamp after " + MAX_INSERT_ATTEMPTS + " attempts");
        } catch (SQLException e) {
            throw new PersistenceException("Audit append failed: " + e.getMessage(), e);
        }
    }

    private static boolean isConflict(SQLException e) {
        String message = e.getMessage() != null ? e.getMessage() : "";
        return e.getErrorCode() == CONSTRAINT || message.contains("SQLITE_CONSTRAINT");
    }

    static long nowMicros() {
        return ChronoUnit.MICROS.between(Instant.EPOCH, Instant.now());
    }

    /**
     * Read entries back, chronologically.
     *
     * @param query filters
     * @return matching entries, oldest first
     */
    public List<AuditEntry> query(AuditQuery query) {
        return query(query, ZoneId.systemDefault());
    }

    synchronized List<AuditEntry> query(AuditQuery query, ZoneId zone) {
        Pattern pattern = query.compiledPattern();
        List<AuditEntry> out = new ArrayList<>();
        String sql = SqlLoader.load(query.isFirst() ? "select-oldest" : "select-newest");
        try (PreparedStatement select = conn.prepareStatement(sql)) {
            select.setLong(1, query.sinceMicros(zone));
            select.setLong(2, query.untilMicros(zone));
            try (ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    AuditEntry entry = AuditEntry.builder()
                            .ts(rs.getLong(1))
                            .instanceId(rs.getString(2))
                            .query(rs.getString(3))
                            .outcome(rs.getString(4))
                            .dbUser(rs.getString(5))
                            .sysUser(rs.getString(6))
                            .writemode(rs.getInt(7) != 0)
                            .justification(rs.getString(8))
                            .build();
                    if (pattern != null && !pattern.matcher(entry.getQuery()).find()) {
                        continue;
                    }
                    out.add(entry);
                    if (query.getLimit() > 0 && out.size() >= query.getLimit()) {
                        break;
                    }
                }
            }
        } catch (SQLException e) {
            throw new PersistenceException("Audit query failed: " + e.getMessage(), e);
        }
        if (!query.isFirst()) {
            Collections.reverse(out);
        }
        return out;
    }

    /**
     * Delete the oldest entries while the store file exceeds the cull threshold, then compact once.
     *
     * <p>Deleted pages go to the free list, so the live size ({@code page_count - freelist_count})
     * is known without compacting. Each round deletes the share of entries proportional to the
     * excess over the target, at least one batch.
     *
     * @throws SQLException on store errors
     * @throws IOException on lock or file errors
     */
    void cullIfOversize() throws SQLException, IOException {
        if (storeSize() <= settings.getCullThresholdBytes()) {
            return;
        }
        boolean ran = withMaintenanceLock(ignored -> {
            try {
                long before = storeSize();
                long started = System.nanoTime();
                int deleted = 0;
                try (PreparedStatement cull = conn.prepareStatement(SqlLoader.load("cull"))) {
                    long live = liveBytes();
                    while (live > settings.getCullTargetBytes()) {
                        long rows = entryCount();
                        if (rows == 0) {
                            break;
                        }
                        long excess = live - settings.getCullTargetBytes();
                        long share = (long) Math.ceil((double) rows * excess / live);
                        int batch = (int) Math.min(rows, Math.max(share, settings.getCullBatch()));
                        cull.setInt(1, batch);
                        int removed = cull.executeUpdate();
                        if (removed == 0) {
                            break;
                        }
                        deleted += removed;
                        live = liveBytes();
                    }
                }
                vacuum();
                log.info("Audit store culled: path={}, size_before={}, size_after={}, deleted={}, took_ms={}",
                        path, before, storeSize(), deleted, (System.nanoTime() - started) / 1_000_000);
            } catch (SQLException | IOException e) {
                throw new PersistenceException("Audit cull failed: " + e.getMessage(), e);
            }
        });
        if (!ran) {
            log.info("Audit maintenance lock held by another instance, cull skipped: path={}", path);
        }
    }

    /**
     * Bytes held by pages in use, excluding the free list.
     */
    long liveBytes() throws SQLException {
        try (Statement st = conn.createStatement()) {
            long pageSize = pragma(st, "page_size");
            long pages = pragma(st, "page_count");
            long free = pragma(st, "freelist_count");
            return (pages - free) * pageSize;
        }
    }

    private static long pragma(Statement st, String name) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + name)) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    private long entryCount() throws SQLException {
        try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT count(*) FROM entries")) {
            return rs.next() ? rs.getLong(1) : 0;
        }
    }

    /**
     * Reclaim space from deleted entries.
     *
     * @return true if compaction ran, false if another instance held the maintenance lock
     * @throws IOException on lock errors
     */
    public boolean compact() throws IOException {
        return withMaintenanceLock(ignored -> {
            try {
                vacuum();
            } catch (SQLException e) {
                throw new PersistenceException("Audit compaction failed: " + e.getMessage(), e);
            }
        });
    }

    private void vacuum() throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
            st.execute("VACUUM");
            st.execute("PRAGMA wal_checkpoint(TRUNCATE)");
        }
    }

    private boolean withMaintenanceLock(Consumer<FileLock> action) throws IOException {
        Path lockPath = dir.resolve(LOCK_FILE);
        try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                return false;
            }
            try {
                action.accept(lock);
                return true;
            } finally {
                lock.release();
            }
        }
    }

    long storeSize() throws IOException {
        long size = Files.size(path);
        Path wal = path.resolveSibling(path.getFileName() + "-wal");
        if (Files.exists(wal)) {
            size += Files.size(wal);
        }
        return size;
    }

    public Path getPath() {
        return path;
    }

    /**
     * Find orphaned stores next to the main store.
     *
     * @param dir audit directory
     * @return orphan paths, sorted by name
     */
    public static List<Path> findOrphans(Path dir) {
        List<Path> out = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return out;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, ORPHAN_PREFIX + "*" + DB_SUFFIX)) {
            for (Path p : stream) {
                out.add(p);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot list " + dir + ": " + e.getMessage(), e);
        }
        Collections.sort(out);
        return out;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    /**
     * Compact the store, then close it.
     */
    @Override
    public synchronized void close() {
        try {
            if (!readOnly && !compact()) {
                log.info("Audit maintenance lock held by another instance, compaction skipped: path={}", path);
            }
        } catch (IOException | PersistenceException e) {
            log.warn("Audit compaction failed: path={}, error={}", path, e.getMessage());
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.warn("Closing audit store failed: path={}, error={}", path, e.getMessage());
        }
    }
}
