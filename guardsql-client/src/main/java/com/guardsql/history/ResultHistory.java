package com.guardsql.history;

import com.guardsql.api.ExecuteResponse;
import com.guardsql.config.GuardsqlProperties;
import com.guardsql.error.InputException;
import com.guardsql.render.ResultTable;
import com.guardsql.render.TableWriter;
import com.guardsql.util.Formats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Memory-bounded history of query results, oldest first.
 *
 * <p>Pushing evicts from the oldest end until the new entry fits, then always appends the new
 * entry, so a single result larger than the budget is still kept until the next push.
 */
@Slf4j
@Component
public class ResultHistory {
    static final int DEFAULT_LIST_LIMIT = 20;
    static final int QUERY_PREVIEW_CHARS = 50;
    private static final DateTimeFormatter WHEN =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final Deque<StoredResult> results = new ArrayDeque<>();
    private final long maxSize;
    private long totalSize;

    @Autowired
    public ResultHistory(GuardsqlProperties properties) {
        this(properties.getHistory().getMaxBytes());
    }

    public ResultHistory(long maxSize) {
        this.maxSize = maxSize;
    }

    public synchronized void push(StoredResult result) {
        while (totalSize + result.getEstimatedSize() > maxSize && !results.isEmpty()) {
            StoredResult removed = results.pollFirst();
            totalSize -= removed.getEstimatedSize();
            log.debug("Result evicted: size={}, query={}", removed.getEstimatedSize(), preview(removed.getQuery()));
        }
        totalSize += result.getEstimatedSize();
        results.addLast(result);
    }

    /**
     * Look up an entry by index, oldest first.
     *
     * @param index 0-based index
     * @return entry
     */
    public synchronized Optional<StoredResult> get(int index) {
        if (index < 0 || index >= results.size()) {
            return Optional.empty();
        }
        return Optional.of(new ArrayList<>(results).get(index));
    }

    public synchronized Optional<StoredResult> last() {
        return Optional.ofNullable(results.peekLast());
    }

    /**
     * Resolve the entry {@code \re show} refers to.
     *
     * @param index index, or null for the most recent
     * @return entry
     */
    public StoredResult resolve(Integer index) {
        if (index == null) {
            return last().orElseThrow(() -> new InputException("No results in history yet"));
        }
        return get(index).orElseThrow(() -> new InputException("No result with index " + index
                + " (history holds " + size() + ")"));
    }

    public synchronized int size() {
        return results.size();
    }

    public synchronized boolean isEmpty() {
        return results.isEmpty();
    }

    public synchronized long totalSize() {
        return totalSize;
    }

    public long maxSize() {
        return maxSize;
    }

    /**
     * Render the {@code \re list} listing.
     *
     * @param limit number of most recent entries, null for the default
     * @param detail include column names and a query preview
     * @return listing text
     */
    public synchronized String list(Integer limit, boolean detail) {
        if (results.isEmpty()) {
            return "Nothing yet\n";
        }
        int n = limit != null ? limit : DEFAULT_LIST_LIMIT;
        List<StoredResult> all = new ArrayList<>(results);
        int start = Math.max(0, all.size() - n);

        List<String> header = detail
                ? Arrays.asList("N", "When", "Took", "Size", "Rows", "Columns", "Query")
                : Arrays.asList("N", "When", "Took", "Size", "Rows", "Cols");
        List<ExecuteResponse.ColumnDefinition> columns = new ArrayList<>();
        for (String name : header) {
            ExecuteResponse.ColumnDefinition col = new ExecuteResponse.ColumnDefinition();
            col.setName(name);
            columns.add(col);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = start; i < all.size(); i++) {
            StoredResult r = all.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("N", String.valueOf(i));
            row.put("When", WHEN.format(r.getTimestamp()));
            row.put("Took", Formats.duration(r.getDuration()));
            row.put("Size", Formats.size(r.getEstimatedSize()));
            row.put("Rows", String.valueOf(r.getRows().size()));
            if (detail) {
                row.put("Columns", String.join(", ", r.toTable().columnNames()));
                row.put("Query", preview(r.getQuery()));
            } else {
                row.put("Cols", String.valueOf(r.getColumns().size()));
            }
            rows.add(row);
        }

        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        try {
            new TableWriter().write(new ResultTable(columns, rows), buf);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Past query results (").append(all.size() - start).append(" of ").append(all.size()).append("):\n\n");
        sb.append(buf.toString(StandardCharsets.UTF_8));
        sb.append("\nTotal memory used: ").append(Formats.size(totalSize)).append('\n');
        sb.append("Memory limit: ").append(Formats.size(maxSize)).append('\n');
        return sb.toString();
    }

    static String preview(String query) {
        String oneLine = query == null ? "" : query.replaceAll("\\s+", " ").trim();
        return oneLine.length() > QUERY_PREVIEW_CHARS ? oneLine.substring(0, QUERY_PREVIEW_CHARS) + "..." : oneLine;
    }
}
