package io.github.yok.flexbackup.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.yok.flexbackup.model.EntityExportSpec;
import io.github.yok.flexbackup.store.BackupStore;
import io.github.yok.flexbackup.store.ExportContext;
import io.github.yok.flexbackup.store.StoreRowSet;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports query results as JSON Lines snapshot files.
 *
 * <p>
 * The column set is discovered from each result; every row becomes one compact JSON object
 * followed by {@code \n}. The whole file is built in memory and only then handed to
 * {@link AtomicFileWriter}, so a failed scan or serialization never touches the previous file.
 * </p>
 *
 * <p>
 * When an entity has a shadow table, the primary and shadow rows are merged by the entity's key
 * columns. Rows of one table keep the order the store returned them in; rows with equal keys keep
 * primary-then-shadow order, so the output is deterministic.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TableExporter {

    private final BackupStore store;

    private final RowNormalizer normalizer;

    private final AtomicFileWriter writer;

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Creates an exporter.
     *
     * @param store store to read from
     * @param normalizer column value normalizer
     * @param writer atomic writer used for output files
     */
    public TableExporter(BackupStore store, RowNormalizer normalizer, AtomicFileWriter writer) {
        this.store = store;
        this.normalizer = normalizer;
        this.writer = writer;
    }

    /**
     * Runs {@code query} and replaces {@code outputPath} with one JSON line per row.
     *
     * @param ctx cancellation context
     * @param query projection query; any column list, including {@code SELECT *}
     * @param outputPath destination file
     * @return number of rows written (0 still produces an empty file)
     * @throws SQLException on query or scan failure
     * @throws IOException on serialization or write failure
     */
    public int exportTable(ExportContext ctx, String query, Path outputPath)
            throws SQLException, IOException {
        List<ExportedRow> rows = readRows(ctx, query);
        writer.write(outputPath, encodeLines(rows));
        log.debug("Exported {} rows to {}", rows.size(), outputPath);
        return rows.size();
    }

    /**
     * Exports one entity to {@code dir/<fileName>}, merging its shadow rows when requested.
     *
     * @param ctx cancellation context
     * @param spec entity description
     * @param includeShadow whether the shadow table exists in this store
     * @param dir backup directory
     * @return number of rows written
     * @throws SQLException on query or scan failure
     * @throws IOException on serialization or write failure
     */
    public int exportEntity(ExportContext ctx, EntityExportSpec spec, boolean includeShadow,
            Path dir) throws SQLException, IOException {
        Path outputPath = dir.resolve(spec.getFileName());
        if (!includeShadow || !spec.hasShadow()) {
            return exportTable(ctx, spec.getPrimaryQuery(), outputPath);
        }
        List<ExportedRow> rows = readRows(ctx, spec.getPrimaryQuery());
        List<ExportedRow> shadowRows = readRows(ctx, spec.getShadowQuery());
        log.debug("Entity[{}] merging {} primary and {} shadow rows by {}", spec.getName(),
                rows.size(), shadowRows.size(), spec.getOrderKeys());
        rows = mergeByKey(rows, shadowRows, spec.getOrderKeys());
        writer.write(outputPath, encodeLines(rows));
        return rows.size();
    }

    /**
     * Runs a query and normalizes every row.
     *
     * @param ctx cancellation context
     * @param sql statement
     * @param args bind values
     * @return rows in result order
     * @throws SQLException on query or scan failure
     */
    List<ExportedRow> readRows(ExportContext ctx, String sql, Object... args)
            throws SQLException {
        try (StoreRowSet rowSet = store.query(ctx, sql, args)) {
            List<String> columns = rowSet.getColumns();
            List<ExportedRow> rows = new ArrayList<>();
            while (rowSet.next()) {
                Map<String, Object> values = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    values.put(columns.get(i), normalizer.normalize(rowSet.getValue(i)));
                }
                rows.add(new ExportedRow(values));
            }
            return rows;
        }
    }

    /**
     * Serializes rows as newline-terminated compact JSON objects (UTF-8).
     *
     * @param rows rows to encode
     * @return JSON Lines payload
     * @throws JsonProcessingException if a value cannot be serialized
     */
    byte[] encodeLines(List<ExportedRow> rows) throws JsonProcessingException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (ExportedRow row : rows) {
            out.writeBytes(mapper.writeValueAsBytes(row));
            out.write('\n');
        }
        return out.toByteArray();
    }

    /**
     * Interleaves primary and shadow rows by key. Both inputs are expected in key order, as
     * returned by their {@code ORDER BY} queries. Each keeps its own order, so the store's
     * collation decides the order within one table and the key comparison only decides where
     * shadow rows are inserted. Equal keys keep primary-then-shadow order.
     *
     * @param primary rows of the live table
     * @param shadow rows of the shadow table
     * @param keys key columns in priority order
     * @return merged rows
     */
    static List<ExportedRow> mergeByKey(List<ExportedRow> primary, List<ExportedRow> shadow,
            List<String> keys) {
        if (shadow.isEmpty()) {
            return primary;
        }
        RowKeyComparator comparator = new RowKeyComparator(keys);
        List<ExportedRow> merged = new ArrayList<>(primary.size() + shadow.size());
        int p = 0;
        int s = 0;
        while (p < primary.size() && s < shadow.size()) {
            if (comparator.compare(primary.get(p), shadow.get(s)) <= 0) {
                merged.add(primary.get(p++));
            } else {
                merged.add(shadow.get(s++));
            }
        }
        merged.addAll(primary.subList(p, primary.size()));
        merged.addAll(shadow.subList(s, shadow.size()));
        return merged;
    }
}
