package io.github.yok.flexbackup.core;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Bytes;
import io.github.yok.flexbackup.config.IncrementalWriteMode;
import io.github.yok.flexbackup.model.BackupState;
import io.github.yok.flexbackup.model.IncrementalStreamSpec;
import io.github.yok.flexbackup.store.ExportContext;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Exports an append-only stream incrementally, driven by {@link BackupState#getLastWatermark()}.
 *
 * <p>
 * <strong>Placement policy:</strong>
 * </p>
 * <ul>
 * <li>No new rows: nothing is written and the watermark is left as is.</li>
 * <li>Watermark {@code 0} (first export): the rows are written as a complete file through
 * {@link AtomicFileWriter}.</li>
 * <li>Otherwise: the new lines are added after the existing content according to the configured
 * {@link IncrementalWriteMode}.</li>
 * </ul>
 *
 * <p>
 * After a write the in-memory watermark is advanced to the highest key seen. Persisting it is the
 * caller's job.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IncrementalStreamExporter {

    private final TableExporter tableExporter;

    private final AtomicFileWriter writer;

    private final IncrementalWriteMode writeMode;

    /**
     * Creates an exporter.
     *
     * @param tableExporter row reader and encoder shared with snapshot exports
     * @param writer writer for the output file
     * @param writeMode how new rows are added to an existing file
     */
    public IncrementalStreamExporter(TableExporter tableExporter, AtomicFileWriter writer,
            IncrementalWriteMode writeMode) {
        this.tableExporter = tableExporter;
        this.writer = writer;
        this.writeMode = writeMode;
    }

    /**
     * Exports rows newer than the stored watermark.
     *
     * @param ctx cancellation context
     * @param spec stream description
     * @param includeShadow whether the shadow table exists in this store
     * @param dir backup directory
     * @param state run state; its watermark is advanced in memory
     * @return number of new rows (0 is not an error)
     * @throws SQLException on query or scan failure, or when a key is not an integer
     * @throws IOException on serialization or write failure
     */
    public int export(ExportContext ctx, IncrementalStreamSpec spec, boolean includeShadow,
            Path dir, BackupState state) throws SQLException, IOException {
        long watermark = state.getLastWatermark();
        List<ExportedRow> rows = tableExporter.readRows(ctx, spec.getPrimaryQuery(), watermark);
        if (includeShadow && spec.hasShadow()) {
            List<ExportedRow> shadowRows =
                    tableExporter.readRows(ctx, spec.getShadowQuery(), watermark);
            rows = TableExporter.mergeByKey(rows, shadowRows,
                    ImmutableList.of(spec.getKeyColumn()));
        }
        if (rows.isEmpty()) {
            log.debug("Stream[{}] no rows after watermark {}", spec.getName(), watermark);
            return 0;
        }

        long maxKey = maxKey(rows, spec.getKeyColumn());
        byte[] payload = tableExporter.encodeLines(rows);
        Path file = dir.resolve(spec.getFileName());
        if (watermark == 0) {
            writer.write(file, payload);
            log.debug("Stream[{}] first export: wrote {} rows", spec.getName(), rows.size());
        } else if (writeMode == IncrementalWriteMode.ATOMIC_REWRITE) {
            byte[] existing = Files.exists(file) ? Files.readAllBytes(file) : new byte[0];
            writer.write(file, Bytes.concat(existing, payload));
            log.debug("Stream[{}] rewrote file with {} new rows", spec.getName(), rows.size());
        } else {
            writer.append(file, payload);
            log.debug("Stream[{}] appended {} rows", spec.getName(), rows.size());
        }

        state.setLastWatermark(Math.max(watermark, maxKey));
        return rows.size();
    }

    private static long maxKey(List<ExportedRow> rows, String keyColumn) throws SQLException {
        long max = 0;
        for (ExportedRow row : rows) {
            max = Math.max(max, toLong(row.get(keyColumn), keyColumn));
        }
        return max;
    }

    private static long toLong(Object value, String keyColumn) throws SQLDataException {
        try {
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).longValueExact();
            }
            if (value instanceof BigInteger) {
                return ((BigInteger) value).longValueExact();
            }
            if (value instanceof Long || value instanceof Integer || value instanceof Short
                    || value instanceof Byte) {
                return ((Number) value).longValue();
            }
        } catch (ArithmeticException e) {
            throw new SQLDataException(
                    "key column '" + keyColumn + "' is not a 64-bit integer: " + value, e);
        }
        throw new SQLDataException("key column '" + keyColumn + "' is not an integer: " + value);
    }
}
