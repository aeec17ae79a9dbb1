package io.github.yok.flexbackup.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexbackup.config.BackupConfig;
import io.github.yok.flexbackup.config.BackupDirectoryResolver;
import io.github.yok.flexbackup.model.BackupState;
import io.github.yok.flexbackup.model.EntityExportSpec;
import io.github.yok.flexbackup.model.IncrementalStreamSpec;
import io.github.yok.flexbackup.store.BackupStore;
import io.github.yok.flexbackup.store.ExportContext;
import io.github.yok.flexbackup.util.LogPathUtil;
import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Core class that backs up every entity of the store into the backup directory in one run.
 *
 * <p>
 * <strong>Run sequence:</strong>
 * </p>
 * <ol>
 * <li>Resolve the backup directory and load {@code backup_state.json}.</li>
 * <li>Unless forced, stop when the store revision equals the recorded one (nothing is
 * written).</li>
 * <li>Check once whether the shadow table exists; the answer applies to every entity.</li>
 * <li>Export each full-snapshot entity (counts are overwritten).</li>
 * <li>Export the incremental stream (its count accumulates).</li>
 * <li>Re-read the store revision, stamp the time and save the state.</li>
 * </ol>
 *
 * <p>
 * Any failure aborts the run before the state is saved, so the next run starts again from the
 * last completed revision and watermark. The revision can advance between steps 2 and 6 when the
 * store is written concurrently; the next run then simply detects the remaining change.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BackupExporter {

    private final BackupStore store;

    private final BackupDirectoryResolver directoryResolver;

    private final BackupStateStore stateStore;

    private final TableExporter tableExporter;

    private final IncrementalStreamExporter streamExporter;

    private final List<EntityExportSpec> snapshotEntities;

    private final IncrementalStreamSpec stream;

    private final String shadowMarkerTable;

    private final Clock clock;

    /**
     * Creates an exporter from explicit collaborators.
     *
     * @param store store to back up
     * @param directoryResolver backup directory resolver
     * @param stateStore state file access
     * @param tableExporter full-snapshot exporter
     * @param streamExporter incremental stream exporter
     * @param snapshotEntities full-snapshot entities in export order
     * @param stream incremental stream
     * @param shadowMarkerTable table whose existence enables shadow merging
     * @param clock clock for the state timestamp
     */
    public BackupExporter(BackupStore store, BackupDirectoryResolver directoryResolver,
            BackupStateStore stateStore, TableExporter tableExporter,
            IncrementalStreamExporter streamExporter, List<EntityExportSpec> snapshotEntities,
            IncrementalStreamSpec stream, String shadowMarkerTable, Clock clock) {
        this.store = store;
        this.directoryResolver = directoryResolver;
        this.stateStore = stateStore;
        this.tableExporter = tableExporter;
        this.streamExporter = streamExporter;
        this.snapshotEntities = ImmutableList.copyOf(snapshotEntities);
        this.stream = stream;
        this.shadowMarkerTable = shadowMarkerTable;
        this.clock = clock;
    }

    /**
     * Creates an exporter for the standard entity catalog.
     *
     * @param store store to back up
     * @param backupConfig backup settings
     * @return exporter
     */
    public static BackupExporter create(BackupStore store, BackupConfig backupConfig) {
        AtomicFileWriter writer = new AtomicFileWriter();
        RowNormalizer normalizer = new RowNormalizer(ZoneId.of(backupConfig.getZone()));
        TableExporter tableExporter = new TableExporter(store, normalizer, writer);
        IncrementalStreamExporter streamExporter = new IncrementalStreamExporter(tableExporter,
                writer, backupConfig.getEventsWriteMode());
        return new BackupExporter(store, new BackupDirectoryResolver(backupConfig),
                new BackupStateStore(writer, BackupCatalog.ENTITY_NAMES), tableExporter,
                streamExporter, BackupCatalog.SNAPSHOT_ENTITIES, BackupCatalog.EVENT_STREAM,
                backupConfig.getShadowMarkerTable(), Clock.systemUTC());
    }

    /**
     * Runs one backup.
     *
     * @param ctx cancellation context threaded through every store call
     * @param force skip change detection and export even if the revision is unchanged
     * @return resulting state; the loaded state unchanged when the run short-circuited
     * @throws BackupExportException if any step fails; the state file is not modified
     */
    public BackupState run(ExportContext ctx, boolean force) throws BackupExportException {
        Path dir;
        try {
            dir = directoryResolver.resolve();
        } catch (IOException e) {
            throw new BackupExportException("failed to create backup directory: " + e.getMessage(),
                    e);
        }
        log.info("Backup started: dir={}, force={}", LogPathUtil.renderPathForLog(dir), force);

        BackupState loaded;
        try {
            loaded = stateStore.load(dir);
        } catch (IOException e) {
            throw new BackupExportException(e.getMessage(), e);
        }

        if (!force) {
            String current = currentRevision(ctx, "failed to get current commit");
            if (!loaded.isNeverExported() && current.equals(loaded.getLastRevision())) {
                log.info("backup: no changes since last backup (commit {})", abbreviate(current));
                return loaded;
            }
        }

        boolean hasShadow = detectShadowTable(ctx);
        BackupState state = loaded.copy();
        Map<String, Long> summary = new LinkedHashMap<>();

        for (EntityExportSpec spec : snapshotEntities) {
            int rows;
            try {
                rows = tableExporter.exportEntity(ctx, spec, hasShadow, dir);
            } catch (SQLException | IOException e) {
                throw BackupExportException.forEntity(spec.getName(), e);
            }
            state.putCount(spec.getName(), rows);
            summary.put(spec.getName(), (long) rows);
            log.info("Entity[{}] snapshot exported: rows={}", spec.getName(), rows);
        }

        int added;
        try {
            added = streamExporter.export(ctx, stream, hasShadow, dir, state);
        } catch (SQLException | IOException e) {
            throw BackupExportException.forEntity(stream.getName(), e);
        }
        state.addCount(stream.getName(), added);
        summary.put(stream.getName(), (long) added);
        log.info("Stream[{}] exported: new-rows={}, watermark={}", stream.getName(), added,
                state.getLastWatermark());

        state.setLastRevision(currentRevision(ctx, "failed to get current commit for state"));
        state.setTimestamp(clock.instant());

        try {
            stateStore.save(dir, state);
        } catch (IOException e) {
            throw new BackupExportException("failed to save backup state: " + e.getMessage(), e);
        }
        logSummary(summary, state);
        return state;
    }

    private String currentRevision(ExportContext ctx, String failureMessage)
            throws BackupExportException {
        try {
            return StringUtils.defaultString(store.currentRevision(ctx));
        } catch (SQLException e) {
            throw new BackupExportException(failureMessage + ": " + e.getMessage(), e);
        }
    }

    private boolean detectShadowTable(ExportContext ctx) {
        if (StringUtils.isBlank(shadowMarkerTable)) {
            return false;
        }
        try {
            boolean exists = store.tableExists(ctx, shadowMarkerTable);
            log.debug("Shadow table [{}] exists: {}", shadowMarkerTable, exists);
            return exists;
        } catch (SQLException e) {
            log.warn("Shadow table check for [{}] failed, exporting primary tables only: {}",
                    shadowMarkerTable, e.getMessage());
            return false;
        }
    }

    private void logSummary(Map<String, Long> summary, BackupState state) {
        log.info("===== Summary =====");
        log.info("Commit[{}] Watermark[{}]:", abbreviate(state.getLastRevision()),
                state.getLastWatermark());

        int maxNameLen = summary.keySet().stream().mapToInt(String::length).max().orElse(0);
        int maxCountDigits = summary.values().stream().map(count -> String.valueOf(count).length())
                .mapToInt(Integer::intValue).max().orElse(0);

        // Example: "  Entity[issues      ] Exported=  42 Total=  42"
        String fmt = "  Entity[%-" + maxNameLen + "s] Exported=%" + maxCountDigits + "d Total=%d";
        summary.forEach((name, rows) -> log.info(String.format(fmt, name, rows,
                state.getCount(name))));
    }

    static String abbreviate(String revision) {
        return StringUtils.left(revision, 8);
    }
}
