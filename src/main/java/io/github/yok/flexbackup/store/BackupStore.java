package io.github.yok.flexbackup.store;

import java.sql.SQLException;

/**
 * Versioned relational store that backups are taken from.
 *
 * <p>
 * The exporter treats the store as opaque: it only runs projection queries, reads a revision
 * marker for change detection, and checks table existence.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface BackupStore {

    /**
     * Runs a query and returns a cursor over its rows.
     *
     * @param ctx cancellation context
     * @param sql statement, using {@code ?} placeholders for {@code args}
     * @param args bind values
     * @return open row set; the caller closes it
     * @throws SQLException when the statement fails
     */
    StoreRowSet query(ExportContext ctx, String sql, Object... args) throws SQLException;

    /**
     * Returns the marker of the store's current state (e.g. a commit hash).
     *
     * @param ctx cancellation context
     * @return revision marker; empty when the store has no data yet
     * @throws SQLException when the marker cannot be read
     */
    String currentRevision(ExportContext ctx) throws SQLException;

    /**
     * Returns whether a table with the given name exists.
     *
     * @param ctx cancellation context
     * @param table table name
     * @return {@code true} if the table exists
     * @throws SQLException when the metadata lookup fails
     */
    boolean tableExists(ExportContext ctx, String table) throws SQLException;
}
