package io.github.yok.flexbackup.store;

import java.sql.SQLException;
import java.util.List;

/**
 * Forward-only cursor over the result of a {@link BackupStore#query} call.
 *
 * <p>
 * The column list is discovered from result metadata when the query runs; callers must not assume
 * a fixed set of columns.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface StoreRowSet extends AutoCloseable {

    /**
     * Returns the column labels in result order.
     *
     * @return column labels
     */
    List<String> getColumns();

    /**
     * Advances to the next row.
     *
     * @return {@code false} when no rows remain
     * @throws SQLException on scan failure
     */
    boolean next() throws SQLException;

    /**
     * Returns the raw value of the given column in the current row.
     *
     * @param index zero-based column index
     * @return driver-level value, possibly {@code null}
     * @throws SQLException on read failure
     */
    Object getValue(int index) throws SQLException;

    @Override
    void close() throws SQLException;
}
