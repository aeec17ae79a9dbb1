package io.github.yok.flexbackup.store;

import com.google.common.collect.ImmutableList;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import lombok.Getter;
import lombok.Setter;

/**
 * In-memory {@link BackupStore} for tests. Results are registered per SQL text.
 */
public class FakeBackupStore implements BackupStore {

    private final Map<String, Result> results = new HashMap<>();

    private final Map<String, SQLException> failures = new HashMap<>();

    private final Set<String> tables = new HashSet<>();

    @Getter
    private final List<String> executed = new ArrayList<>();

    @Setter
    private String revision = "";

    @Setter
    private SQLException revisionFailure;

    @Setter
    private SQLException tableExistsFailure;

    /**
     * Registers fixed rows for a query.
     */
    public FakeBackupStore rows(String sql, List<String> columns, List<List<Object>> rows) {
        return rows(sql, columns, args -> rows);
    }

    /**
     * Registers rows computed from the bind arguments.
     */
    public FakeBackupStore rows(String sql, List<String> columns,
            Function<Object[], List<List<Object>>> rows) {
        results.put(sql, new Result(ImmutableList.copyOf(columns), rows));
        failures.remove(sql);
        return this;
    }

    /**
     * Makes a query fail.
     */
    public FakeBackupStore fail(String sql, SQLException error) {
        failures.put(sql, error);
        return this;
    }

    /**
     * Marks a table as existing for {@link #tableExists}.
     */
    public FakeBackupStore table(String name) {
        tables.add(name);
        return this;
    }

    @Override
    public StoreRowSet query(ExportContext ctx, String sql, Object... args) throws SQLException {
        ctx.checkCancelled();
        executed.add(sql);
        SQLException failure = failures.get(sql);
        if (failure != null) {
            throw failure;
        }
        Result result = results.get(sql);
        if (result == null) {
            throw new SQLException("unexpected query: " + sql);
        }
        Object[] bound = Arrays.copyOf(args, args.length);
        return new FakeRowSet(result.columns, result.rows.apply(bound).iterator());
    }

    @Override
    public String currentRevision(ExportContext ctx) throws SQLException {
        ctx.checkCancelled();
        if (revisionFailure != null) {
            throw revisionFailure;
        }
        return revision;
    }

    @Override
    public boolean tableExists(ExportContext ctx, String table) throws SQLException {
        if (tableExistsFailure != null) {
            throw tableExistsFailure;
        }
        return tables.contains(table);
    }

    private static final class Result {
        private final List<String> columns;
        private final Function<Object[], List<List<Object>>> rows;

        private Result(List<String> columns, Function<Object[], List<List<Object>>> rows) {
            this.columns = columns;
            this.rows = rows;
        }
    }

    private static final class FakeRowSet implements StoreRowSet {
        private final List<String> columns;
        private final Iterator<List<Object>> iterator;
        private List<Object> current;

        private FakeRowSet(List<String> columns, Iterator<List<Object>> iterator) {
            this.columns = columns;
            this.iterator = iterator;
        }

        @Override
        public List<String> getColumns() {
            return columns;
        }

        @Override
        public boolean next() {
            if (!iterator.hasNext()) {
                current = null;
                return false;
            }
            current = iterator.next();
            return true;
        }

        @Override
        public Object getValue(int index) throws SQLException {
            if (current == null) {
                throw new SQLException("no current row");
            }
            return current.get(index);
        }

        @Override
        public void close() {
            current = null;
        }
    }
}
