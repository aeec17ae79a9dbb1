package io.github.yok.flexbackup.store;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link BackupStore} backed by a single JDBC {@link Connection} to a MySQL-protocol store.
 *
 * <p>
 * LOB values are materialized while scanning ({@link Clob} as {@link String}, {@link Blob} as
 * {@code byte[]}) so that rows stay readable after the cursor moves on. MySQL zero dates
 * ({@code 0000-00-00}) are read as {@code null} even when the driver is configured to reject
 * them. Each statement is registered with the {@link ExportContext}; cancelling the context
 * cancels the statement.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcBackupStore implements BackupStore {

    /**
     * Revision query for Dolt, which exposes the HEAD commit hash.
     */
    public static final String DEFAULT_REVISION_QUERY = "SELECT DOLT_HASHOF('HEAD')";

    static final String ZERO_DATE_PREFIX = "0000-00-00";

    static final String TABLE_EXISTS_QUERY =
            "SELECT TABLE_NAME FROM information_schema.tables WHERE TABLE_NAME = ?";

    private final Connection connection;

    private final String revisionQuery;

    /**
     * Creates a store over an open connection. The connection is owned by the caller.
     *
     * @param connection JDBC connection
     * @param revisionQuery single-value query returning the current revision marker
     */
    public JdbcBackupStore(Connection connection, String revisionQuery) {
        this.connection = Preconditions.checkNotNull(connection, "connection must not be null");
        this.revisionQuery =
                StringUtils.defaultIfBlank(revisionQuery, DEFAULT_REVISION_QUERY);
    }

    @Override
    public StoreRowSet query(ExportContext ctx, String sql, Object... args) throws SQLException {
        ctx.checkCancelled();
        log.debug("Executing query: {}", sql);
        PreparedStatement ps = connection.prepareStatement(sql);
        ExportContext.Registration registration = ctx.onCancel(() -> cancelQuietly(ps));
        try {
            for (int i = 0; i < args.length; i++) {
                ps.setObject(i + 1, args[i]);
            }
            Optional<Duration> remaining = ctx.remaining();
            if (remaining.isPresent()) {
                long seconds = Math.max(1L, remaining.get().toSeconds());
                ps.setQueryTimeout((int) Math.min(Integer.MAX_VALUE, seconds));
            }
            ResultSet rs = ps.executeQuery();
            return new JdbcRowSet(ctx, ps, rs, registration);
        } catch (SQLException | RuntimeException e) {
            registration.close();
            closeAfterFailure(ps, e);
            throw e;
        }
    }

    @Override
    public String currentRevision(ExportContext ctx) throws SQLException {
        try (StoreRowSet rows = query(ctx, revisionQuery)) {
            if (!rows.next()) {
                return "";
            }
            Object value = rows.getValue(0);
            if (value instanceof byte[]) {
                return new String((byte[]) value, StandardCharsets.UTF_8);
            }
            return value == null ? "" : value.toString();
        }
    }

    @Override
    public boolean tableExists(ExportContext ctx, String table) throws SQLException {
        try (StoreRowSet rows = query(ctx, TABLE_EXISTS_QUERY, table)) {
            return rows.next();
        }
    }

    private static void cancelQuietly(PreparedStatement ps) {
        try {
            ps.cancel();
        } catch (SQLException e) {
            log.warn("Failed to cancel running statement: {}", e.getMessage());
        }
    }

    private static void closeAfterFailure(PreparedStatement ps, Exception primary) {
        try {
            ps.close();
        } catch (SQLException e) {
            primary.addSuppressed(e);
        }
    }

    /**
     * Row set over a live {@link ResultSet}.
     */
    static final class JdbcRowSet implements StoreRowSet {

        private final ExportContext ctx;
        private final PreparedStatement statement;
        private final ResultSet resultSet;
        private final ExportContext.Registration registration;
        private final List<String> columns;

        JdbcRowSet(ExportContext ctx, PreparedStatement statement, ResultSet resultSet,
                ExportContext.Registration registration) throws SQLException {
            this.ctx = ctx;
            this.statement = statement;
            this.resultSet = resultSet;
            this.registration = registration;
            ResultSetMetaData md = resultSet.getMetaData();
            ImmutableList.Builder<String> labels = ImmutableList.builder();
            for (int i = 1; i <= md.getColumnCount(); i++) {
                labels.add(md.getColumnLabel(i));
            }
            this.columns = labels.build();
        }

        @Override
        public List<String> getColumns() {
            return columns;
        }

        @Override
        public boolean next() throws SQLException {
            ctx.checkCancelled();
            return resultSet.next();
        }

        @Override
        public Object getValue(int index) throws SQLException {
            Object value;
            try {
                value = resultSet.getObject(index + 1);
            } catch (SQLException e) {
                if (isZeroDate(index, e)) {
                    return null;
                }
                throw e;
            }
            if (value instanceof Clob) {
                Clob clob = (Clob) value;
                try (Reader reader = clob.getCharacterStream()) {
                    return IOUtils.toString(reader);
                } catch (IOException e) {
                    throw new SQLException("Failed to read CLOB column " + columns.get(index), e);
                } finally {
                    clob.free();
                }
            }
            if (value instanceof Blob) {
                Blob blob = (Blob) value;
                try {
                    return blob.getBytes(1, (int) blob.length());
                } finally {
                    blob.free();
                }
            }
            return value;
        }

        // Connector/J refuses zero dates unless zeroDateTimeBehavior=CONVERT_TO_NULL is set
        private boolean isZeroDate(int index, SQLException failure) {
            try {
                return StringUtils.startsWith(resultSet.getString(index + 1), ZERO_DATE_PREFIX);
            } catch (SQLException e) {
                failure.addSuppressed(e);
                return false;
            }
        }

        @Override
        public void close() throws SQLException {
            registration.close();
            try {
                resultSet.close();
            } finally {
                statement.close();
            }
        }
    }
}
