package io.github.yok.flexbackup.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.sql.SQLException;
import lombok.Getter;

/**
 * Raised when a backup run aborts. The previous state file and snapshot files are left in place.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class BackupExportException extends Exception {

    private static final long serialVersionUID = 1L;

    // Entity being exported when the run failed; null for run-level failures
    private final String entity;

    /**
     * Creates a run-level exception.
     *
     * @param message description
     * @param cause underlying error
     */
    public BackupExportException(String message, Throwable cause) {
        super(message, cause);
        this.entity = null;
    }

    private BackupExportException(String entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }

    /**
     * Creates an exception scoped to one entity, e.g. {@code backup comments: query failed: ...}.
     *
     * @param entity entity name
     * @param cause underlying error
     * @return new exception
     */
    public static BackupExportException forEntity(String entity, Exception cause) {
        String detail;
        if (cause instanceof SQLException) {
            detail = "query failed: " + cause.getMessage();
        } else if (cause instanceof JsonProcessingException) {
            detail = "serialization failed: " + cause.getMessage();
        } else {
            detail = cause.getMessage();
        }
        return new BackupExportException(entity, "backup " + entity + ": " + detail, cause);
    }
}
