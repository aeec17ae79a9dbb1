package io.github.yok.flexbackup.core;

import java.io.IOException;
import java.nio.file.Path;
import lombok.Getter;

/**
 * Raised when {@link AtomicFileWriter} fails. The target path is left untouched and no temporary
 * file remains.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class AtomicWriteException extends IOException {

    private static final long serialVersionUID = 1L;

    /**
     * Step of the write that failed.
     */
    public enum Stage {
        CREATE_DIRECTORY("failed to create directory"),
        CREATE_TEMP("failed to create temp file"),
        WRITE("failed to write temp file"),
        SYNC("failed to sync temp file"),
        CLOSE("failed to close temp file"),
        RENAME("failed to rename temp file");

        private final String description;

        Stage(String description) {
            this.description = description;
        }
    }

    private final Stage stage;

    private final transient Path target;

    /**
     * Creates an exception for the given stage.
     *
     * @param stage failing stage
     * @param target path that was being written
     * @param cause underlying I/O error
     */
    public AtomicWriteException(Stage stage, Path target, IOException cause) {
        super(stage.description + " for " + target + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.target = target;
    }
}
