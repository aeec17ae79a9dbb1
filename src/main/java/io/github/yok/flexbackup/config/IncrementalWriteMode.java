package io.github.yok.flexbackup.config;

/**
 * Durability tier used when new rows are added to an existing incremental stream file.
 *
 * @author Yasuharu.Okawauchi
 */
public enum IncrementalWriteMode {

    /**
     * Appends the new lines in place. Cost is proportional to the new rows only; a crash during the
     * append can leave a torn last line.
     */
    APPEND,

    /**
     * Reads the existing file, adds the new lines and replaces the file atomically. Cost is
     * proportional to the whole stream history.
     */
    ATOMIC_REWRITE
}
