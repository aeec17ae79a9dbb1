package io.github.yok.flexbackup.core;

import io.github.yok.flexbackup.core.AtomicWriteException.Stage;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes files so that readers only ever observe the previous or the new content.
 *
 * <p>
 * <strong>Procedure:</strong>
 * </p>
 * <ol>
 * <li>Create a uniquely named temporary file next to the target (same file system).</li>
 * <li>Write the whole payload and force it to durable storage.</li>
 * <li>Close the file and atomically rename it onto the target.</li>
 * </ol>
 *
 * <p>
 * Any failure removes the temporary file and raises {@link AtomicWriteException} tagged with the
 * failing {@link Stage}. Nothing is retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AtomicFileWriter {

    static final String TEMP_PREFIX = ".backup-tmp-";

    /**
     * Replaces the content of {@code target} with {@code payload} atomically.
     *
     * @param target destination file
     * @param payload complete new content
     * @throws AtomicWriteException if any step fails; {@code target} is unchanged
     */
    public void write(Path target, byte[] payload) throws AtomicWriteException {
        Path dir = target.toAbsolutePath().getParent();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new AtomicWriteException(Stage.CREATE_DIRECTORY, target, e);
        }

        Path tmp;
        try {
            tmp = Files.createTempFile(dir, TEMP_PREFIX, null);
        } catch (IOException e) {
            throw new AtomicWriteException(Stage.CREATE_TEMP, target, e);
        }

        Stage stage = Stage.WRITE;
        FileChannel channel = null;
        try {
            channel = FileChannel.open(tmp, StandardOpenOption.WRITE);
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            stage = Stage.SYNC;
            channel.force(true);
            stage = Stage.CLOSE;
            channel.close();
            channel = null;
            stage = Stage.RENAME;
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            closeAfterFailure(channel, e);
            deleteAfterFailure(tmp, e);
            throw new AtomicWriteException(stage, target, e);
        }
        log.debug("Wrote {} bytes atomically to {}", payload.length, target);
    }

    /**
     * Appends {@code payload} to {@code target} and forces it to storage. The file is created if it
     * does not exist.
     *
     * <p>
     * This is not rename-atomic: a crash during the call can leave a partially appended tail.
     * </p>
     *
     * @param target destination file
     * @param payload bytes to append
     * @throws IOException if the file cannot be opened, written or synced
     */
    public void append(Path target, byte[] payload) throws IOException {
        try (FileChannel channel = FileChannel.open(target, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        log.debug("Appended {} bytes to {}", payload.length, target);
    }

    private static void closeAfterFailure(FileChannel channel, IOException primary) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }

    private static void deleteAfterFailure(Path tmp, IOException primary) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            primary.addSuppressed(e);
        }
    }
}
