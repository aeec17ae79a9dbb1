package io.github.yok.flexbackup.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;

/**
 * Utility for rendering backup paths for logs.
 *
 * <p>
 * Paths under the working directory are rendered relative to it; other paths are rendered
 * absolute. Separators are always UNIX style so log lines look the same on every platform.
 * </p>
 */
@Slf4j
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.flexbackup.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a path for logs.
     *
     * @param path file or directory
     * @return path string rendered for logs
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String renderPathForLog(Path path) {
        Preconditions.checkNotNull(path, "path must not be null");

        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = path.toAbsolutePath().normalize();

        String rendered = abs.startsWith(base) && !abs.equals(base)
                ? base.relativize(abs).toString()
                : abs.toString();
        return FilenameUtils.separatorsToUnix(rendered);
    }
}
