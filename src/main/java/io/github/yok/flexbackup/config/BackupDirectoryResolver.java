package io.github.yok.flexbackup.config;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Resolves (and creates) the directory that receives the backup files.
 *
 * <p>
 * When {@code backup.git-repo} points at a git working tree, the files go to its {@code backup/}
 * subdirectory so they can be committed alongside other data. Otherwise the resolver falls back to
 * {@code <backup.beads-dir>/backup}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class BackupDirectoryResolver {

    static final String BACKUP_DIR_NAME = "backup";

    private final BackupConfig backupConfig;

    private final Path userHome;

    /**
     * Creates a resolver that expands {@code ~/} against the {@code user.home} system property.
     *
     * @param backupConfig backup settings
     */
    public BackupDirectoryResolver(BackupConfig backupConfig) {
        this(backupConfig, Paths.get(System.getProperty("user.home")));
    }

    BackupDirectoryResolver(BackupConfig backupConfig, Path userHome) {
        this.backupConfig = backupConfig;
        this.userHome = userHome;
    }

    /**
     * Returns the backup directory, creating it if needed.
     *
     * @return backup directory
     * @throws IOException if the directory cannot be created
     */
    public Path resolve() throws IOException {
        String gitRepo = backupConfig.getGitRepo();
        if (StringUtils.isNotBlank(gitRepo)) {
            Path repo = expandHome(gitRepo.trim());
            if (Files.exists(repo.resolve(".git"))) {
                return createDirectory(repo.resolve(BACKUP_DIR_NAME));
            }
            log.debug("backup: git-repo {} is not a git repo, falling back to {}", repo,
                    backupConfig.getBeadsDir());
        }
        String beadsDir = StringUtils.defaultIfBlank(backupConfig.getBeadsDir(), ".beads");
        return createDirectory(Paths.get(beadsDir).resolve(BACKUP_DIR_NAME));
    }

    private Path expandHome(String path) {
        if (path.startsWith("~/")) {
            return userHome.resolve(path.substring(2));
        }
        return Paths.get(path);
    }

    private static Path createDirectory(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            return dir;
        }
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.createDirectories(dir, PosixFilePermissions
                    .asFileAttribute(PosixFilePermissions.fromString("rwx------")));
        } else {
            Files.createDirectories(dir);
        }
        log.debug("Created backup directory: {}", dir);
        return dir;
    }
}
