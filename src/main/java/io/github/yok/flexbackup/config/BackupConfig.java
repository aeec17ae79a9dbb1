package io.github.yok.flexbackup.config;

import io.github.yok.flexbackup.store.JdbcBackupStore;
import java.time.Duration;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds settings related to backup export runs.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code backup.git-repo}: git working tree whose {@code backup/} subdirectory receives the
 * files; a leading {@code ~/} is expanded to the user home</li>
 * <li>{@code backup.shadow-marker-table}: table whose presence enables shadow merging</li>
 * <li>{@code backup.shadow-marker-table}: table whose presence enables the shadow merge</li>
 * <li>{@code backup.revision-query}: query returning the store's current revision marker</li>
 * <li>{@code backup.events-write-mode}: {@link IncrementalWriteMode} for the events stream</li>
 * <li>{@code backup.zone}: zone applied to temporal values that carry no offset</li>
 * <li>{@code backup.timeout}: maximum run duration; {@code 0} disables the deadline</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "backup")
@Getter
@Setter
@NoArgsConstructor
public class BackupConfig {

    private String gitRepo;

    private String beadsDir = ".beads";

    private String shadowMarkerTable = "wisps";

    private String revisionQuery = JdbcBackupStore.DEFAULT_REVISION_QUERY;

    private IncrementalWriteMode eventsWriteMode = IncrementalWriteMode.APPEND;

    private String zone = "UTC";

    private Duration timeout = Duration.ZERO;
}
