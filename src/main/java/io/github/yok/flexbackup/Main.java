package io.github.yok.flexbackup;

import io.github.yok.flexbackup.config.BackupConfig;
import io.github.yok.flexbackup.config.ConnectionConfig;
import io.github.yok.flexbackup.core.BackupExporter;
import io.github.yok.flexbackup.model.BackupState;
import io.github.yok.flexbackup.store.ExportContext;
import io.github.yok.flexbackup.store.JdbcBackupStore;
import io.github.yok.flexbackup.util.ErrorHandler;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line option {@code --force}/{@code -f}, opens the JDBC connection configured
 * in {@code application.yml} and invokes {@link BackupExporter}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --force} or {@code -f} exports even when the store revision has not changed since
 * the last backup.</li>
 * </ul>
 *
 * <p>
 * Spring Boot binds {@link BackupConfig} and {@link ConnectionConfig} and passes them in through
 * the constructor. The process exits with {@link ErrorHandler#EXIT_FAILURE} when the backup fails
 * and with {@code 0} otherwise.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see BackupConfig
 * @see ConnectionConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({BackupConfig.class, ConnectionConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final BackupConfig backupConfig;
    private final ConnectionConfig connectionConfig;

    // Exit status of the last run; reported to SpringApplication.exit
    private int exitCode;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        int status = SpringApplication.exit(app.run(args));
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));
        exitCode = 0;

        boolean force = false;
        for (String arg : args) {
            switch (arg) {
                case "--force":
                case "-f":
                    force = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", arg);
            }
        }

        if (StringUtils.isBlank(connectionConfig.getUrl())) {
            exitCode = ErrorHandler.errorAndExit("connection.url is not configured. "
                    + "Please set 'connection.url' in application.yml.");
            return;
        }

        ExportContext ctx = ExportContext.withTimeout(backupConfig.getTimeout());
        try (Connection conn = openConnection()) {
            log.info("Starting backup export. Force [{}]", force);
            JdbcBackupStore store = new JdbcBackupStore(conn, backupConfig.getRevisionQuery());
            BackupExporter exporter = BackupExporter.create(store, backupConfig);
            BackupState state = exporter.run(ctx, force);
            log.info("Backup export completed. Commit [{}], Watermark [{}]",
                    StringUtils.left(state.getLastRevision(), 8), state.getLastWatermark());
        } catch (Exception e) {
            log.error("Fatal error occurred during backup: {}", e.getMessage(), e);
            exitCode = ErrorHandler.errorAndExit("Backup failed: " + e.getMessage(), e);
        }
    }

    /**
     * Returns the exit status of the last {@link #run(String...)}.
     *
     * @return {@code 0} on success, {@link ErrorHandler#EXIT_FAILURE} on failure
     */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    private Connection openConnection() throws ClassNotFoundException, SQLException {
        // Blank driver class relies on JDBC 4 auto-loading
        if (StringUtils.isNotBlank(connectionConfig.getDriverClass())) {
            Class.forName(connectionConfig.getDriverClass());
        }
        return DriverManager.getConnection(connectionConfig.getUrl(), connectionConfig.getUser(),
                connectionConfig.getPassword());
    }
}
