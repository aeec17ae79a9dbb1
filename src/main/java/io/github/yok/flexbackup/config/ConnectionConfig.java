package io.github.yok.flexbackup.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that holds the JDBC connection to the store being backed up, loaded from the
 * {@code connection} section of {@code application.yml}.
 *
 * <pre>
 * connection:
 *   url: jdbc:mysql://127.0.0.1:3307/beads?zeroDateTimeBehavior=CONVERT_TO_NULL
 *   user: root
 *   password:
 *   driverClass: com.mysql.cj.jdbc.Driver
 * </pre>
 *
 * <p>
 * Keep {@code zeroDateTimeBehavior=CONVERT_TO_NULL} on Connector/J URLs so that
 * {@code 0000-00-00} values are exported as {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "connection")
@Data
public class ConnectionConfig {

    // JDBC connection URL (e.g., jdbc:mysql://127.0.0.1:3307/beads)
    private String url;
    // Database user name
    private String user;
    // Database password
    private String password;
    // Fully qualified JDBC driver class name; blank relies on JDBC 4 auto-loading
    private String driverClass;
}
