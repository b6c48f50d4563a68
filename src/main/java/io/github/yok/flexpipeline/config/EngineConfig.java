package io.github.yok.flexpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings of the embedded query engine, bound from the {@code engine} section.
 *
 * <pre>
 * engine:
 *   url: jdbc:h2:mem:
 *   user: sa
 *   password: ""
 *   driverClass: org.h2.Driver
 * </pre>
 *
 * <p>
 * The default URL opens a private in-memory H2 database that disappears when its session is
 * closed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "engine")
@Data
public class EngineConfig {

    // JDBC connection URL
    private String url = "jdbc:h2:mem:";

    // Database user name
    private String user = "sa";

    // Database password
    private String password = "";

    // Fully qualified JDBC driver class name
    private String driverClass = "org.h2.Driver";
}
