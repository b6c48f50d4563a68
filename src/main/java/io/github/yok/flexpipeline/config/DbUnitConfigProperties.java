package io.github.yok.flexpipeline.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Holds properties applied to DBUnit's {@code DatabaseConfig} and to batched loads into the query
 * engine.
 *
 * <ul>
 * <li>{@code dbunit.config.batch-size}: number of rows per JDBC batch</li>
 * <li>{@code dbunit.config.fetch-size}: JDBC fetch size used when reading projections back</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "dbunit.config")
@Getter
@Setter
@NoArgsConstructor
public class DbUnitConfigProperties {

    /**
     * Specifies the number of rows to insert per batch.
     */
    private int batchSize = 100;

    /**
     * Specifies the JDBC fetch size for query tables.
     */
    private int fetchSize = 100;
}
