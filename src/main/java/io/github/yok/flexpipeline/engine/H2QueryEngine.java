package io.github.yok.flexpipeline.engine;

import io.github.yok.flexpipeline.config.EngineConfig;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.springframework.stereotype.Component;

/**
 * {@link QueryEngine} backed by an embedded H2 database.
 *
 * <p>
 * With the default URL ({@code jdbc:h2:mem:}) every session gets its own private in-memory
 * database, which is discarded when the session closes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class H2QueryEngine implements QueryEngine {

    private final EngineConfig engineConfig;

    private final DbUnitConfigFactory configFactory;

    @Override
    public QueryEngineSession openSession() throws SQLException {
        try {
            Class.forName(engineConfig.getDriverClass());
        } catch (ClassNotFoundException e) {
            throw new SQLException("JDBC driver not found: " + engineConfig.getDriverClass(), e);
        }
        Connection conn = DriverManager.getConnection(engineConfig.getUrl(),
                engineConfig.getUser(), engineConfig.getPassword());
        log.debug("Query engine session opened: {}", engineConfig.getUrl());
        try {
            return new JdbcQueryEngineSession(conn, configFactory);
        } catch (DatabaseUnitException | RuntimeException e) {
            conn.close();
            throw new SQLException("Failed to initialize query engine session", e);
        }
    }
}
