package io.github.yok.flexpipeline.engine;

import java.sql.SQLException;

/**
 * Factory of isolated query engine sessions.
 *
 * <p>
 * Each run opens exactly one session; relations created in it are invisible to other sessions and
 * disappear when it is closed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface QueryEngine {

    /**
     * Opens a new session.
     *
     * @return open session; the caller must close it
     * @throws SQLException if the engine cannot be reached
     */
    QueryEngineSession openSession() throws SQLException;
}
