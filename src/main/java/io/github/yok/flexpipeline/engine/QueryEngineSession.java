package io.github.yok.flexpipeline.engine;

import io.github.yok.flexpipeline.engine.query.ProjectionQuery;
import io.github.yok.flexpipeline.model.DataRecord;
import io.github.yok.flexpipeline.model.FieldSchema;
import io.github.yok.flexpipeline.model.ProjectionKind;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * One connection to the query engine, scoped to a single run.
 *
 * @author Yasuharu.Okawauchi
 */
public interface QueryEngineSession extends AutoCloseable {

    /**
     * (Re)creates a base table with one column per schema field and inserts the records.
     *
     * @param table table name (plain identifier)
     * @param schema column names and types
     * @param records rows to insert; values are looked up by field name
     * @throws SQLException on any database error
     */
    void loadTable(String table, FieldSchema schema, List<DataRecord> records)
            throws SQLException;

    /**
     * Creates a view or table from a structured query.
     *
     * @param name relation name (plain identifier)
     * @param kind view or table
     * @param query query to materialize
     * @param source relation the query reads from
     * @param columns column list used to expand {@code *}
     * @param aliases source field → output column name
     * @throws SQLException on any database error
     */
    void createRelation(String name, ProjectionKind kind, ProjectionQuery query, String source,
            List<String> columns, Map<String, String> aliases) throws SQLException;

    /**
     * Counts the rows of a relation.
     *
     * @param relation relation name
     * @return row count
     * @throws SQLException on any database error
     */
    long countRows(String relation) throws SQLException;

    /**
     * Reads the full contents of a relation.
     *
     * @param relation relation name
     * @return column names and rows
     * @throws SQLException on any database error
     */
    RelationRows fetchAll(String relation) throws SQLException;

    @Override
    void close() throws SQLException;
}
