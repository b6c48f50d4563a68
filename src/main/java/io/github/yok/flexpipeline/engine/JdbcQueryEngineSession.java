package io.github.yok.flexpipeline.engine;

import io.github.yok.flexpipeline.engine.query.Identifiers;
import io.github.yok.flexpipeline.engine.query.ProjectionQuery;
import io.github.yok.flexpipeline.model.DataRecord;
import io.github.yok.flexpipeline.model.FieldRule;
import io.github.yok.flexpipeline.model.FieldSchema;
import io.github.yok.flexpipeline.model.FieldType;
import io.github.yok.flexpipeline.model.ProjectionKind;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.DatabaseUnitException;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * JDBC session of the embedded engine.
 *
 * <p>
 * Base tables are created with DDL derived from the schema and filled with batched
 * {@link PreparedStatement}s. Relations are read back as DBUnit query tables. The DBUnit
 * connection wraps the JDBC connection, so both are released together by {@link #close()}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcQueryEngineSession implements QueryEngineSession {

    private final Connection connection;

    private final IDatabaseConnection dbConn;

    private final int batchSize;

    /**
     * Wraps an open JDBC connection.
     *
     * @param connection JDBC connection owned by this session from now on
     * @param configFactory DBUnit settings
     * @throws DatabaseUnitException if DBUnit cannot wrap the connection
     */
    public JdbcQueryEngineSession(Connection connection, DbUnitConfigFactory configFactory)
            throws DatabaseUnitException {
        this.connection = connection;
        this.dbConn = new DatabaseConnection(connection);
        configFactory.configure(dbConn.getConfig(), new H2DataTypeFactory());
        this.batchSize = Math.max(1, configFactory.getBatchSize());
    }

    @Override
    public void loadTable(String table, FieldSchema schema, List<DataRecord> records)
            throws SQLException {
        String quoted = Identifiers.quote(Identifiers.requirePlain(table, "table"));
        List<String> fields = schema.getFieldNames();

        StringJoiner columns = new StringJoiner(", ", "(", ")");
        StringJoiner names = new StringJoiner(", ", "(", ")");
        StringJoiner params = new StringJoiner(", ", "(", ")");
        for (String field : fields) {
            String column = Identifiers.quote(field);
            columns.add(column + " " + schema.getRule(field).getType().getSqlType());
            names.add(column);
            params.add("?");
        }

        try (Statement st = connection.createStatement()) {
            st.execute("DROP TABLE IF EXISTS " + quoted);
            st.execute("CREATE TABLE " + quoted + " " + columns);
        }
        if (records.isEmpty()) {
            log.debug("Table {} created without rows", table);
            return;
        }

        String insert = "INSERT INTO " + quoted + " " + names + " VALUES " + params;
        int pending = 0;
        try (PreparedStatement ps = connection.prepareStatement(insert)) {
            for (DataRecord record : records) {
                for (int i = 0; i < fields.size(); i++) {
                    bind(ps, i + 1, schema.getRule(fields.get(i)), record.getValue(fields.get(i)));
                }
                ps.addBatch();
                if (++pending >= batchSize) {
                    ps.executeBatch();
                    pending = 0;
                }
            }
            if (pending > 0) {
                ps.executeBatch();
            }
        }
        log.debug("Table {} loaded with {} rows", table, records.size());
    }

    private static void bind(PreparedStatement ps, int index, FieldRule rule, Object value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlTypeOf(rule.getType()));
        } else {
            ps.setObject(index, value);
        }
    }

    private static int sqlTypeOf(FieldType type) {
        switch (type) {
            case INTEGER:
                return Types.BIGINT;
            case FLOAT:
                return Types.DOUBLE;
            case BOOLEAN:
                return Types.BOOLEAN;
            default:
                return Types.VARCHAR;
        }
    }

    @Override
    public void createRelation(String name, ProjectionKind kind, ProjectionQuery query,
            String source, List<String> columns, Map<String, String> aliases)
            throws SQLException {
        String quoted = Identifiers.quote(Identifiers.requirePlain(name, "relation"));
        String select = query.toSql(source, columns, aliases);
        try (Statement st = connection.createStatement()) {
            if (kind == ProjectionKind.VIEW) {
                st.execute("CREATE OR REPLACE VIEW " + quoted + " AS " + select);
            } else {
                st.execute("DROP TABLE IF EXISTS " + quoted);
                st.execute("CREATE TABLE " + quoted + " AS " + select);
            }
        }
        log.debug("Created {} {}: {}", kind.label(), name, select);
    }

    @Override
    public long countRows(String relation) throws SQLException {
        String sql = "SELECT COUNT(*) FROM " + Identifiers.quote(relation);
        try (Statement st = connection.createStatement(); ResultSet rs = st.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    @Override
    public RelationRows fetchAll(String relation) throws SQLException {
        try {
            ITable table = dbConn.createQueryTable(relation,
                    "SELECT * FROM " + Identifiers.quote(relation));
            Column[] cols = table.getTableMetaData().getColumns();
            List<String> columnNames = new ArrayList<>(cols.length);
            for (Column col : cols) {
                columnNames.add(col.getColumnName());
            }
            List<List<Object>> rows = new ArrayList<>(table.getRowCount());
            for (int r = 0; r < table.getRowCount(); r++) {
                List<Object> row = new ArrayList<>(cols.length);
                for (Column col : cols) {
                    row.add(table.getValue(r, col.getColumnName()));
                }
                rows.add(row);
            }
            return new RelationRows(columnNames, rows);
        } catch (DataSetException e) {
            throw new SQLException("Failed to read relation " + relation, e);
        }
    }

    @Override
    public void close() throws SQLException {
        dbConn.close();
        log.debug("Query engine session closed");
    }
}
