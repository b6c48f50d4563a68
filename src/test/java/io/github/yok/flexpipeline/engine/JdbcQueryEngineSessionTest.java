package io.github.yok.flexpipeline.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexpipeline.config.DbUnitConfigProperties;
import io.github.yok.flexpipeline.config.EngineConfig;
import io.github.yok.flexpipeline.engine.query.ProjectionExpressionParser;
import io.github.yok.flexpipeline.engine.query.ProjectionQuery;
import io.github.yok.flexpipeline.model.DataRecord;
import io.github.yok.flexpipeline.model.FieldRule;
import io.github.yok.flexpipeline.model.FieldSchema;
import io.github.yok.flexpipeline.model.FieldType;
import io.github.yok.flexpipeline.model.ProjectionKind;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcQueryEngineSessionTest {

    private QueryEngineSession session;

    private final ProjectionExpressionParser parser = new ProjectionExpressionParser();

    @BeforeEach
    void setup() throws Exception {
        DbUnitConfigProperties props = new DbUnitConfigProperties();
        props.setBatchSize(2);
        session = new H2QueryEngine(new EngineConfig(), new DbUnitConfigFactory(props))
                .openSession();
    }

    @AfterEach
    void teardown() throws Exception {
        session.close();
    }

    private static FieldSchema schema() {
        Map<String, FieldRule> rules = new LinkedHashMap<>();
        rules.put("employee_id", new FieldRule(FieldType.INTEGER, true, null, null));
        rules.put("name", new FieldRule(FieldType.STRING, false, null, null));
        rules.put("salary_amount", new FieldRule(FieldType.FLOAT, false, null, null));
        rules.put("has_payroll", new FieldRule(FieldType.BOOLEAN, false, null, null));
        return new FieldSchema(rules);
    }

    private static List<DataRecord> records(int count) {
        List<DataRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            Map<String, Object> values = new HashMap<>();
            values.put("employee_id", (long) i);
            values.put("name", i == 2 ? null : "emp" + i);
            values.put("salary_amount", 1000.0d * i);
            values.put("has_payroll", i % 2 == 0);
            records.add(new DataRecord(i, values));
        }
        return records;
    }

    @Test
    void loadTable_正常ケース_バッチサイズを超える行を投入する_全行が読み戻せること() throws Exception {
        session.loadTable("employees_stage", schema(), records(5));

        assertEquals(5, session.countRows("employees_stage"));
        RelationRows rows = session.fetchAll("employees_stage");
        assertEquals(List.of("employee_id", "name", "salary_amount", "has_payroll"),
                rows.getColumns());
        assertEquals(5, rows.size());
        assertEquals("1", rows.getRows().get(0).get(0).toString());
        assertNull(rows.getRows().get(1).get(1));
        assertEquals(Boolean.TRUE, rows.getRows().get(1).get(3));
    }

    @Test
    void loadTable_正常ケース_同名テーブルを再投入する_前回の内容が置き換わること() throws Exception {
        session.loadTable("employees_stage", schema(), records(3));
        session.loadTable("employees_stage", schema(), records(1));

        assertEquals(1, session.countRows("employees_stage"));
    }

    @Test
    void createRelation_正常ケース_ビューとテーブルを作成する_ビューのみ基底変更に追従すること()
            throws Exception {
        session.loadTable("employees_stage", schema(), records(4));
        ProjectionQuery query =
                parser.parse("SELECT employee_id, name FROM employees WHERE salary_amount > 1500");

        session.createRelation("rich_view", ProjectionKind.VIEW, query, "employees_stage",
                schema().getFieldNames(), Map.of("employee_id", "emp_id"));
        session.createRelation("rich_table", ProjectionKind.TABLE, query, "employees_stage",
                schema().getFieldNames(), Map.of());

        assertEquals(3, session.countRows("rich_view"));
        assertEquals(3, session.countRows("rich_table"));
        assertEquals(List.of("emp_id", "name"), session.fetchAll("rich_view").getColumns());

        session.loadTable("other_stage", schema(), records(1));
        session.createRelation("rich_view", ProjectionKind.VIEW, query, "other_stage",
                schema().getFieldNames(), Map.of());
        assertEquals(0, session.countRows("rich_view"));
        assertEquals(3, session.countRows("rich_table"));
    }

    @Test
    void countRows_異常ケース_存在しないリレーションを指定する_SQLExceptionが送出されること() {
        assertThrows(SQLException.class, () -> session.countRows("missing"));
        assertThrows(SQLException.class, () -> session.fetchAll("missing"));
    }

    @Test
    void loadTable_異常ケース_不正なテーブル名を指定する_IllegalArgumentExceptionが送出されること() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> session.loadTable("x\"; DROP", schema(), records(1)));
        assertTrue(ex.getMessage().contains("table"));
    }
}
