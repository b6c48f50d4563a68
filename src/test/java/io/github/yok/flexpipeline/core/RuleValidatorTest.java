package io.github.yok.flexpipeline.core;

import static io.github.yok.flexpipeline.core.TestRecords.dataset;
import static io.github.yok.flexpipeline.core.TestRecords.row;
import static io.github.yok.flexpipeline.core.TestRecords.rowIndices;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.exception.RuleViolationException;
import io.github.yok.flexpipeline.model.CustomRule;
import io.github.yok.flexpipeline.model.DataRecord;
import io.github.yok.flexpipeline.model.RuleEnforcementMode;
import io.github.yok.flexpipeline.model.RuleKind;
import io.github.yok.flexpipeline.model.RuleViolation;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RuleValidatorTest {

    // "today" is 2024-06-01
    private static final Clock CLOCK =
            Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    private static final List<String> COLUMNS = List.of("employee_id", "birthday_on", "hired_on");

    private final RuleValidator validator = new RuleValidator(CLOCK);

    private static CustomRule ageGte(String field, int minAge) {
        return new CustomRule(field, RuleKind.AGE_GTE, Map.of("min_age", minAge));
    }

    @Test
    void apply_異常ケース_stopモードで18歳未満が1行ある_違反行を保持した例外が送出されること() {
        TabularDataset input = dataset(COLUMNS,
                row(1L, "2000-01-01", "2020-01-01"),
                row(2L, "2014-01-01", "2020-01-01"),
                row(3L, "1995-05-15", "2020-01-01"));

        RuleViolationException ex = assertThrows(RuleViolationException.class,
                () -> validator.apply(input, List.of(ageGte("birthday_on", 18)),
                        RuleEnforcementMode.STOP));

        RuleViolation violation = ex.getViolation();
        assertEquals("birthday_on", violation.getField());
        assertEquals(1, violation.size());
        assertEquals(2, violation.getRows().get(0).getRowIndex());
        assertEquals("Custom validation failed for field 'birthday_on' with age_gte (1 row(s)).",
                ex.getMessage());
    }

    @Test
    void apply_異常ケース_stopモードで先頭ルールが違反する_後続ルールが評価されないこと() {
        TabularDataset input = dataset(COLUMNS, row(1L, "2014-01-01", "2024-05-01"));

        RuleViolationException ex = assertThrows(RuleViolationException.class,
                () -> validator.apply(input,
                        List.of(ageGte("birthday_on", 18), ageGte("hired_on", 1)),
                        RuleEnforcementMode.STOP));

        assertEquals("birthday_on", ex.getViolation().getField());
    }

    @Test
    void apply_正常ケース_skipモードで複数ルールを適用する_後続ルールが削減後の集合を評価すること() {
        TabularDataset input = dataset(COLUMNS,
                row(1L, "2014-01-01", "2024-05-01"),
                row(2L, "1990-01-01", "2024-05-01"),
                row(3L, "1990-01-01", "2010-01-01"));

        RuleValidationResult result = validator.apply(input,
                List.of(ageGte("birthday_on", 18), ageGte("hired_on", 1)),
                RuleEnforcementMode.SKIP);

        assertEquals(List.of(3), rowIndices(result.getRemaining().getRecords()));
        assertEquals(2, result.getViolations().size());
        assertEquals("birthday_on", result.getViolations().get(0).getField());
        assertEquals(1, result.getViolations().get(0).size());
        // row 1 already removed by the first rule; only row 2 fails the second one
        assertEquals("hired_on", result.getViolations().get(1).getField());
        assertEquals(2, result.getViolations().get(1).getRows().get(0).getRowIndex());
        assertEquals(2, result.getInvalidRowCount());
    }

    @Test
    void apply_正常ケース_違反がない_全行が残り違反が空であること() {
        TabularDataset input = dataset(COLUMNS, row(1L, "1980-01-01", "2000-01-01"));

        RuleValidationResult result = validator.apply(input, List.of(ageGte("birthday_on", 18)),
                RuleEnforcementMode.STOP);

        assertEquals(1, result.getRemaining().size());
        assertTrue(result.getViolations().isEmpty());
        assertEquals(0, result.getInvalidRowCount());
    }

    @Test
    void violates_正常ケース_境界日付と日時と不正値を評価する_満年齢で判定され不正値は違反となること() {
        AgeGteEvaluator evaluator = new AgeGteEvaluator(CLOCK);
        CustomRule rule = ageGte("birthday_on", 18);

        assertFalse(evaluator.violates(record("2006-06-01"), rule));
        assertTrue(evaluator.violates(record("2006-06-02"), rule));
        assertFalse(evaluator.violates(record("2000-01-01T08:30:00"), rule));
        assertTrue(evaluator.violates(record("01/01/2000"), rule));
        assertTrue(evaluator.violates(record(null), rule));
    }

    @Test
    void violates_正常ケース_min_age未指定で評価する_0歳以上なら違反とならないこと() {
        AgeGteEvaluator evaluator = new AgeGteEvaluator(CLOCK);
        CustomRule rule = new CustomRule("birthday_on", RuleKind.AGE_GTE, Map.of());

        assertFalse(evaluator.violates(record("2024-05-31"), rule));
    }

    private static DataRecord record(String birthday) {
        return dataset(COLUMNS, row(1L, birthday, null)).getRecords().get(0);
    }

    @Test
    void apply_正常ケース_min_ageが小数である_切り捨てずに比較されること() {
        TabularDataset input = dataset(COLUMNS,
                row(1L, "2007-06-01", "2020-01-01"),
                row(2L, "2006-06-01", "2020-01-01"));
        CustomRule rule = new CustomRule("birthday_on", RuleKind.AGE_GTE,
                Map.of("min_age", 17.5d));

        RuleValidationResult result =
                validator.apply(input, List.of(rule), RuleEnforcementMode.SKIP);

        // 17 years < 17.5 is a violation; 18 years is not
        assertEquals(List.of(2), rowIndices(result.getRemaining().getRecords()));
        assertEquals(1, result.getInvalidRowCount());
    }
}
