package io.github.yok.flexpipeline.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigEnumsTest {

    @Test
    void fromValue_正常ケース_重複解決ポリシーの旧表記を指定する_同じポリシーが返ること() {
        assertEquals(DuplicateResolutionPolicy.KEEP_FIRST,
                DuplicateResolutionPolicy.fromValue("first"));
        assertEquals(DuplicateResolutionPolicy.KEEP_FIRST,
                DuplicateResolutionPolicy.fromValue("keep_first"));
        assertEquals(DuplicateResolutionPolicy.KEEP_LAST,
                DuplicateResolutionPolicy.fromValue("LAST"));
        assertEquals(DuplicateResolutionPolicy.EXCLUDE_ALL,
                DuplicateResolutionPolicy.fromValue("exclude_all"));
        assertEquals("keep_last", DuplicateResolutionPolicy.KEEP_LAST.label());
    }

    @Test
    void fromValue_異常ケース_未知の値を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> DuplicateResolutionPolicy.fromValue("newest"));
        assertThrows(IllegalArgumentException.class, () -> RuleEnforcementMode.fromValue("warn"));
        assertThrows(IllegalArgumentException.class, () -> ProjectionKind.fromValue("index"));
        assertThrows(IllegalArgumentException.class, () -> RuleKind.fromValue(null));
    }

    @Test
    void fromValue_正常ケース_大文字小文字を混在させる_対応する値が返ること() {
        assertEquals(RuleEnforcementMode.SKIP, RuleEnforcementMode.fromValue("Skip"));
        assertEquals(ProjectionKind.VIEW, ProjectionKind.fromValue("VIEW"));
        assertEquals("table", ProjectionKind.TABLE.label());
        assertEquals(RuleKind.AGE_GTE, RuleKind.fromValue("age_gte"));
    }

    @Test
    void getDecimalParam_正常ケース_文字列と小数と未指定のパラメータを取得する_丸めずに返ること() {
        CustomRule rule = new CustomRule("birthday_on", RuleKind.AGE_GTE,
                Map.of("min_age", "21", "limit", 17.5d));
        assertEquals(0, new BigDecimal("21").compareTo(rule.getDecimalParam("min_age", null)));
        assertEquals(new BigDecimal("17.5"), rule.getDecimalParam("limit", null));
        assertEquals(BigDecimal.TEN, rule.getDecimalParam("other", BigDecimal.TEN));
        assertEquals("birthday_on age_gte", rule.describe());
    }

    @Test
    void getDecimalParam_異常ケース_数値でないパラメータを取得する_IllegalArgumentExceptionが送出されること() {
        CustomRule rule = new CustomRule("birthday_on", RuleKind.AGE_GTE,
                Map.of("min_age", "adult"));
        assertThrows(IllegalArgumentException.class,
                () -> rule.getDecimalParam("min_age", BigDecimal.ZERO));
    }

    @Test
    void getNumericParams_正常ケース_age_gteを参照する_min_ageが数値パラメータであること() {
        assertEquals(List.of("min_age"), RuleKind.AGE_GTE.getNumericParams());
    }
}
