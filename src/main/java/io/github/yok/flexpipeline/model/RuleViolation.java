package io.github.yok.flexpipeline.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Rows violating one custom rule.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RuleViolation {

    private final CustomRule rule;

    private final List<RemovedRecord> rows;

    public RuleViolation(CustomRule rule, List<RemovedRecord> rows) {
        this.rule = rule;
        this.rows = ImmutableList.copyOf(rows);
    }

    public String getField() {
        return rule.getField();
    }

    public int size() {
        return rows.size();
    }
}
