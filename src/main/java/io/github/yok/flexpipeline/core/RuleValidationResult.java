package io.github.yok.flexpipeline.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.model.RuleViolation;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of custom rule validation in {@code skip} mode (or in {@code stop} mode without
 * violations).
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class RuleValidationResult {

    private final TabularDataset remaining;

    // one entry per rule with at least one violating row, in rule order
    private final List<RuleViolation> violations;

    private final int invalidRowCount;

    public RuleValidationResult(TabularDataset remaining, List<RuleViolation> violations,
            int invalidRowCount) {
        this.remaining = remaining;
        this.violations = ImmutableList.copyOf(violations);
        this.invalidRowCount = invalidRowCount;
    }
}
