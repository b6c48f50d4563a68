package io.github.yok.flexpipeline.core;

import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.exception.RuleViolationException;
import io.github.yok.flexpipeline.model.CustomRule;
import io.github.yok.flexpipeline.model.DataRecord;
import io.github.yok.flexpipeline.model.RemovedRecord;
import io.github.yok.flexpipeline.model.RuleEnforcementMode;
import io.github.yok.flexpipeline.model.RuleKind;
import io.github.yok.flexpipeline.model.RuleViolation;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies custom business rules in declaration order.
 *
 * <p>
 * In {@link RuleEnforcementMode#STOP} mode the first rule with violations raises
 * {@link RuleViolationException} and later rules are not evaluated. In
 * {@link RuleEnforcementMode#SKIP} mode violating rows are removed before the next rule runs.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class RuleValidator {

    private final Map<RuleKind, RuleEvaluator> evaluators;

    /**
     * Creates a validator whose date-based rules measure against the given clock.
     *
     * @param clock source of today's date
     */
    public RuleValidator(Clock clock) {
        this.evaluators = new EnumMap<>(RuleKind.class);
        evaluators.put(RuleKind.AGE_GTE, new AgeGteEvaluator(clock));
    }

    /**
     * Applies the rules.
     *
     * @param dataset deduplicated records
     * @param rules rules in declaration order
     * @param mode enforcement mode
     * @return remaining records and recorded violations
     * @throws RuleViolationException in {@code stop} mode, for the first violated rule
     */
    public RuleValidationResult apply(TabularDataset dataset, List<CustomRule> rules,
            RuleEnforcementMode mode) {
        List<DataRecord> working = dataset.getRecords();
        List<RuleViolation> violations = new ArrayList<>();
        int invalidRowCount = 0;

        for (CustomRule rule : rules) {
            RuleEvaluator evaluator = evaluators.get(rule.getKind());
            if (evaluator == null) {
                throw new IllegalStateException("No evaluator for rule kind " + rule.getKind());
            }
            log.info("Running custom validation: {}", rule.describe());

            List<DataRecord> passed = new ArrayList<>(working.size());
            List<RemovedRecord> failed = new ArrayList<>();
            for (DataRecord record : working) {
                if (evaluator.violates(record, rule)) {
                    failed.add(RemovedRecord.of(record));
                } else {
                    passed.add(record);
                }
            }
            invalidRowCount += failed.size();
            if (failed.isEmpty()) {
                continue;
            }

            RuleViolation violation = new RuleViolation(rule, failed);
            if (mode == RuleEnforcementMode.STOP) {
                throw new RuleViolationException(violation);
            }
            violations.add(violation);
            working = passed;
            log.info("Skipped {} invalid row(s) for custom validation {}", failed.size(),
                    rule.describe());
        }

        return new RuleValidationResult(dataset.derive(working), violations, invalidRowCount);
    }
}
