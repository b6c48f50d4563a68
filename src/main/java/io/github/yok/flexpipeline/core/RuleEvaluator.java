package io.github.yok.flexpipeline.core;

import io.github.yok.flexpipeline.model.CustomRule;
import io.github.yok.flexpipeline.model.DataRecord;

/**
 * Decides whether a record violates a custom rule. One evaluator exists per rule kind.
 *
 * @author Yasuharu.Okawauchi
 */
@FunctionalInterface
public interface RuleEvaluator {

    /**
     * Evaluates one record.
     *
     * @param record record to check
     * @param rule rule with its parameters
     * @return {@code true} if the record violates the rule
     */
    boolean violates(DataRecord record, CustomRule rule);
}
