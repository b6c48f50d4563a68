package io.github.yok.flexpipeline.exception;

import io.github.yok.flexpipeline.model.RuleViolation;
import lombok.Getter;

/**
 * Thrown in {@code stop} mode when a custom rule is violated. Carries the rule and every row that
 * matched its violation condition.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class RuleViolationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    private final transient RuleViolation violation;

    public RuleViolationException(RuleViolation violation) {
        super("Custom validation failed for field '" + violation.getField() + "' with "
                + violation.getRule().getKind().getConfigName() + " (" + violation.size()
                + " row(s)).");
        this.violation = violation;
    }
}
