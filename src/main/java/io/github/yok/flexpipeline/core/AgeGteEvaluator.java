package io.github.yok.flexpipeline.core;

import io.github.yok.flexpipeline.model.CustomRule;
import io.github.yok.flexpipeline.model.DataRecord;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.Period;
import java.time.format.DateTimeParseException;
import lombok.extern.slf4j.Slf4j;

/**
 * {@code age_gte}: the whole years between the date in the rule's field and today must be at least
 * {@code min_age} (default 0). A fractional {@code min_age} is compared as is, so {@code 17.5}
 * requires an age of 18.
 *
 * <p>
 * The field holds an ISO date ({@code yyyy-MM-dd}) or an ISO date-time whose date part is used.
 * A missing or unparseable date is a violation.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class AgeGteEvaluator implements RuleEvaluator {

    static final String MIN_AGE = "min_age";

    private final Clock clock;

    public AgeGteEvaluator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean violates(DataRecord record, CustomRule rule) {
        BigDecimal minAge = rule.getDecimalParam(MIN_AGE, BigDecimal.ZERO);
        Object value = record.getValue(rule.getField());
        if (value == null) {
            return true;
        }
        LocalDate date;
        try {
            date = parseDate(value.toString().trim());
        } catch (DateTimeParseException e) {
            log.debug("Row {}: '{}' is not a date ({})", record.getRowIndex(), value,
                    e.getMessage());
            return true;
        }
        int age = Period.between(date, LocalDate.now(clock)).getYears();
        return BigDecimal.valueOf(age).compareTo(minAge) < 0;
    }

    private static LocalDate parseDate(String text) {
        if (text.length() > 10 && (text.charAt(10) == 'T' || text.charAt(10) == ' ')) {
            return LocalDate.parse(text.substring(0, 10));
        }
        return LocalDate.parse(text);
    }
}
