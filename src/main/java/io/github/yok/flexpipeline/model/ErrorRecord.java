package io.github.yok.flexpipeline.model;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A record rejected by schema validation.
 *
 * <p>
 * Carries the original row index, a snapshot of the input values and one message per failing
 * field, formatted as {@code "<field>: <reason>"}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ErrorRecord {

    private final int rowIndex;

    private final Map<String, Object> data;

    private final List<String> messages;

    /**
     * Creates an error record.
     *
     * @param rowIndex 1-based original row index
     * @param data snapshot of the input values
     * @param messages violation messages
     */
    public ErrorRecord(int rowIndex, Map<String, Object> data, List<String> messages) {
        this.rowIndex = rowIndex;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.messages = ImmutableList.copyOf(messages);
    }
}
