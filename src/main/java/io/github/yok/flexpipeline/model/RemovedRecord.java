package io.github.yok.flexpipeline.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A record removed by deduplication or by a custom rule. The reason is implied by the stage that
 * produced it.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RemovedRecord {

    private final int rowIndex;

    private final Map<String, Object> data;

    public RemovedRecord(int rowIndex, Map<String, Object> data) {
        this.rowIndex = rowIndex;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Takes a snapshot of a dataset record.
     *
     * @param record source record
     * @return removed-record snapshot
     */
    public static RemovedRecord of(DataRecord record) {
        return new RemovedRecord(record.getRowIndex(), record.getValues());
    }
}
