package io.github.yok.flexpipeline.dataset;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexpipeline.model.DataRecord;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable {@link TabularDataset} backed by lists.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class InMemoryTabularDataset implements TabularDataset {

    private final List<String> columns;

    private final List<DataRecord> records;

    public InMemoryTabularDataset(List<String> columns, List<DataRecord> records) {
        this.columns = ImmutableList.copyOf(columns);
        this.records = ImmutableList.copyOf(records);
    }

    @Override
    public TabularDataset derive(List<String> newColumns, List<DataRecord> newRecords) {
        return new InMemoryTabularDataset(newColumns, newRecords);
    }
}
