package io.github.yok.flexpipeline.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.model.RemovedRecord;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Survivors of deduplication and the rows removed by all passes, in pass order.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class DeduplicationResult {

    private final TabularDataset kept;

    private final List<RemovedRecord> removed;

    public DeduplicationResult(TabularDataset kept, List<RemovedRecord> removed) {
        this.kept = kept;
        this.removed = ImmutableList.copyOf(removed);
    }
}
