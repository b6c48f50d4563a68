package io.github.yok.flexpipeline.core;

import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.model.CompositeKey;
import io.github.yok.flexpipeline.model.DataRecord;
import io.github.yok.flexpipeline.model.DuplicateResolutionPolicy;
import io.github.yok.flexpipeline.model.RemovedRecord;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Removes duplicate records by composite key.
 *
 * <p>
 * Keys are applied one after another; each pass sees only the survivors of the previous one, so
 * the order of keys matters. Within a pass records are grouped by their key tuple ({@code null}
 * equals {@code null}):
 * </p>
 * <ul>
 * <li>{@link DuplicateResolutionPolicy#KEEP_FIRST}: the earliest record of each group survives</li>
 * <li>{@link DuplicateResolutionPolicy#KEEP_LAST}: the latest record of each group survives</li>
 * <li>{@link DuplicateResolutionPolicy#EXCLUDE_ALL}: groups with more than one record are removed
 * entirely</li>
 * </ul>
 * <p>
 * Survivors keep their relative order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DeduplicationEngine {

    /**
     * Deduplicates a dataset.
     *
     * @param dataset records to deduplicate
     * @param keys composite keys, applied in order
     * @param policy resolution policy
     * @return survivors and removed rows
     */
    public DeduplicationResult deduplicate(TabularDataset dataset, List<CompositeKey> keys,
            DuplicateResolutionPolicy policy) {
        List<DataRecord> current = dataset.getRecords();
        List<RemovedRecord> removed = new ArrayList<>();

        for (CompositeKey key : keys) {
            Map<List<Object>, List<Integer>> groups = new HashMap<>();
            for (int i = 0; i < current.size(); i++) {
                groups.computeIfAbsent(key.extract(current.get(i)), k -> new ArrayList<>())
                        .add(i);
            }

            boolean[] drop = new boolean[current.size()];
            for (List<Integer> positions : groups.values()) {
                if (positions.size() < 2) {
                    continue;
                }
                int survivor;
                switch (policy) {
                    case KEEP_FIRST:
                        survivor = positions.get(0);
                        break;
                    case KEEP_LAST:
                        survivor = positions.get(positions.size() - 1);
                        break;
                    default:
                        survivor = -1;
                }
                for (int pos : positions) {
                    if (pos != survivor) {
                        drop[pos] = true;
                    }
                }
            }

            List<DataRecord> next = new ArrayList<>(current.size());
            int removedInPass = 0;
            for (int i = 0; i < current.size(); i++) {
                if (drop[i]) {
                    removed.add(RemovedRecord.of(current.get(i)));
                    removedInPass++;
                } else {
                    next.add(current.get(i));
                }
            }
            log.info("Duplicates removed for composite key {} ({}): {}", key,
                    policy.label(), removedInPass);
            current = next;
        }

        log.info("Rows after deduplication: {}", current.size());
        return new DeduplicationResult(dataset.derive(current), removed);
    }
}
