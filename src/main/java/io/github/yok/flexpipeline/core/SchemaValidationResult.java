package io.github.yok.flexpipeline.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.flexpipeline.dataset.TabularDataset;
import io.github.yok.flexpipeline.model.ErrorRecord;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Partition of an input dataset into schema-valid records and error records.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class SchemaValidationResult {

    private final TabularDataset valid;

    private final List<ErrorRecord> errors;

    public SchemaValidationResult(TabularDataset valid, List<ErrorRecord> errors) {
        this.valid = valid;
        this.errors = ImmutableList.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
