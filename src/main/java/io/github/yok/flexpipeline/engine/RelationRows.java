package io.github.yok.flexpipeline.engine;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Column names and rows read back from a relation. Cells may be {@code null}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class RelationRows {

    private final ImmutableList<String> columns;

    private final List<List<Object>> rows;

    public RelationRows(List<String> columns, List<List<Object>> rows) {
        this.columns = ImmutableList.copyOf(columns);
        List<List<Object>> copy = new ArrayList<>(rows.size());
        rows.forEach(r -> copy.add(Collections.unmodifiableList(new ArrayList<>(r))));
        this.rows = Collections.unmodifiableList(copy);
    }

    public int size() {
        return rows.size();
    }
}
