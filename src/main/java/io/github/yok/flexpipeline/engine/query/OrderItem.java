package io.github.yok.flexpipeline.engine.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * One {@code ORDER BY} term.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public final class OrderItem {

    private final String field;

    private final boolean descending;
}
