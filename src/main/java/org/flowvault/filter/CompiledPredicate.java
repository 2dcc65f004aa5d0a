package org.flowvault.filter;

import java.util.List;
import java.util.Objects;

/**
 * A filter compiled to SQL.
 * <p>
 * The fragment is a boolean expression over the flow view aliased as {@code v}; its {@code ?}
 * placeholders bind to {@code params} in order. User input never appears in the fragment.
 *
 * @param fragment SQL boolean expression
 * @param params   values for the placeholders, left to right
 */
public record CompiledPredicate(String fragment, List<Object> params) {

    /** Matches every flow. */
    public static final CompiledPredicate ALL = new CompiledPredicate("TRUE", List.of());

    public CompiledPredicate {
        Objects.requireNonNull(fragment, "fragment cannot be null");
        params = List.copyOf(params);
    }
}
