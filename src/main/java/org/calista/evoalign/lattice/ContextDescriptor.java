package org.calista.evoalign.lattice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized values of one context, keyed by dimension name in declaration order.
 *
 * Descriptors produced by {@code join}/{@code meet} carry a synthetic id such as
 * {@code join(a,b)}.
 */
public record ContextDescriptor(String id, Map<String, Dimension.Value> values) {

    public ContextDescriptor {
        Objects.requireNonNull(id, "id");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
    }

    public Dimension.Value get(String dimension) {
        Dimension.Value v = values.get(dimension);
        if (v == null) throw new LatticeException("Context '" + id + "' has no dimension '" + dimension + "'");
        return v;
    }

    /** Plain rendering: dimension -> "*", atom list, token or boolean. */
    public Map<String, Object> raw() {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((k, v) -> out.put(k, v.raw()));
        return out;
    }
}
