package org.calista.evoalign.lattice;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One axis of context variation.
 *
 * <p>Closed family: {@link SetDimension}, {@link OrderedEnumDimension}, {@link BooleanDimension}.
 * Every dimension owns its value type, and TOP is a variant of that type. A value only
 * ever meets the dimension that produced it: handing a foreign value to any operation
 * fails with {@link LatticeException}.</p>
 *
 * <p>{@code join}/{@code meet} reject empty input.</p>
 *
 * @param <V> value type owned by this dimension
 */
public sealed interface Dimension<V extends Dimension.Value>
        permits SetDimension, OrderedEnumDimension, BooleanDimension {

    /** Normalized value of a dimension. */
    interface Value {
        /** Dimension that produced this value. */
        Dimension<?> owner();

        /** TOP for set/enum dimensions, {@code true} for booleans. */
        boolean isTop();

        /** Plain Java rendering: "*", sorted list of atoms, enum token, or Boolean. */
        Object raw();
    }

    String name();

    DimensionType type();

    /**
     * Validates a raw document value against the declared universe.
     */
    V normalize(JsonNode raw);

    boolean leq(V a, V b);

    V join(List<V> values);

    V meet(List<V> values);

    /** Most permissive value of this dimension. */
    V top();

    /** Declared bottom for set/enum dimensions, {@code false} for booleans. */
    V bottom();

    /**
     * Ownership-checked narrowing of an arbitrary value to this dimension's value type.
     */
    V own(Value value);
}
