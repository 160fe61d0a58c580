package org.calista.evoalign.lattice;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Boolean dimension. The order is fixed: {@code false <= true}, so leq is {@code !a || b},
 * join is OR and meet is AND.
 *
 * <p>The declared {@code top}/{@code bottom} constants are validated (booleans, distinct)
 * and kept as metadata; they do not change the order.</p>
 */
public final class BooleanDimension implements Dimension<BooleanDimension.Value> {

    private final String name;
    private final boolean declaredTop;
    private final boolean declaredBottom;
    private final Value trueValue;
    private final Value falseValue;

    public BooleanDimension(String name) {
        this(name, true, false);
    }

    public BooleanDimension(String name, boolean top, boolean bottom) {
        this.name = Objects.requireNonNull(name, "name");
        if (top == bottom) {
            throw new LatticeException("Boolean dimension '" + name + "' top and bottom must differ");
        }
        this.declaredTop = top;
        this.declaredBottom = bottom;
        this.trueValue = new Value(this, true);
        this.falseValue = new Value(this, false);
    }

    public Value of(boolean v) {
        return v ? trueValue : falseValue;
    }

    /** Top constant as written in the lattice document. */
    public boolean declaredTop() {
        return declaredTop;
    }

    public boolean declaredBottom() {
        return declaredBottom;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DimensionType type() {
        return DimensionType.BOOLEAN;
    }

    @Override
    public Value normalize(JsonNode raw) {
        if (raw == null || !raw.isBoolean()) {
            throw new LatticeException("Boolean dimension '" + name + "' expects boolean value");
        }
        return of(raw.booleanValue());
    }

    @Override
    public boolean leq(Value a, Value b) {
        Value x = own(a);
        Value y = own(b);
        return !x.value || y.value;
    }

    @Override
    public Value join(List<Value> values) {
        requireValues(values, "join");
        boolean any = false;
        for (Value v : values) any |= own(v).value;
        return of(any);
    }

    @Override
    public Value meet(List<Value> values) {
        requireValues(values, "meet");
        boolean all = true;
        for (Value v : values) all &= own(v).value;
        return of(all);
    }

    @Override
    public Value top() {
        return trueValue;
    }

    @Override
    public Value bottom() {
        return falseValue;
    }

    @Override
    public Value own(Dimension.Value value) {
        if (value instanceof Value v && v.owner == this) return v;
        throw new LatticeException("Value " + SetDimension.describe(value)
                + " does not belong to boolean dimension '" + name + "'");
    }

    private void requireValues(List<Value> values, String op) {
        if (values == null || values.isEmpty()) {
            throw new LatticeException("Boolean dimension '" + name + "' " + op + " requires values");
        }
    }

    @Override
    public String toString() {
        return "BooleanDimension{" + name + ", top=" + declaredTop + "}";
    }

    // ---------------------------------------------------------------------
    // Value
    // ---------------------------------------------------------------------

    public static final class Value implements Dimension.Value {
        private final BooleanDimension owner;
        private final boolean value;

        private Value(BooleanDimension owner, boolean value) {
            this.owner = owner;
            this.value = value;
        }

        @Override
        public BooleanDimension owner() {
            return owner;
        }

        @Override
        public boolean isTop() {
            return value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public Object raw() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Value v)) return false;
            return owner == v.owner && value == v.value;
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(owner), value);
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }
}
