package org.calista.evoalign.lattice;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Set-valued dimension: a value is a subset of the declared atoms, or TOP ("*", any/all).
 *
 * <ul>
 *   <li>leq: TOP only below TOP; anything below TOP; otherwise subset</li>
 *   <li>join: union, TOP if any input is TOP</li>
 *   <li>meet: intersection of the non-TOP inputs, TOP only if every input is TOP</li>
 * </ul>
 */
public final class SetDimension implements Dimension<SetDimension.Value> {

    public static final String TOP_SYMBOL = "*";

    private final String name;
    private final SortedSet<String> atoms;
    private final Value top;
    private final Value bottom;

    public SetDimension(String name, Collection<String> atoms, String topSymbol, Collection<String> bottom) {
        this.name = Objects.requireNonNull(name, "name");
        this.atoms = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(atoms, "atoms")));
        if (this.atoms.isEmpty()) {
            throw new LatticeException("Set dimension '" + name + "' must define atoms");
        }
        if (!TOP_SYMBOL.equals(topSymbol)) {
            throw new LatticeException("Set dimension '" + name + "' must use '*' for top");
        }
        TreeSet<String> b = new TreeSet<>(bottom == null ? List.of() : bottom);
        if (!this.atoms.containsAll(b)) {
            throw new LatticeException("Set dimension '" + name + "' bottom has unknown atoms");
        }
        this.top = new Value(this, true, Collections.emptySortedSet());
        this.bottom = new Value(this, false, b);
    }

    public SortedSet<String> atoms() {
        return atoms;
    }

    /** Ordinary value from atoms; every atom must be declared. */
    public Value of(Collection<String> members) {
        TreeSet<String> vals = new TreeSet<>(members);
        TreeSet<String> unknown = new TreeSet<>(vals);
        unknown.removeAll(atoms);
        if (!unknown.isEmpty()) {
            throw new LatticeException("Set dimension '" + name + "' has unknown atoms: " + unknown);
        }
        return new Value(this, false, vals);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DimensionType type() {
        return DimensionType.SET;
    }

    @Override
    public Value normalize(JsonNode raw) {
        if (raw != null && raw.isTextual() && TOP_SYMBOL.equals(raw.textValue())) return top;
        if (raw == null || !raw.isArray()) {
            throw new LatticeException("Set dimension '" + name + "' expects list or '*'");
        }
        List<String> members = new ArrayList<>(raw.size());
        for (JsonNode n : raw) {
            if (!n.isTextual()) {
                throw new LatticeException("Set dimension '" + name + "' has non-string atom " + n);
            }
            members.add(n.textValue());
        }
        return of(members);
    }

    @Override
    public boolean leq(Value a, Value b) {
        Value x = own(a);
        Value y = own(b);
        if (x.top) return y.top;
        if (y.top) return true;
        return y.members.containsAll(x.members);
    }

    @Override
    public Value join(List<Value> values) {
        requireValues(values, "join");
        TreeSet<String> union = new TreeSet<>();
        for (Value v : values) {
            Value x = own(v);
            if (x.top) return top;
            union.addAll(x.members);
        }
        return new Value(this, false, union);
    }

    @Override
    public Value meet(List<Value> values) {
        requireValues(values, "meet");
        TreeSet<String> acc = null;
        for (Value v : values) {
            Value x = own(v);
            if (x.top) continue;
            if (acc == null) acc = new TreeSet<>(x.members);
            else acc.retainAll(x.members);
        }
        return acc == null ? top : new Value(this, false, acc);
    }

    @Override
    public Value top() {
        return top;
    }

    @Override
    public Value bottom() {
        return bottom;
    }

    @Override
    public Value own(Dimension.Value value) {
        if (value instanceof Value v && v.owner == this) return v;
        throw new LatticeException("Value " + describe(value) + " does not belong to set dimension '" + name + "'");
    }

    private void requireValues(List<Value> values, String op) {
        if (values == null || values.isEmpty()) {
            throw new LatticeException("Set dimension '" + name + "' " + op + " requires values");
        }
    }

    static String describe(Dimension.Value v) {
        if (v == null) return "null";
        return v.raw() + " of '" + v.owner().name() + "'";
    }

    @Override
    public String toString() {
        return "SetDimension{" + name + ", atoms=" + atoms + "}";
    }

    // ---------------------------------------------------------------------
    // Value
    // ---------------------------------------------------------------------

    public static final class Value implements Dimension.Value {
        private final SetDimension owner;
        private final boolean top;
        private final SortedSet<String> members;

        private Value(SetDimension owner, boolean top, SortedSet<String> members) {
            this.owner = owner;
            this.top = top;
            this.members = Collections.unmodifiableSortedSet(members);
        }

        @Override
        public SetDimension owner() {
            return owner;
        }

        @Override
        public boolean isTop() {
            return top;
        }

        /** Members of an ordinary value; empty for TOP. */
        public SortedSet<String> members() {
            return members;
        }

        @Override
        public Object raw() {
            return top ? TOP_SYMBOL : List.copyOf(members);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Value v)) return false;
            return owner == v.owner && top == v.top && members.equals(v.members);
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(owner), top, members);
        }

        @Override
        public String toString() {
            return String.valueOf(raw());
        }
    }
}
