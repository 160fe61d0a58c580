package org.calista.evoalign.lattice;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Totally ordered token dimension. Rank is the position in {@code order}.
 *
 * <p>The top symbol may be "*" (a dedicated TOP above every token) or one of the tokens;
 * in the latter case that token normalizes to TOP.</p>
 */
public final class OrderedEnumDimension implements Dimension<OrderedEnumDimension.Value> {

    private final String name;
    private final List<String> order;
    private final Map<String, Integer> rank;
    private final String topSymbol;
    private final Value top;
    private final Value bottom;

    public OrderedEnumDimension(String name, List<String> order, String topSymbol, String bottom) {
        this.name = Objects.requireNonNull(name, "name");
        this.order = List.copyOf(Objects.requireNonNull(order, "order"));
        if (this.order.isEmpty()) {
            throw new LatticeException("Ordered enum '" + name + "' must define order");
        }
        Map<String, Integer> r = new HashMap<>();
        for (int i = 0; i < this.order.size(); i++) {
            if (r.putIfAbsent(this.order.get(i), i) != null) {
                throw new LatticeException("Ordered enum '" + name + "' has duplicate value '" + this.order.get(i) + "'");
            }
        }
        this.rank = Collections.unmodifiableMap(r);

        if (topSymbol == null || (!SetDimension.TOP_SYMBOL.equals(topSymbol) && !rank.containsKey(topSymbol))) {
            throw new LatticeException("Ordered enum '" + name + "' top must be '*' or in order");
        }
        if (bottom == null || !rank.containsKey(bottom)) {
            throw new LatticeException("Ordered enum '" + name + "' bottom must be in order");
        }
        this.topSymbol = topSymbol;
        this.top = new Value(this, null);
        this.bottom = bottom.equals(topSymbol) ? top : new Value(this, bottom);
    }

    public List<String> order() {
        return order;
    }

    public String topSymbol() {
        return topSymbol;
    }

    public Value of(String token) {
        if (topSymbol.equals(token)) return top;
        if (token == null || !rank.containsKey(token)) {
            throw new LatticeException("Ordered enum '" + name + "' has unknown value '" + token + "'");
        }
        return new Value(this, token);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DimensionType type() {
        return DimensionType.ORDERED_ENUM;
    }

    @Override
    public Value normalize(JsonNode raw) {
        if (raw == null || !raw.isTextual()) {
            throw new LatticeException("Ordered enum '" + name + "' has unknown value '" + raw + "'");
        }
        return of(raw.textValue());
    }

    @Override
    public boolean leq(Value a, Value b) {
        Value x = own(a);
        Value y = own(b);
        if (x.isTop()) return y.isTop();
        if (y.isTop()) return true;
        return rank.get(x.token) <= rank.get(y.token);
    }

    @Override
    public Value join(List<Value> values) {
        requireValues(values, "join");
        Value best = null;
        for (Value v : values) {
            Value x = own(v);
            if (x.isTop()) return top;
            if (best == null || rank.get(x.token) > rank.get(best.token)) best = x;
        }
        return best;
    }

    @Override
    public Value meet(List<Value> values) {
        requireValues(values, "meet");
        Value least = null;
        for (Value v : values) {
            Value x = own(v);
            if (x.isTop()) continue;
            if (least == null || rank.get(x.token) < rank.get(least.token)) least = x;
        }
        return least == null ? top : least;
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
        throw new LatticeException("Value " + SetDimension.describe(value)
                + " does not belong to ordered enum '" + name + "'");
    }

    private void requireValues(List<Value> values, String op) {
        if (values == null || values.isEmpty()) {
            throw new LatticeException("Ordered enum '" + name + "' " + op + " requires values");
        }
    }

    @Override
    public String toString() {
        return "OrderedEnumDimension{" + name + ", order=" + order + ", top=" + topSymbol + "}";
    }

    // ---------------------------------------------------------------------
    // Value
    // ---------------------------------------------------------------------

    public static final class Value implements Dimension.Value {
        private final OrderedEnumDimension owner;
        private final String token; // null => TOP

        private Value(OrderedEnumDimension owner, String token) {
            this.owner = owner;
            this.token = token;
        }

        @Override
        public OrderedEnumDimension owner() {
            return owner;
        }

        @Override
        public boolean isTop() {
            return token == null;
        }

        /** Token of an ordinary value; empty for TOP. */
        public Optional<String> token() {
            return Optional.ofNullable(token);
        }

        @Override
        public Object raw() {
            return token == null ? owner.topSymbol : token;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Value v)) return false;
            return owner == v.owner && Objects.equals(token, v.token);
        }

        @Override
        public int hashCode() {
            return Objects.hash(System.identityHashCode(owner), token);
        }

        @Override
        public String toString() {
            return String.valueOf(raw());
        }
    }
}
