package org.calista.evoalign.lattice;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * ContextLattice: product partial order over named operating contexts.
 *
 * <p>Built once from a lattice document, immutable afterwards. Every context assigns a
 * normalized value to exactly the declared dimensions; comparisons are per dimension.</p>
 *
 * <pre>
 * version: "1.0"
 * dimensions:
 *   tool_access: {type: set, atoms: [web, email], top: "*", bottom: []}
 *   autonomy:    {type: ordered_enum, order: [none, supervised, full], top: "*", bottom: none}
 * contexts:
 *   any:      {tool_access: "*", autonomy: "*"}
 *   web_only: {tool_access: [web], autonomy: supervised}
 * </pre>
 *
 * {@code covers(sup, sub)} reads "sup is at least as permissive as sub on every axis" and
 * is {@code leq(sub, sup)}.
 */
public final class ContextLattice {

    private static final Logger log = LogManager.getLogger(ContextLattice.class);

    private final String version;
    private final Map<String, Dimension<?>> dimensions;
    private final Map<String, ContextDescriptor> contexts;

    private ContextLattice(String version, Map<String, Dimension<?>> dimensions, Map<String, ContextDescriptor> contexts) {
        this.version = version;
        this.dimensions = Collections.unmodifiableMap(dimensions);
        this.contexts = Collections.unmodifiableMap(contexts);
    }

    // ---------------------------------------------------------------------
    // Loading
    // ---------------------------------------------------------------------

    public static ContextLattice load(Path latticeFile) {
        return load(latticeFile, null);
    }

    public static ContextLattice load(Path latticeFile, Path schemaFile) {
        Objects.requireNonNull(latticeFile, "latticeFile");
        Path dir = latticeFile.toAbsolutePath().getParent();
        return load(new DataFiles(new FileIO(dir == null ? Path.of(".") : dir)), latticeFile, schemaFile);
    }

    /**
     * Parses, optionally schema-validates, then builds dimensions and contexts.
     *
     * @param schemaFile nullable; when given, a missing or failing schema aborts the load
     */
    public static ContextLattice load(DataFiles data, Path latticeFile, Path schemaFile) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(latticeFile, "latticeFile");
        if (!data.io().exists(latticeFile)) {
            throw new LatticeException("Lattice file not found: " + latticeFile);
        }

        JsonNode doc;
        try {
            doc = data.read(latticeFile);
        } catch (IOException e) {
            throw new LatticeException("Failed to parse lattice file " + latticeFile + ": " + e.getMessage(), e);
        }

        if (schemaFile != null) {
            LatticeSchemaValidator.load(data, schemaFile).validate(doc);
        }

        ContextLattice lattice = fromTree(doc);
        log.info("Context lattice loaded: file={}, version={}, dimensions={}, contexts={}",
                latticeFile.getFileName(), lattice.version, lattice.dimensions.size(), lattice.contexts.size());
        return lattice;
    }

    public static ContextLattice fromTree(JsonNode doc) {
        if (doc == null || !doc.isObject()) {
            throw new LatticeException("Lattice document must be an object");
        }
        JsonNode v = doc.get("version");
        if (v == null || v.isNull()) {
            throw new LatticeException("Lattice is missing version");
        }
        Map<String, Dimension<?>> dims = loadDimensions(doc.get("dimensions"));
        Map<String, ContextDescriptor> ctx = loadContexts(doc.get("contexts"), dims);
        return new ContextLattice(v.asText(), dims, ctx);
    }

    private static Map<String, Dimension<?>> loadDimensions(JsonNode node) {
        Map<String, Dimension<?>> dims = new LinkedHashMap<>();
        if (node != null && !node.isNull()) {
            if (!node.isObject()) throw new LatticeException("Lattice dimensions must be an object");
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                dims.put(e.getKey(), buildDimension(e.getKey(), e.getValue()));
            }
        }
        if (dims.isEmpty()) {
            throw new LatticeException("Lattice must define at least one dimension");
        }
        return dims;
    }

    static Dimension<?> buildDimension(String name, JsonNode spec) {
        if (spec == null || !spec.isObject()) {
            throw new LatticeException("Dimension '" + name + "' must be an object");
        }
        JsonNode typeNode = spec.get("type");
        DimensionType type = DimensionType.fromId(typeNode == null || typeNode.isNull() ? null : typeNode.asText(), name);

        switch (type) {
            case SET:
                return new SetDimension(name,
                        tokens(spec.get("atoms"), name, "atoms"),
                        textOr(spec.get("top"), SetDimension.TOP_SYMBOL),
                        tokens(spec.get("bottom"), name, "bottom"));
            case ORDERED_ENUM:
                return new OrderedEnumDimension(name,
                        tokens(spec.get("order"), name, "order"),
                        textOr(spec.get("top"), SetDimension.TOP_SYMBOL),
                        textOr(spec.get("bottom"), null));
            case BOOLEAN:
                return new BooleanDimension(name,
                        bool(spec.get("top"), true, name),
                        bool(spec.get("bottom"), false, name));
            default:
                throw new LatticeException("Unknown dimension type '" + type + "' for '" + name + "'");
        }
    }

    private static Map<String, ContextDescriptor> loadContexts(JsonNode node, Map<String, Dimension<?>> dims) {
        Map<String, ContextDescriptor> out = new LinkedHashMap<>();
        if (node != null && !node.isNull()) {
            if (!node.isObject()) throw new LatticeException("Lattice contexts must be an object");
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                out.put(e.getKey(), buildDescriptor(e.getKey(), e.getValue(), dims));
            }
        }
        if (out.isEmpty()) {
            throw new LatticeException("Lattice must define at least one context");
        }
        return out;
    }

    private static ContextDescriptor buildDescriptor(String id, JsonNode raw, Map<String, Dimension<?>> dims) {
        if (raw == null || !raw.isObject()) {
            throw new LatticeException("Context '" + id + "' must be an object");
        }
        TreeSet<String> keys = new TreeSet<>();
        raw.fieldNames().forEachRemaining(keys::add);

        TreeSet<String> missing = new TreeSet<>(dims.keySet());
        missing.removeAll(keys);
        if (!missing.isEmpty()) {
            throw new LatticeException("Context '" + id + "' missing dimensions: " + missing);
        }
        TreeSet<String> extra = new TreeSet<>(keys);
        extra.removeAll(dims.keySet());
        if (!extra.isEmpty()) {
            throw new LatticeException("Context '" + id + "' has unknown dimensions: " + extra);
        }

        Map<String, Dimension.Value> values = new LinkedHashMap<>();
        for (Map.Entry<String, Dimension<?>> d : dims.entrySet()) {
            values.put(d.getKey(), d.getValue().normalize(raw.get(d.getKey())));
        }
        return new ContextDescriptor(id, values);
    }

    private static List<String> tokens(JsonNode node, String dim, String field) {
        if (node == null || node.isNull()) return List.of();
        if (!node.isArray()) {
            throw new LatticeException("Dimension '" + dim + "' " + field + " must be a list");
        }
        List<String> out = new ArrayList<>(node.size());
        for (JsonNode n : node) {
            if (!n.isTextual()) {
                throw new LatticeException("Dimension '" + dim + "' " + field + " must contain strings");
            }
            out.add(n.textValue());
        }
        return out;
    }

    private static String textOr(JsonNode node, String def) {
        if (node == null || node.isNull()) return def;
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static boolean bool(JsonNode node, boolean def, String dim) {
        if (node == null) return def;
        if (!node.isBoolean()) {
            throw new LatticeException("Boolean dimension '" + dim + "' top/bottom must be boolean");
        }
        return node.booleanValue();
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public String version() {
        return version;
    }

    public Map<String, Dimension<?>> dimensions() {
        return dimensions;
    }

    public Set<String> contextIds() {
        return contexts.keySet();
    }

    public boolean hasContext(String id) {
        return id != null && contexts.containsKey(id);
    }

    public ContextDescriptor resolve(String contextId) {
        ContextDescriptor d = contextId == null ? null : contexts.get(contextId);
        if (d == null) throw new LatticeException("Unknown context id '" + contextId + "'");
        return d;
    }

    /** True iff left is below-or-equal right on every dimension. */
    public boolean leq(String leftId, String rightId) {
        return leq(resolve(leftId), resolve(rightId));
    }

    public boolean leq(ContextDescriptor left, ContextDescriptor right) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        for (Map.Entry<String, Dimension<?>> d : dimensions.entrySet()) {
            String name = d.getKey();
            if (!leqIn(d.getValue(), left.get(name), right.get(name))) return false;
        }
        return true;
    }

    /** sup is at least as permissive as sub. */
    public boolean covers(String supId, String subId) {
        return leq(subId, supId);
    }

    public ContextDescriptor join(Collection<String> ids) {
        return combine(ids, "join");
    }

    public ContextDescriptor meet(Collection<String> ids) {
        return combine(ids, "meet");
    }

    private ContextDescriptor combine(Collection<String> ids, String op) {
        if (ids == null || ids.isEmpty()) {
            throw new LatticeException(op + " requires at least one context id");
        }
        List<ContextDescriptor> resolved = new ArrayList<>(ids.size());
        for (String id : ids) resolved.add(resolve(id));

        Map<String, Dimension.Value> values = new LinkedHashMap<>();
        for (Map.Entry<String, Dimension<?>> d : dimensions.entrySet()) {
            List<Dimension.Value> column = new ArrayList<>(resolved.size());
            for (ContextDescriptor c : resolved) column.add(c.get(d.getKey()));
            values.put(d.getKey(), "join".equals(op) ? joinIn(d.getValue(), column) : meetIn(d.getValue(), column));
        }
        return new ContextDescriptor(op + "(" + String.join(",", ids) + ")", values);
    }

    // typed bridges; own() rejects values of other dimensions

    private static <V extends Dimension.Value> boolean leqIn(Dimension<V> dim, Dimension.Value a, Dimension.Value b) {
        return dim.leq(dim.own(a), dim.own(b));
    }

    private static <V extends Dimension.Value> V joinIn(Dimension<V> dim, List<Dimension.Value> column) {
        List<V> typed = new ArrayList<>(column.size());
        for (Dimension.Value v : column) typed.add(dim.own(v));
        return dim.join(typed);
    }

    private static <V extends Dimension.Value> V meetIn(Dimension<V> dim, List<Dimension.Value> column) {
        List<V> typed = new ArrayList<>(column.size());
        for (Dimension.Value v : column) typed.add(dim.own(v));
        return dim.meet(typed);
    }

    @Override
    public String toString() {
        return "ContextLattice{version=" + version + ", dimensions=" + dimensions.keySet()
                + ", contexts=" + contexts.keySet() + "}";
    }
}
