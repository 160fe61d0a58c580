package org.calista.evoalign.invariant;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.evoalign.canonical.ContentHasher;
import org.calista.evoalign.core.GovernanceConfig;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.lattice.ContextLattice;
import org.calista.evoalign.lattice.LatticeException;
import org.calista.evoalign.solvency.OversightPlan;
import org.calista.evoalign.solvency.RiskFit;
import org.calista.evoalign.solvency.RiskTolerance;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * GovernanceArtifacts: typed loaders for the repository artifacts the invariants read.
 *
 * <p>All directories come from {@link GovernanceConfig} and are walked recursively in
 * sorted order. Contracts, fits and plans that fail to parse are skipped with a WARN;
 * AARs, lineage entries and key registries are not, a broken one aborts the check.</p>
 *
 * File names in loaded records are repo-relative.
 */
public final class GovernanceArtifacts {

    private static final Logger log = LogManager.getLogger(GovernanceArtifacts.class);

    private final DataFiles data;
    private final FileIO io;
    private final GovernanceConfig cfg;

    /** A parsed data file. */
    public record Artifact(Path file, String relName, JsonNode data) {}

    /** The lattice used for checks and the file it came from. */
    public record LoadedLattice(ContextLattice lattice, Path file) {}

    /** One {@code context_class} string found in a data file; path is dotted with [i] indexes. */
    public record ContextReference(String contextClass, String file, String path) {}

    public GovernanceArtifacts(DataFiles data, GovernanceConfig cfg) {
        this.data = Objects.requireNonNull(data, "data");
        this.io = data.io();
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    public DataFiles data() {
        return data;
    }

    public GovernanceConfig config() {
        return cfg;
    }

    // ---------------------------------------------------------------------
    // Lattice
    // ---------------------------------------------------------------------

    /**
     * First of the sorted {@code *.yaml}, then {@code *.yml}, then {@code *.json} files directly
     * in the lattice directory, validated against the configured schema.
     */
    public LoadedLattice loadLattice() throws IOException {
        Path dir = io.resolve(cfg.lattice.dir);
        if (!io.exists(dir)) {
            throw new LatticeException("Context lattice directory not found");
        }
        List<Path> candidates = new ArrayList<>();
        candidates.addAll(io.list(dir, ".yaml"));
        candidates.addAll(io.list(dir, ".yml"));
        candidates.addAll(io.list(dir, ".json"));
        if (candidates.isEmpty()) {
            throw new LatticeException("No context lattice files found");
        }
        Path file = candidates.get(0);
        Path schema = cfg.lattice.schema == null ? null : io.resolve(cfg.lattice.schema);
        return new LoadedLattice(ContextLattice.load(data, file, schema), file);
    }

    /** Every data file under the lattice directory, recursively. */
    public List<Path> latticeFiles() throws IOException {
        return data.list(io.resolve(cfg.lattice.dir));
    }

    /**
     * Every string {@code context_class} value, at any depth, in the data files under the
     * configured reference paths. Unparsable files are skipped.
     */
    public List<ContextReference> contextReferences() throws IOException {
        List<ContextReference> out = new ArrayList<>();
        for (String rel : cfg.lattice.referencePaths) {
            for (Path f : data.list(io.resolve(rel))) {
                JsonNode doc = readSkipping(f);
                if (doc == null) continue;
                collectContextClasses(doc, "", io.relativeName(f), out);
            }
        }
        return out;
    }

    static void collectContextClasses(JsonNode node, String path, String file, List<ContextReference> out) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                String next = path.isEmpty() ? e.getKey() : path + "." + e.getKey();
                if ("context_class".equals(e.getKey()) && e.getValue().isTextual()) {
                    out.add(new ContextReference(e.getValue().textValue(), file, next));
                }
                collectContextClasses(e.getValue(), next, file, out);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                collectContextClasses(node.get(i), path + "[" + i + "]", file, out);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Governor inputs
    // ---------------------------------------------------------------------

    /** Tolerance entries of every safety contract. */
    public List<RiskTolerance> tolerances() throws IOException {
        List<RiskTolerance> out = new ArrayList<>();
        for (Path f : data.list(io.resolve(cfg.governor.safetyContracts))) {
            JsonNode doc = readSkipping(f);
            if (doc == null || !doc.isObject()) continue;
            JsonNode tols = doc.get("tolerances");
            if (tols == null || !tols.isArray()) continue;
            String rel = io.relativeName(f);
            for (JsonNode t : tols) {
                if (!t.isObject()) continue;
                out.add(new RiskTolerance(text(t, "hazard_id"), text(t, "severity_id"),
                        text(t, "context_class"), t.get("tau"), rel));
            }
        }
        return out;
    }

    /** Risk fits from {@code .json} files holding one fit object or a list of them. */
    public List<RiskFit> riskFits() throws IOException {
        List<RiskFit> out = new ArrayList<>();
        for (Path f : io.walk(io.resolve(cfg.governor.riskFits), Set.of(".json"))) {
            JsonNode doc = readSkipping(f);
            if (doc == null) continue;
            String rel = io.relativeName(f);
            if (doc.isArray()) {
                for (JsonNode fit : doc) {
                    if (fit.isObject()) out.add(new RiskFit(fit, rel));
                }
            } else if (doc.isObject()) {
                out.add(new RiskFit(doc, rel));
            }
        }
        return out;
    }

    /**
     * Plans from {@code plans_by_context}, {@code plans}, a single plan object with a
     * {@code context_class}, or a top-level list. Entries without a context class are dropped.
     */
    public List<OversightPlan> oversightPlans() throws IOException {
        List<OversightPlan> out = new ArrayList<>();
        for (Path f : data.list(io.resolve(cfg.governor.oversightPlans))) {
            JsonNode doc = readSkipping(f);
            if (doc == null) continue;
            String rel = io.relativeName(f);
            for (JsonNode entry : planEntries(doc)) {
                if (!entry.isObject()) continue;
                String context = text(entry, "context_class");
                if (context == null) continue;
                JsonNode alloc = entry.get("channel_allocations");
                if (alloc == null || alloc.isNull() || isEmptyValue(alloc)) {
                    alloc = JsonNodeFactory.instance.objectNode();
                }
                out.add(new OversightPlan(text(entry, "plan_id"), context, alloc, rel));
            }
        }
        return out;
    }

    static List<JsonNode> planEntries(JsonNode doc) {
        List<JsonNode> out = new ArrayList<>();
        JsonNode src;
        if (doc.isArray()) {
            src = doc;
        } else if (doc.isObject()) {
            if (doc.has("plans_by_context")) src = doc.get("plans_by_context");
            else if (doc.has("plans")) src = doc.get("plans");
            else if (doc.has("context_class")) return List.of(doc);
            else return out;
        } else {
            return out;
        }
        if (src != null && src.isArray()) src.forEach(out::add);
        return out;
    }

    // ---------------------------------------------------------------------
    // Provenance
    // ---------------------------------------------------------------------

    /** AAR objects from {@code .json} files. */
    public List<Artifact> aars() throws IOException {
        List<Artifact> out = new ArrayList<>();
        for (Path f : io.walk(io.resolve(cfg.provenance.aars), Set.of(".json"))) {
            JsonNode doc = data.read(f);
            if (doc.isObject()) out.add(new Artifact(f, io.relativeName(f), doc));
        }
        return out;
    }

    /** Sorted content hashes of every lineage entry object. */
    public List<String> lineageEntryHashes() throws IOException {
        List<String> out = new ArrayList<>();
        for (Path f : data.list(io.resolve(cfg.provenance.lineage))) {
            JsonNode doc = data.read(f);
            if (doc.isObject()) out.add(ContentHasher.contentHash(doc));
        }
        out.sort(null);
        return out;
    }

    /** First data file under the keys directory with a {@code keys} field. */
    public Optional<Artifact> keyRegistry() throws IOException {
        for (Path f : data.list(io.resolve(cfg.provenance.keys))) {
            JsonNode doc = data.read(f);
            if (doc.isObject() && doc.has("keys")) {
                return Optional.of(new Artifact(f, io.relativeName(f), doc));
            }
        }
        return Optional.empty();
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private JsonNode readSkipping(Path f) {
        try {
            return data.read(f);
        } catch (IOException e) {
            log.warn("Skipping unparsable artifact {}: {}", io.relativeName(f), e.getMessage());
            return null;
        }
    }

    static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    private static boolean isEmptyValue(JsonNode n) {
        if (n.isContainerNode()) return n.size() == 0;
        if (n.isTextual()) return n.asText().isEmpty();
        if (n.isBoolean()) return !n.booleanValue();
        if (n.isNumber()) return n.doubleValue() == 0.0;
        return false;
    }
}
