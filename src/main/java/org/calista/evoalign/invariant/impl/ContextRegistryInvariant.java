package org.calista.evoalign.invariant.impl;

import org.calista.evoalign.invariant.GovernanceArtifacts;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantChecker;
import org.calista.evoalign.lattice.ContextLattice;
import org.calista.evoalign.lattice.LatticeException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Every {@code context_class} referenced by contracts, fits, plans, sweeps, deployments
 * and AARs names a context registered in the lattice.
 */
public final class ContextRegistryInvariant implements InvariantChecker {

    public static final String NAME = "CONTEXT_REGISTRY";

    private final GovernanceArtifacts artifacts;

    public ContextRegistryInvariant(GovernanceArtifacts artifacts) {
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public InvariantCheck check() throws IOException {
        GovernanceArtifacts.LoadedLattice loaded;
        try {
            loaded = artifacts.loadLattice();
        } catch (LatticeException e) {
            return InvariantCheck.fail(NAME, e.getMessage());
        }

        List<GovernanceArtifacts.ContextReference> refs = artifacts.contextReferences();
        if (refs.isEmpty()) {
            return InvariantCheck.skip(NAME, "No context_class references found (lattice: "
                    + loaded.file().getFileName() + ")");
        }

        ContextLattice lattice = loaded.lattice();
        List<Map<String, Object>> missing = new ArrayList<>();
        for (GovernanceArtifacts.ContextReference ref : refs) {
            if (lattice.hasContext(ref.contextClass())) continue;
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("context_class", ref.contextClass());
            f.put("file", ref.file());
            f.put("path", ref.path());
            f.put("reason", "Unknown context_class '" + ref.contextClass() + "'");
            missing.add(f);
        }

        if (!missing.isEmpty()) {
            return InvariantCheck.failures(NAME,
                    missing.size() + " context reference(s) missing from lattice registry", missing);
        }
        return InvariantCheck.pass(NAME, "Verified " + refs.size() + " context reference(s) against lattice registry");
    }
}
