package org.calista.evoalign.invariant.impl;

import org.calista.evoalign.GovernanceRepo;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ContextRegistryInvariantTest {

    private static InvariantCheck check(GovernanceRepo repo) throws Exception {
        return new ContextRegistryInvariant(repo.artifacts()).check();
    }

    @Test
    void registeredReferencesPass(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root).withLattice();
        repo.write("contracts/safety_contracts/c.yaml", String.join("\n",
                "tolerances:",
                "  - {hazard_id: H1, context_class: any}",
                "  - {hazard_id: H2, context_class: web_email}",
                ""));
        repo.write("deployments/prod/d.json", "{\"target\":{\"context_class\":\"offline\"}}");

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.PASS, c.result(), String.valueOf(c.details()));
        assertEquals("Verified 3 context reference(s) against lattice registry", c.message());
    }

    @Test
    void unknownReferenceFailsWithLocation(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root).withLattice();
        repo.write("control_plane/governor/oversight_plans/p.json",
                "{\"plans\":[{\"context_class\":\"web_only\"},{\"context_class\":\"lab_only\"}]}");
        repo.write("aars/a.json", "[{\"fit\":{\"context_class\":\"any\"}}]");

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.FAIL, c.result());
        assertEquals("1 context reference(s) missing from lattice registry", c.message());
        Map<String, Object> f = c.failureList().get(0);
        assertEquals("lab_only", f.get("context_class"));
        assertEquals("control_plane/governor/oversight_plans/p.json", f.get("file"));
        assertEquals("plans[1].context_class", f.get("path"));
    }

    @Test
    void noReferencesSkips(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root).withLattice();
        repo.write("deployments/d.json", "{\"context\":\"any\",\"context_class\":42}");
        repo.write("deployments/notes.txt", "context_class: nowhere");
        repo.write("deployments/broken.yaml", "context_class: [unclosed");

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.SKIP, c.result());
        assertEquals("No context_class references found (lattice: context_lattice_v1.yaml)", c.message());
    }

    @Test
    void missingLatticeFails(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root);
        repo.write("deployments/d.json", "{\"context_class\":\"any\"}");

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.FAIL, c.result());
        assertEquals("Context lattice directory not found", c.message());
    }
}
