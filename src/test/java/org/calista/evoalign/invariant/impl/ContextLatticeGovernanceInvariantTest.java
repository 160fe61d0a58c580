package org.calista.evoalign.invariant.impl;

import org.calista.evoalign.GovernanceRepo;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ContextLatticeGovernanceInvariantTest {

    private static InvariantCheck check(GovernanceRepo repo) throws Exception {
        return new ContextLatticeGovernanceInvariant(repo.artifacts()).check();
    }

    @Test
    void approvedLatticePasses(@TempDir Path root) throws Exception {
        InvariantCheck c = check(new GovernanceRepo(root).withLattice());

        assertEquals(InvariantResult.PASS, c.result(), String.valueOf(c.details()));
        assertEquals("Verified 1 lattice file(s) have required RFC and signatures", c.message());
    }

    @Test
    void missingGovernanceMetadataFails(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root).withLattice();
        repo.write("contracts/context_lattice/drafts/v2.yaml",
                "version: \"2.0\"\nmetadata:\n  approvals:\n    - approver: someone\n");
        repo.write("contracts/context_lattice/list.json", "[1, 2]");
        repo.write("contracts/context_lattice/broken.yml", "a: [unclosed");

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.FAIL, c.result());
        assertEquals("4 lattice governance issue(s)", c.message());
        List<Object> files = c.failureList().stream().map(f -> f.get("file")).toList();
        assertEquals(List.of(
                "contracts/context_lattice/broken.yml",
                "contracts/context_lattice/drafts/v2.yaml",
                "contracts/context_lattice/drafts/v2.yaml",
                "contracts/context_lattice/list.json"), files);
        assertTrue(c.failureList().get(0).get("reason").toString().startsWith("Failed to parse lattice file: "));
        assertEquals("No rfc_reference in lattice metadata", c.failureList().get(1).get("reason"));
        assertEquals("No signed approvals in lattice metadata", c.failureList().get(2).get("reason"));
        assertEquals("Lattice file must be a mapping", c.failureList().get(3).get("reason"));
    }

    @Test
    void noLatticeFilesSkips(@TempDir Path root) throws Exception {
        assertEquals(InvariantResult.SKIP, check(new GovernanceRepo(root)).result());
    }
}
