package org.calista.evoalign.invariant.impl;

import org.calista.evoalign.GovernanceRepo;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantResult;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.secrecy.CorpusScanner;
import org.calista.evoalign.secrecy.HashingScheme;
import org.calista.evoalign.secrecy.SecrecyAudit;
import org.calista.evoalign.secrecy.key.impl.StaticKeyProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SecrecyInvariantTest {

    private static final String FP_X = "sha256:b463c1524601cb7b657e0717a90054c840bcac0c7070b12567297b3343f7a3b6";

    private static InvariantCheck check(Path root) {
        DataFiles data = new DataFiles(new FileIO(root));
        try (CorpusScanner scanner = CorpusScanner.builder(data).build()) {
            return new SecrecyInvariant(new SecrecyAudit(data, scanner, StaticKeyProvider.empty(), null)).check();
        }
    }

    @Test
    void leakFailsWithReportDetails(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1");
        repo.writeSecretRegistry(h, HashingScheme.sha256V1(), Map.of("s1", List.of(FP_X)));
        repo.write("prompt_libraries/lib.yaml", "prompts:\n  - prompt: X\n");

        InvariantCheck c = check(root);

        assertEquals(InvariantResult.FAIL, c.result());
        assertEquals("Secrecy hash check failed", c.message());
        assertEquals("fail", c.details().get("status"));
        assertEquals(1, ((List<?>) c.details().get("leaks")).size());
    }

    @Test
    void cleanCorpusPasses(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1");
        repo.writeSecretRegistry(h, HashingScheme.sha256V1(), Map.of("s1", List.of(FP_X)));

        InvariantCheck c = check(root);

        assertEquals(InvariantResult.PASS, c.result());
        assertEquals("Secret suite fingerprints not found in protected artifacts", c.message());
    }

    @Test
    void noSecretSuitesSkips(@TempDir Path root) {
        new GovernanceRepo(root).writeSuiteRegistry();

        assertEquals(InvariantResult.SKIP, check(root).result());
    }
}
