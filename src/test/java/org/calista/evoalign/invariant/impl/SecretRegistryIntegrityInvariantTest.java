package org.calista.evoalign.invariant.impl;

import org.calista.evoalign.GovernanceRepo;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantResult;
import org.calista.evoalign.secrecy.HashingScheme;
import org.calista.evoalign.secrecy.SecretHashRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SecretRegistryIntegrityInvariantTest {

    private static InvariantCheck check(GovernanceRepo repo) {
        return new SecretRegistryIntegrityInvariant(repo.artifacts()).check();
    }

    private static List<Object> reasons(InvariantCheck c) {
        return c.failureList().stream().map(f -> f.get("reason")).toList();
    }

    private static Map<String, Object> entry(String id, List<String> fps, String root, Object n) {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("suite_id", id);
        s.put("test_case_fingerprints", fps);
        s.put("suite_fingerprint_root", root);
        s.put("n_test_cases", n);
        return s;
    }

    @Test
    void consistentRegistryPasses(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1", "s2");
        repo.writeSecretRegistry(h, HashingScheme.sha256V1(), Map.of(
                "s1", List.of("sha256:aa", "sha256:bb"),
                "s2", List.of("sha256:cc")));

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.PASS, c.result(), String.valueOf(c.details()));
        assertEquals("Secret hash registry integrity verified", c.message());
    }

    @Test
    void everyInconsistencyIsReported(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        repo.writeSuiteRegistry("s1", "s2", "s3");
        Map<String, Object> scheme = new HashingScheme("md5-v0", "json-c14n-v1", "md5:", null).toMap();
        repo.writeSecretRegistryRaw("sha256:0000", scheme, List.of(
                entry("s1", List.of("sha256:aa", "sha256:aa"), SecretHashRegistry.suiteFingerprintRoot(List.of("sha256:aa", "sha256:aa")), 2),
                entry("s2", List.of("sha256:bb"), SecretHashRegistry.suiteFingerprintRoot(List.of("sha256:bb")), 5),
                entry("s3", List.of("sha256:cc"), "sha256:wrong", 1)));

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.FAIL, c.result());
        assertEquals(List.of(
                "Unsupported hashing scheme 'md5-v0'",
                "suite_registry_hash mismatch",
                "Duplicate fingerprints in registry entry",
                "n_test_cases does not match fingerprint count",
                "suite_fingerprint_root mismatch"), reasons(c));
        assertEquals("5 registry integrity issue(s) detected", c.message());
        assertEquals("sha256:0000", c.failureList().get(1).get("found"));
        assertEquals("s1", c.failureList().get(2).get("suite_id"));
    }

    @Test
    void missingSuiteIsReported(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1", "s2");
        repo.writeSecretRegistry(h, HashingScheme.sha256V1(), Map.of("s1", List.of("sha256:aa")));

        InvariantCheck c = check(repo);

        assertEquals(List.of("Secret suite missing from hash registry"), reasons(c));
        assertEquals("s2", c.failureList().get(0).get("suite_id"));
    }

    @Test
    void skipsWithoutSecretSuitesAndFailsWithoutRegistries(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        assertEquals(InvariantResult.FAIL, check(repo).result());

        repo.writeSuiteRegistry();
        assertEquals(InvariantResult.SKIP, check(repo).result());

        repo.writeSuiteRegistry("s1");
        InvariantCheck c = check(repo);
        assertEquals(InvariantResult.FAIL, c.result());
        assertTrue(c.message().startsWith("Secret hash registry not found"), c.message());
    }
}
