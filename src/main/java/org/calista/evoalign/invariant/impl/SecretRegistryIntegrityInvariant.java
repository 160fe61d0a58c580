package org.calista.evoalign.invariant.impl;

import org.calista.evoalign.canonical.HashValue;
import org.calista.evoalign.core.GovernanceConfig;
import org.calista.evoalign.invariant.GovernanceArtifacts;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantChecker;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.secrecy.FingerprintException;
import org.calista.evoalign.secrecy.SecretHashRegistry;
import org.calista.evoalign.secrecy.SuiteRegistry;

import java.util.*;

/**
 * The secret hash registry is complete and consistent with the suite registry:
 * supported scheme, matching suite registry hash, an entry per secret suite, and
 * per entry no duplicate fingerprints, a matching count and a matching fingerprint root.
 */
public final class SecretRegistryIntegrityInvariant implements InvariantChecker {

    public static final String NAME = "SECRET_REGISTRY_INTEGRITY";

    private final DataFiles data;
    private final GovernanceConfig cfg;

    public SecretRegistryIntegrityInvariant(GovernanceArtifacts artifacts) {
        Objects.requireNonNull(artifacts, "artifacts");
        this.data = artifacts.data();
        this.cfg = artifacts.config();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public InvariantCheck check() {
        FileIO io = data.io();

        SuiteRegistry suites;
        try {
            suites = SuiteRegistry.load(data, io.resolve(cfg.secrecy.suiteRegistry));
        } catch (FingerprintException e) {
            return InvariantCheck.fail(NAME, e.getMessage());
        }

        Set<String> secretIds = suites.secretSuites().keySet();
        if (secretIds.isEmpty()) {
            return InvariantCheck.skip(NAME, "No secret suites defined");
        }

        SecretHashRegistry registry;
        try {
            registry = SecretHashRegistry.load(data, io.resolve(cfg.secrecy.secretHashRegistry));
        } catch (FingerprintException e) {
            return InvariantCheck.fail(NAME, e.getMessage());
        }

        List<Map<String, Object>> failures = new ArrayList<>();

        String schemeId = registry.scheme().schemeId();
        if (!cfg.secrecy.supportedSchemes.contains(schemeId)) {
            failures.add(failure(null, "Unsupported hashing scheme '" + schemeId + "'"));
        }

        if (!HashValue.verify(registry.suiteRegistryHash(), suites.hash())) {
            Map<String, Object> f = failure(null, "suite_registry_hash mismatch");
            f.put("expected", suites.hash());
            f.put("found", registry.suiteRegistryHash());
            failures.add(f);
        }

        Map<String, SecretHashRegistry.Suite> entries = new LinkedHashMap<>();
        for (SecretHashRegistry.Suite s : registry.suites()) entries.put(s.suiteId(), s);

        for (String id : secretIds) {
            if (!entries.containsKey(id)) {
                failures.add(failure(id, "Secret suite missing from hash registry"));
            }
        }

        for (SecretHashRegistry.Suite s : entries.values()) {
            List<String> fps = s.fingerprints();
            if (fps.size() != new HashSet<>(fps).size()) {
                failures.add(failure(s.suiteId(), "Duplicate fingerprints in registry entry"));
            }
            if (s.declaredCount() != null && s.declaredCount() != fps.size()) {
                failures.add(failure(s.suiteId(), "n_test_cases does not match fingerprint count"));
            }
            if (!SecretHashRegistry.suiteFingerprintRoot(fps).equals(s.fingerprintRoot())) {
                failures.add(failure(s.suiteId(), "suite_fingerprint_root mismatch"));
            }
        }

        if (!failures.isEmpty()) {
            return InvariantCheck.failures(NAME, failures.size() + " registry integrity issue(s) detected", failures);
        }
        return InvariantCheck.pass(NAME, "Secret hash registry integrity verified");
    }

    private static Map<String, Object> failure(String suiteId, String reason) {
        Map<String, Object> f = new LinkedHashMap<>();
        if (suiteId != null) f.put("suite_id", suiteId);
        f.put("reason", reason);
        return f;
    }
}
