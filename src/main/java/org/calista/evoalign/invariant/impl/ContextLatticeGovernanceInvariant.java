package org.calista.evoalign.invariant.impl;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.evoalign.invariant.GovernanceArtifacts;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantChecker;
import org.calista.evoalign.io.DataFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Every lattice file carries an RFC reference and at least one signed approval.
 */
public final class ContextLatticeGovernanceInvariant implements InvariantChecker {

    public static final String NAME = "CONTEXT_LATTICE_GOVERNANCE";

    private final GovernanceArtifacts artifacts;

    public ContextLatticeGovernanceInvariant(GovernanceArtifacts artifacts) {
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public InvariantCheck check() throws IOException {
        List<Path> files = artifacts.latticeFiles();
        if (files.isEmpty()) {
            return InvariantCheck.skip(NAME, "No context lattice files found");
        }

        DataFiles data = artifacts.data();
        List<Map<String, Object>> failures = new ArrayList<>();
        for (Path f : files) {
            String rel = data.io().relativeName(f);
            JsonNode doc;
            try {
                doc = data.read(f);
            } catch (IOException e) {
                failures.add(failure(rel, "Failed to parse lattice file: " + e.getMessage()));
                continue;
            }
            if (!doc.isObject()) {
                failures.add(failure(rel, "Lattice file must be a mapping"));
                continue;
            }

            JsonNode metadata = doc.path("metadata");
            JsonNode rfc = metadata.get("rfc_reference");
            if (rfc == null || rfc.isNull() || rfc.asText().isEmpty()) {
                failures.add(failure(rel, "No rfc_reference in lattice metadata"));
            }
            if (!hasSignedApproval(metadata.path("approvals"))) {
                failures.add(failure(rel, "No signed approvals in lattice metadata"));
            }
        }

        if (!failures.isEmpty()) {
            return InvariantCheck.failures(NAME, failures.size() + " lattice governance issue(s)", failures);
        }
        return InvariantCheck.pass(NAME, "Verified " + files.size() + " lattice file(s) have required RFC and signatures");
    }

    private static boolean hasSignedApproval(JsonNode approvals) {
        if (!approvals.isArray()) return false;
        for (JsonNode a : approvals) {
            JsonNode sig = a.get("signature");
            if (sig != null && !sig.isNull() && !sig.asText().isEmpty()) return true;
        }
        return false;
    }

    private static Map<String, Object> failure(String file, String reason) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("file", file);
        f.put("reason", reason);
        return f;
    }
}
