package org.calista.evoalign.invariant.impl;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.evoalign.canonical.HashValue;
import org.calista.evoalign.invariant.GovernanceArtifacts;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantChecker;
import org.calista.evoalign.merkle.MerkleTree;

import java.io.IOException;
import java.util.*;

/**
 * Merkle roots and key references claimed by AARs are verifiable:
 * <ul>
 *   <li>{@code provenance.merkle_root} equals the artifact root of
 *       {@code risk_modeling.risk_fit_artifacts} keyed by {@code fit_hash}</li>
 *   <li>{@code lineage_references.ledger_root_hash} equals the root of the sorted lineage
 *       entry hashes</li>
 *   <li>approvals signed {@code key:<id>} name an active key of the key registry</li>
 * </ul>
 */
public final class TamperEvidenceInvariant implements InvariantChecker {

    public static final String NAME = "TAMPER_EVIDENCE";
    public static final String KEY_REF_PREFIX = "key:";

    private final GovernanceArtifacts artifacts;

    public TamperEvidenceInvariant(GovernanceArtifacts artifacts) {
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public InvariantCheck check() throws IOException {
        List<GovernanceArtifacts.Artifact> aars = artifacts.aars();
        Optional<GovernanceArtifacts.Artifact> keyRegistry = artifacts.keyRegistry();

        if (aars.isEmpty() && keyRegistry.isEmpty()) {
            return InvariantCheck.skip(NAME, "No AARs or key registry found");
        }

        Set<String> activeKeys = keyRegistry.map(k -> activeKeyIds(k.data())).orElseGet(TreeSet::new);

        List<String> lineage = artifacts.lineageEntryHashes();
        String ledgerRoot = lineage.isEmpty() ? "" : MerkleTree.root(lineage);

        List<Map<String, Object>> failures = new ArrayList<>();
        for (GovernanceArtifacts.Artifact aar : aars) {
            JsonNode doc = aar.data();
            String file = aar.relName();

            // ---- provenance.merkle_root ----
            String claimedMerkle = text(doc.path("provenance"), "merkle_root");
            if (claimedMerkle != null) {
                JsonNode fits = doc.path("risk_modeling").path("risk_fit_artifacts");
                if (fits.isArray() && fits.size() > 0) {
                    String computed = MerkleTree.artifactRoot(fits, "fit_hash");
                    if (!computed.isEmpty() && !HashValue.verify(claimedMerkle, computed)) {
                        failures.add(failure(file, "provenance.merkle_root mismatch"));
                    }
                }
            }

            // ---- lineage_references.ledger_root_hash ----
            String claimedLedger = text(doc.path("lineage_references"), "ledger_root_hash");
            if (claimedLedger != null) {
                if (ledgerRoot.isEmpty()) {
                    failures.add(failure(file, "ledger_root_hash claimed but no lineage entries found"));
                } else if (!HashValue.verify(claimedLedger, ledgerRoot)) {
                    failures.add(failure(file, "ledger_root_hash mismatch"));
                }
            }

            // ---- approvals -> key registry ----
            if (!activeKeys.isEmpty()) {
                JsonNode approvals = doc.path("governance").path("approvals");
                if (!approvals.isArray()) continue;
                for (JsonNode approval : approvals) {
                    if (!approval.isObject()) continue;
                    String sig = text(approval, "signature");
                    if (sig == null || !sig.startsWith(KEY_REF_PREFIX)) continue;
                    String keyRef = sig.substring(KEY_REF_PREFIX.length());
                    if (!activeKeys.contains(keyRef)) {
                        failures.add(failure(file, "Approval references unknown key: " + keyRef));
                    }
                }
            }
        }

        if (!failures.isEmpty()) {
            return InvariantCheck.failures(NAME, failures.size() + " tamper evidence issue(s) detected", failures);
        }

        List<String> checked = new ArrayList<>();
        if (!aars.isEmpty()) checked.add(aars.size() + " AAR(s)");
        if (keyRegistry.isPresent()) checked.add(activeKeys.size() + " active key(s)");
        return InvariantCheck.pass(NAME, "Verified tamper evidence for " + String.join(", ", checked));
    }

    /** key_id of every non-revoked key. */
    static Set<String> activeKeyIds(JsonNode registry) {
        Set<String> ids = new TreeSet<>();
        JsonNode keys = registry.path("keys");
        if (!keys.isArray()) return ids;
        for (JsonNode k : keys) {
            if (!k.isObject() || k.path("revoked").asBoolean(false)) continue;
            String id = text(k, "key_id");
            if (id != null) ids.add(id);
        }
        return ids;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.textValue().isEmpty()) return null;
        return v.textValue();
    }

    private static Map<String, Object> failure(String file, String reason) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("file", file);
        f.put("reason", reason);
        return f;
    }
}
