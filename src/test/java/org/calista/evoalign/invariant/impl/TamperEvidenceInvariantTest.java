package org.calista.evoalign.invariant.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.evoalign.GovernanceRepo;
import org.calista.evoalign.canonical.ContentHasher;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantResult;
import org.calista.evoalign.merkle.MerkleTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TamperEvidenceInvariantTest {

    private static final String FIT_A = "sha256:" + ContentHasher.sha256Hex("fit-a");
    private static final String FIT_B = "sha256:" + ContentHasher.sha256Hex("fit-b");

    private static String fitRoot() {
        return MerkleTree.artifactRoot(List.of(Map.of("fit_hash", FIT_A), Map.of("fit_hash", FIT_B)), "fit_hash");
    }

    private static InvariantCheck check(GovernanceRepo repo) throws Exception {
        return new TamperEvidenceInvariant(repo.artifacts()).check();
    }

    private static List<Object> reasons(InvariantCheck c) {
        return c.failureList().stream().map(f -> f.get("reason")).toList();
    }

    /** Two lineage entries; returns the ledger root over them. */
    private static String lineage(GovernanceRepo repo) {
        Map<String, Object> e1 = Map.of("entry_id", "L1", "action", "train");
        Map<String, Object> e2 = Map.of("entry_id", "L2", "action", "deploy");
        repo.writeJson("lineage/l1.json", e1);
        repo.writeJson("lineage/l2.json", e2);
        List<String> hashes = new ArrayList<>(List.of(ContentHasher.contentHash(e1), ContentHasher.contentHash(e2)));
        hashes.sort(null);
        return MerkleTree.root(hashes);
    }

    private static Map<String, Object> aar(String merkleRoot, String ledgerRoot, String... signatures) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("aar_id", "AAR-1");
        doc.put("provenance", Map.of("merkle_root", merkleRoot));
        doc.put("risk_modeling", Map.of("risk_fit_artifacts", List.of(Map.of("fit_hash", FIT_B), Map.of("fit_hash", FIT_A))));
        doc.put("lineage_references", Map.of("ledger_root_hash", ledgerRoot));
        List<Map<String, Object>> approvals = new ArrayList<>();
        for (String s : signatures) approvals.add(Map.of("approver", "board", "signature", s));
        doc.put("governance", Map.of("approvals", approvals));
        return doc;
    }

    private static void keys(GovernanceRepo repo) {
        repo.write("control_plane/keys/key_registry.json",
                "{\"keys\":[{\"key_id\":\"board-2024\"},{\"key_id\":\"old-2019\",\"revoked\":true}]}");
    }

    @Test
    void consistentAarPasses(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root);
        String ledger = lineage(repo);
        keys(repo);
        String merkle = fitRoot();
        repo.writeJson("aars/aar-1.json", aar(merkle, ledger, "key:board-2024", "pgp:external"));

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.PASS, c.result(), String.valueOf(c.details()));
        assertEquals("Verified tamper evidence for 1 AAR(s), 1 active key(s)", c.message());
    }

    @Test
    void bareHexRootsVerify(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root);
        String ledger = lineage(repo);
        String merkle = fitRoot();
        repo.writeJson("aars/aar-1.json", aar(merkle.substring("sha256:".length()), ledger.substring("sha256:".length())));

        assertEquals(InvariantResult.PASS, check(repo).result());
    }

    @Test
    void tamperingIsReported(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root);
        lineage(repo);
        keys(repo);
        repo.writeJson("aars/aar-1.json", aar("sha256:feed", "sha256:beef", "key:old-2019", "key:board-2024"));

        InvariantCheck c = check(repo);

        assertEquals(InvariantResult.FAIL, c.result());
        assertEquals(List.of(
                "provenance.merkle_root mismatch",
                "ledger_root_hash mismatch",
                "Approval references unknown key: old-2019"), reasons(c));
        assertEquals("3 tamper evidence issue(s) detected", c.message());
        assertEquals("aars/aar-1.json", c.failureList().get(0).get("file"));
    }

    @Test
    void ledgerClaimWithoutLineageFails(@TempDir Path root) throws Exception {
        GovernanceRepo repo = new GovernanceRepo(root);
        String merkle = fitRoot();
        repo.writeJson("aars/aar-1.json", aar(merkle, "sha256:beef"));

        assertEquals(List.of("ledger_root_hash claimed but no lineage entries found"), reasons(check(repo)));
    }

    @Test
    void nothingToVerifySkips(@TempDir Path root) throws Exception {
        InvariantCheck c = check(new GovernanceRepo(root));

        assertEquals(InvariantResult.SKIP, c.result());
        assertEquals("No AARs or key registry found", c.message());
    }

    @Test
    void revokedKeysAreInactive() throws Exception {
        Set<String> ids = TamperEvidenceInvariant.activeKeyIds(new ObjectMapper().readTree(
                "{\"keys\":[{\"key_id\":\"a\"},{\"key_id\":\"b\",\"revoked\":true},{\"revoked\":false},\"junk\"]}"));
        assertEquals(Set.of("a"), ids);
    }
}
