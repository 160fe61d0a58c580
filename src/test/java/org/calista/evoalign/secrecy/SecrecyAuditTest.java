package org.calista.evoalign.secrecy;

import org.calista.evoalign.GovernanceRepo;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.secrecy.key.KeyProvider;
import org.calista.evoalign.secrecy.key.impl.StaticKeyProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SecrecyAuditTest {

    private static final String FP_X = "sha256:b463c1524601cb7b657e0717a90054c840bcac0c7070b12567297b3343f7a3b6";

    private static SecrecyAuditReport audit(Path root, KeyProvider keys) {
        DataFiles data = new DataFiles(new FileIO(root));
        try (CorpusScanner scanner = CorpusScanner.builder(data).build()) {
            return new SecrecyAudit(data, scanner, keys, null).run();
        }
    }

    @Test
    void leakedSecretItemFails(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1");
        repo.writeSecretRegistry(h, HashingScheme.sha256V1(), Map.of("s1", List.of(FP_X)));
        repo.write("training/data/set.json", "{\"items\": [{\"prompt\": \"X\"}]}");

        SecrecyAuditReport r = audit(root, StaticKeyProvider.empty());

        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertEquals(1, r.leaks.size());
        assertEquals(List.of("training/data/set.json"), r.leaks.get(0).files());
        assertEquals(List.of("s1"), r.secretSuiteIds);
        assertEquals(h, r.suiteRegistryHash);
        assertNotNull(r.secretRegistryHash);
    }

    @Test
    void cleanCorpusPasses(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1");
        repo.writeSecretRegistry(h, HashingScheme.sha256V1(), Map.of("s1", List.of(FP_X)));
        repo.write("training/data/set.json", "{\"items\": [{\"prompt\": \"Y\"}]}");

        SecrecyAuditReport r = audit(root, StaticKeyProvider.empty());

        assertTrue(r.passed(), r.toString());
        assertEquals(1, r.secretFingerprintCount);
        assertEquals(1, r.scannedFilesCount);
        assertEquals("pass", r.toMap().get("status"));
    }

    @Test
    void noSecretSuitesSkips(@TempDir Path root) {
        new GovernanceRepo(root).writeSuiteRegistry();

        SecrecyAuditReport r = audit(root, StaticKeyProvider.empty());

        assertEquals(SecrecyAuditReport.Status.SKIP, r.status);
        assertEquals("No secret suites defined", r.message);
    }

    @Test
    void missingRegistriesFailClosed(@TempDir Path root) {
        SecrecyAuditReport r = audit(root, StaticKeyProvider.empty());
        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertEquals("Suite registry not found", r.message);

        new GovernanceRepo(root).writeSuiteRegistry("s1");
        r = audit(root, StaticKeyProvider.empty());
        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertTrue(r.message.startsWith("Secret hash registry not found"), r.message);
    }

    @Test
    void missingHmacKeyFailsClosed(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1");
        HashingScheme hmac = new HashingScheme("hmac-sha256-v1", "json-c14n-v1", "hmacsha256:", null);
        repo.writeSecretRegistry(h, hmac, Map.of("s1", List.of("hmacsha256:00")));

        SecrecyAuditReport r = audit(root, StaticKeyProvider.empty());

        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertTrue(r.message.contains(SecrecyFingerprinter.DEFAULT_KEY_NAME), r.message);
    }

    @Test
    void hmacLeakIsFoundWithKey(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1");
        HashingScheme hmac = new HashingScheme("hmac-sha256-v1", "json-c14n-v1", "hmacsha256:", null);
        String fp = "hmacsha256:53db0bda476874c8dd7d2eede3ce39a7a34272e78ce20a6478fa3f41af4f185b";
        repo.writeSecretRegistry(h, hmac, Map.of("s1", List.of(fp)));
        repo.write("prompts/lib.jsonl", "{\"prompt\":\"X\"}\n");

        SecrecyAuditReport r = audit(root, StaticKeyProvider.of(SecrecyFingerprinter.DEFAULT_KEY_NAME, "secret-key"));

        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertEquals(1, r.leaks.size());
        assertEquals(fp, r.leaks.get(0).fingerprint());
    }

    @Test
    void registryHashMismatchAndMissingSuiteFail(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        repo.writeSuiteRegistry("s1", "s2");
        repo.writeSecretRegistry("sha256:0000", HashingScheme.sha256V1(), Map.of("s1", List.of(FP_X)));

        SecrecyAuditReport r = audit(root, StaticKeyProvider.empty());

        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertTrue(r.errors.contains("suite_registry_hash mismatch"), r.errors.toString());
        assertEquals(List.of("s2"), r.missingSecretSuites);
        assertTrue(r.leaks.isEmpty());
    }

    @Test
    void secretPaddedWithUnicodeSpacesIsStillALeak(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1");
        String fp = new SecrecyFingerprinter(HashingScheme.sha256V1(), StaticKeyProvider.empty())
                .fingerprintTextBlock("Secret").orElseThrow();
        repo.writeSecretRegistry(h, HashingScheme.sha256V1(), Map.of("s1", List.of(fp)));
        repo.write("training/corpora/notes.txt", "intro\n\n\u00a0Secret\u00a0\n");

        SecrecyAuditReport r = audit(root, StaticKeyProvider.empty());

        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertEquals(1, r.leaks.size());
        assertEquals(fp, r.leaks.get(0).fingerprint());
        assertEquals(List.of("training/corpora/notes.txt"), r.leaks.get(0).files());
    }

    @Test
    void configuredPathOutsideRepoFailsClosed(@TempDir Path root) {
        GovernanceRepo repo = new GovernanceRepo(root);
        String h = repo.writeSuiteRegistry("s1");
        repo.writeSecretRegistry(h, HashingScheme.sha256V1(), Map.of("s1", List.of(FP_X)));
        DataFiles data = new DataFiles(new FileIO(root));

        SecrecyAudit.Settings outside = new SecrecyAudit.Settings();
        outside.suiteRegistry = "../registry.json";
        SecrecyAuditReport r;
        try (CorpusScanner scanner = CorpusScanner.builder(data).build()) {
            r = new SecrecyAudit(data, scanner, StaticKeyProvider.empty(), outside).run();
        }
        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertTrue(r.message.startsWith("Invalid suite registry path: "), r.message);
        assertEquals(List.of(r.message), r.errors);

        SecrecyAudit.Settings registryOutside = new SecrecyAudit.Settings();
        registryOutside.secretHashRegistry = "../../secret.json";
        try (CorpusScanner scanner = CorpusScanner.builder(data).build()) {
            r = new SecrecyAudit(data, scanner, StaticKeyProvider.empty(), registryOutside).run();
        }
        assertEquals(SecrecyAuditReport.Status.FAIL, r.status);
        assertTrue(r.message.startsWith("Invalid secret hash registry path: "), r.message);
    }
}
