package org.calista.evoalign.secrecy;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.evoalign.canonical.ContentHasher;
import org.calista.evoalign.canonical.HashValue;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.io.FileIO;
import org.calista.evoalign.secrecy.key.KeyProvider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * SecrecyAudit: end-to-end leak check of protected corpora against the secret hash registry.
 *
 * <ol>
 *   <li>suite registry -> secret suites (none: SKIP)</li>
 *   <li>secret hash registry -> scheme, declared fingerprints, missing suites,
 *       suite_registry_hash check</li>
 *   <li>scan protected paths with the registry's scheme</li>
 *   <li>leaks = declared ∩ scanned</li>
 * </ol>
 *
 * Every failure to run (missing registry, malformed scheme, missing HMAC key, a configured
 * path outside the repo) is a FAIL report, never an exception and never a pass.
 */
public final class SecrecyAudit {

    private static final Logger log = LogManager.getLogger(SecrecyAudit.class);

    private final DataFiles data;
    private final ContentHasher hasher;
    private final CorpusScanner scanner;
    private final KeyProvider keys;
    private final Settings settings;

    /** Repo-relative locations and defaults used by the audit. */
    public static final class Settings {
        public String suiteRegistry = "control_plane/evals/suites/registry.json";
        public String secretHashRegistry = "control_plane/evals/suites/hash_registries/secret_suite_hashes_v1.json";
        public List<String> protectedPaths = CorpusScanner.DEFAULT_PROTECTED_PATHS;
        public String defaultKeyName = SecrecyFingerprinter.DEFAULT_KEY_NAME;
    }

    public SecrecyAudit(DataFiles data, CorpusScanner scanner, KeyProvider keys, Settings settings) {
        this.data = Objects.requireNonNull(data, "data");
        this.hasher = new ContentHasher(data);
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.settings = settings == null ? new Settings() : settings;
    }

    public SecrecyAuditReport run() {
        FileIO io = data.io();
        SecrecyAuditReport.Builder r = SecrecyAuditReport.builder();

        SuiteRegistry suites;
        try {
            suites = SuiteRegistry.load(data, io.resolve(settings.suiteRegistry));
        } catch (FingerprintException e) {
            return fail(r, e.getMessage());
        } catch (IllegalArgumentException e) {
            return fail(r, "Invalid suite registry path: " + e.getMessage());
        }
        r.suiteRegistryHash(suites.hash());

        SortedSet<String> secretIds = new TreeSet<>(suites.secretSuites().keySet());
        r.secretSuiteIds(secretIds);
        if (secretIds.isEmpty()) {
            return r.status(SecrecyAuditReport.Status.SKIP).message("No secret suites defined").build();
        }

        SecretHashRegistry registry;
        try {
            Path registryFile = io.resolve(settings.secretHashRegistry);
            registry = SecretHashRegistry.load(data, registryFile);
            r.secretRegistryHash(hasher.fileHash(registryFile));
        } catch (FingerprintException e) {
            return fail(r, e.getMessage());
        } catch (IllegalArgumentException e) {
            return fail(r, "Invalid secret hash registry path: " + e.getMessage());
        } catch (IOException e) {
            return fail(r, "Secret hash registry unreadable: " + e.getMessage());
        }
        r.scheme(registry.scheme());

        SortedSet<String> missing = new TreeSet<>(secretIds);
        missing.removeAll(registry.suiteIds());

        List<String> errors = new ArrayList<>();
        if (!HashValue.verify(registry.suiteRegistryHash(), suites.hash())) {
            errors.add("suite_registry_hash mismatch");
        }

        SortedMap<String, SortedSet<String>> declared = registry.fingerprintIndex();

        ScanResult scan;
        try {
            SecrecyFingerprinter fp = new SecrecyFingerprinter(registry.scheme(), keys, settings.defaultKeyName);
            scan = scanner.scan(fp, settings.protectedPaths);
        } catch (FingerprintException e) {
            return fail(r, e.getMessage());
        }
        errors.addAll(scan.errors());

        List<Leak> leaks = LeakDetector.detect(declared, scan);

        boolean clean = leaks.isEmpty() && errors.isEmpty() && missing.isEmpty();
        SecrecyAuditReport report = r
                .status(clean ? SecrecyAuditReport.Status.PASS : SecrecyAuditReport.Status.FAIL)
                .message(clean ? "Secrecy hash check passed" : "Secrecy hash check failed")
                .missingSecretSuites(missing)
                .secretFingerprintCount(declared.size())
                .scannedFingerprintCount(scan.fingerprints().size())
                .scannedFilesCount(scan.scannedFiles().size())
                .leaks(leaks)
                .errors(errors)
                .build();

        log.info("Secrecy audit: status={}, secretSuites={}, leaks={}, errors={}, missing={}",
                report.status, secretIds.size(), leaks.size(), errors.size(), missing.size());
        return report;
    }

    private static SecrecyAuditReport fail(SecrecyAuditReport.Builder r, String message) {
        log.warn("Secrecy audit failed closed: {}", message);
        return r.status(SecrecyAuditReport.Status.FAIL)
                .message(message)
                .errors(List.of(message))
                .build();
    }
}
