package org.calista.evoalign.secrecy;

import java.util.*;

/**
 * Result of a secrecy audit. {@code PASS} only with no leaks, no errors and no secret suite
 * missing from the hash registry.
 */
public final class SecrecyAuditReport {

    public enum Status { PASS, FAIL, SKIP }

    public final Status status;
    public final String message;
    public final String suiteRegistryHash;      // nullable
    public final String secretRegistryHash;     // nullable
    public final HashingScheme scheme;          // nullable
    public final List<String> secretSuiteIds;
    public final List<String> missingSecretSuites;
    public final int secretFingerprintCount;
    public final int scannedFingerprintCount;
    public final int scannedFilesCount;
    public final List<Leak> leaks;
    public final List<String> errors;

    private SecrecyAuditReport(Builder b) {
        this.status = b.status;
        this.message = b.message;
        this.suiteRegistryHash = b.suiteRegistryHash;
        this.secretRegistryHash = b.secretRegistryHash;
        this.scheme = b.scheme;
        this.secretSuiteIds = List.copyOf(b.secretSuiteIds);
        this.missingSecretSuites = List.copyOf(b.missingSecretSuites);
        this.secretFingerprintCount = b.secretFingerprintCount;
        this.scannedFingerprintCount = b.scannedFingerprintCount;
        this.scannedFilesCount = b.scannedFilesCount;
        this.leaks = List.copyOf(b.leaks);
        this.errors = List.copyOf(b.errors);
    }

    static Builder builder() {
        return new Builder();
    }

    public boolean passed() {
        return status == Status.PASS;
    }

    /** Report as a plain map (snake_case keys) for check details and event logs. */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("status", status.name().toLowerCase(Locale.ROOT));
        out.put("message", message);
        if (suiteRegistryHash != null) out.put("suite_registry_hash", suiteRegistryHash);
        if (secretRegistryHash != null) out.put("secret_registry_hash", secretRegistryHash);
        if (scheme != null) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("scheme_id", scheme.schemeId());
            s.put("digest_prefix", scheme.digestPrefix());
            out.put("hashing_scheme", s);
        }
        out.put("secret_suite_ids", secretSuiteIds);
        out.put("missing_secret_suites", missingSecretSuites);
        out.put("secret_fingerprint_count", secretFingerprintCount);
        out.put("scanned_fingerprint_count", scannedFingerprintCount);
        out.put("scanned_files_count", scannedFilesCount);
        List<Map<String, Object>> l = new ArrayList<>(leaks.size());
        for (Leak leak : leaks) l.add(leak.toMap());
        out.put("leaks", l);
        out.put("errors", errors);
        return out;
    }

    @Override
    public String toString() {
        return "SecrecyAuditReport{" + status + ", leaks=" + leaks.size() + ", errors=" + errors.size()
                + ", missing=" + missingSecretSuites + "}";
    }

    static final class Builder {
        private Status status = Status.FAIL;
        private String message = "";
        private String suiteRegistryHash;
        private String secretRegistryHash;
        private HashingScheme scheme;
        private Collection<String> secretSuiteIds = List.of();
        private Collection<String> missingSecretSuites = List.of();
        private int secretFingerprintCount;
        private int scannedFingerprintCount;
        private int scannedFilesCount;
        private List<Leak> leaks = List.of();
        private List<String> errors = List.of();

        Builder status(Status v) { this.status = v; return this; }
        Builder message(String v) { this.message = v; return this; }
        Builder suiteRegistryHash(String v) { this.suiteRegistryHash = v; return this; }
        Builder secretRegistryHash(String v) { this.secretRegistryHash = v; return this; }
        Builder scheme(HashingScheme v) { this.scheme = v; return this; }
        Builder secretSuiteIds(Collection<String> v) { this.secretSuiteIds = v; return this; }
        Builder missingSecretSuites(Collection<String> v) { this.missingSecretSuites = v; return this; }
        Builder secretFingerprintCount(int v) { this.secretFingerprintCount = v; return this; }
        Builder scannedFingerprintCount(int v) { this.scannedFingerprintCount = v; return this; }
        Builder scannedFilesCount(int v) { this.scannedFilesCount = v; return this; }
        Builder leaks(List<Leak> v) { this.leaks = v; return this; }
        Builder errors(List<String> v) { this.errors = v; return this; }

        SecrecyAuditReport build() {
            return new SecrecyAuditReport(this);
        }
    }
}
