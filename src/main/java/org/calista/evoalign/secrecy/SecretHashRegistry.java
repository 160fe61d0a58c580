package org.calista.evoalign.secrecy;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.evoalign.canonical.ContentHasher;
import org.calista.evoalign.canonical.HashValue;
import org.calista.evoalign.io.DataFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Declared fingerprints of secret evaluation suites.
 *
 * <pre>
 * {"registry_version": "1.0", "generated_at": "...",
 *  "hashing_scheme": {...},
 *  "suite_registry_hash": "sha256:...",
 *  "suites": [{"suite_id": "...", "test_case_fingerprints": [...],
 *              "suite_fingerprint_root": "sha256:...", "n_test_cases": 2}]}
 * </pre>
 *
 * {@code generated_at} is optional; the other top-level fields are required and non-null.
 */
public final class SecretHashRegistry {

    private static final List<String> REQUIRED = List.of("registry_version", "hashing_scheme", "suite_registry_hash", "suites");

    private final String registryVersion;
    private final String generatedAt; // nullable
    private final HashingScheme scheme;
    private final String suiteRegistryHash; // nullable
    private final List<Suite> suites;

    /** One registry entry. Fingerprint list kept as declared, duplicates included. */
    public record Suite(String suiteId, List<String> fingerprints, String fingerprintRoot, Integer declaredCount) {
        public Suite {
            fingerprints = List.copyOf(fingerprints);
        }
    }

    private SecretHashRegistry(String registryVersion, String generatedAt, HashingScheme scheme,
                               String suiteRegistryHash, List<Suite> suites) {
        this.registryVersion = registryVersion;
        this.generatedAt = generatedAt;
        this.scheme = scheme;
        this.suiteRegistryHash = suiteRegistryHash;
        this.suites = List.copyOf(suites);
    }

    public static SecretHashRegistry load(DataFiles data, Path file) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(file, "file");
        if (!data.io().exists(file)) {
            throw new FingerprintException("Secret hash registry not found: " + data.io().relativeName(file));
        }
        try {
            return fromTree(data.read(file));
        } catch (IOException e) {
            throw new FingerprintException("Secret hash registry unreadable: " + e.getMessage(), e);
        }
    }

    public static SecretHashRegistry fromTree(JsonNode doc) {
        if (doc == null || !doc.isObject()) {
            throw new FingerprintException("Secret hash registry must be an object");
        }
        for (String f : REQUIRED) {
            if (!doc.hasNonNull(f)) throw new FingerprintException("Secret hash registry missing '" + f + "'");
        }
        HashingScheme scheme = HashingScheme.fromTree(doc.get("hashing_scheme"));

        List<Suite> suites = new ArrayList<>();
        JsonNode arr = doc.get("suites");
        if (arr != null && arr.isArray()) {
            for (JsonNode s : arr) {
                if (!s.isObject()) continue;
                List<String> fps = new ArrayList<>();
                JsonNode list = s.get("test_case_fingerprints");
                if (list != null && list.isArray()) {
                    for (JsonNode fp : list) {
                        if (fp.isTextual()) fps.add(fp.textValue());
                    }
                }
                JsonNode n = s.get("n_test_cases");
                suites.add(new Suite(
                        text(s, "suite_id"),
                        fps,
                        text(s, "suite_fingerprint_root"),
                        n != null && n.isIntegralNumber() ? n.intValue() : null));
            }
        } else if (arr != null && !arr.isNull()) {
            throw new FingerprintException("Secret hash registry 'suites' must be a list");
        }

        return new SecretHashRegistry(text(doc, "registry_version"), text(doc, "generated_at"),
                scheme, text(doc, "suite_registry_hash"), suites);
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        return v.asText();
    }

    public String registryVersion() { return registryVersion; }
    public Optional<String> generatedAt() { return Optional.ofNullable(generatedAt); }
    public HashingScheme scheme() { return scheme; }
    public String suiteRegistryHash() { return suiteRegistryHash; }
    public List<Suite> suites() { return suites; }

    public SortedSet<String> suiteIds() {
        SortedSet<String> ids = new TreeSet<>();
        for (Suite s : suites) if (s.suiteId() != null) ids.add(s.suiteId());
        return ids;
    }

    /** Every declared fingerprint. */
    public SortedSet<String> fingerprints() {
        SortedSet<String> out = new TreeSet<>();
        for (Suite s : suites) out.addAll(s.fingerprints());
        return out;
    }

    /** fingerprint -> ids of the suites declaring it */
    public SortedMap<String, SortedSet<String>> fingerprintIndex() {
        SortedMap<String, SortedSet<String>> idx = new TreeMap<>();
        for (Suite s : suites) {
            for (String fp : s.fingerprints()) {
                SortedSet<String> ids = idx.computeIfAbsent(fp, k -> new TreeSet<>());
                if (s.suiteId() != null) ids.add(s.suiteId());
            }
        }
        return idx;
    }

    /**
     * {@code "sha256:" + hex(SHA-256(join("\n", sorted(fingerprints))))}.
     */
    public static String suiteFingerprintRoot(Collection<String> fingerprints) {
        List<String> sorted = new ArrayList<>(fingerprints);
        Collections.sort(sorted);
        return HashValue.SHA256 + ":" + ContentHasher.sha256Hex(String.join("\n", sorted));
    }
}
