package org.calista.evoalign.secrecy;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.*;

/**
 * Declared fingerprint scheme of a secret hash registry.
 *
 * <pre>
 * {"scheme_id": "hmac-sha256-v1", "normalization_id": "json-c14n-v1",
 *  "digest_prefix": "hmacsha256:", "key_id": "env:EVOALIGN_SECRECY_HMAC_KEY"}
 * </pre>
 *
 * {@code normalization} is accepted for {@code normalization_id}.
 */
public final class HashingScheme {

    public static final String HMAC_PREFIX = "hmacsha256:";

    private final String schemeId;
    private final String normalizationId;
    private final String digestPrefix;
    private final String keyId; // nullable

    public HashingScheme(String schemeId, String normalizationId, String digestPrefix, String keyId) {
        this.schemeId = Objects.requireNonNull(schemeId, "schemeId");
        this.normalizationId = Objects.requireNonNull(normalizationId, "normalizationId");
        this.digestPrefix = Objects.requireNonNull(digestPrefix, "digestPrefix");
        this.keyId = keyId;
    }

    public static HashingScheme sha256V1() {
        return new HashingScheme("sha256-v1", "json-c14n-v1", "sha256:", null);
    }

    public static HashingScheme fromTree(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new FingerprintException("hashing_scheme must be an object");
        }
        String scheme = text(node, "scheme_id");
        String norm = text(node, "normalization_id");
        if (norm == null) norm = text(node, "normalization");
        String prefix = text(node, "digest_prefix");

        SortedSet<String> missing = new TreeSet<>();
        if (scheme == null) missing.add("scheme_id");
        if (norm == null) missing.add("normalization_id");
        if (prefix == null) missing.add("digest_prefix");
        if (!missing.isEmpty()) {
            throw new FingerprintException("hashing_scheme missing fields: " + missing);
        }
        return new HashingScheme(scheme, norm, prefix, text(node, "key_id"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        return v.isValueNode() ? v.asText() : v.toString();
    }

    public String schemeId() { return schemeId; }
    public String normalizationId() { return normalizationId; }
    public String digestPrefix() { return digestPrefix; }
    public Optional<String> keyId() { return Optional.ofNullable(keyId); }

    public boolean usesHmac() {
        return schemeId.startsWith("hmac") || digestPrefix.startsWith(HMAC_PREFIX);
    }

    /**
     * Key lookup name: the part after the first ':' of key_id ("env:NAME" -> "NAME"),
     * the whole key_id otherwise, {@code defaultName} when key_id is absent.
     */
    public String keyLookupName(String defaultName) {
        String id = (keyId == null || keyId.isEmpty()) ? defaultName : keyId;
        int colon = id.indexOf(':');
        return colon < 0 ? id : id.substring(colon + 1);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("scheme_id", schemeId);
        out.put("normalization_id", normalizationId);
        out.put("digest_prefix", digestPrefix);
        if (keyId != null) out.put("key_id", keyId);
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HashingScheme s)) return false;
        return schemeId.equals(s.schemeId) && normalizationId.equals(s.normalizationId)
                && digestPrefix.equals(s.digestPrefix) && Objects.equals(keyId, s.keyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemeId, normalizationId, digestPrefix, keyId);
    }

    @Override
    public String toString() {
        return "HashingScheme{" + schemeId + ", prefix=" + digestPrefix + (keyId == null ? "" : ", key=" + keyId) + "}";
    }
}
