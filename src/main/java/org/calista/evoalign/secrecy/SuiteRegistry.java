package org.calista.evoalign.secrecy;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.evoalign.canonical.ContentHasher;
import org.calista.evoalign.io.DataFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation suite registry and its content hash. Secret suites are those with
 * {@code secrecy_level: secret}.
 */
public final class SuiteRegistry {

    public static final String SECRET = "secret";

    private final JsonNode document;
    private final String hash;

    private SuiteRegistry(JsonNode document, String hash) {
        this.document = document;
        this.hash = hash;
    }

    public static SuiteRegistry load(DataFiles data, Path file) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(file, "file");
        if (!data.io().exists(file)) {
            throw new FingerprintException("Suite registry not found");
        }
        JsonNode doc;
        try {
            doc = data.read(file);
        } catch (IOException e) {
            throw new FingerprintException("Suite registry unreadable: " + e.getMessage(), e);
        }
        if (!doc.isObject()) {
            throw new FingerprintException("Suite registry must be an object");
        }
        return new SuiteRegistry(doc, ContentHasher.contentHash(doc));
    }

    public JsonNode document() {
        return document;
    }

    /** Canonical content hash of the registry file. */
    public String hash() {
        return hash;
    }

    /** suite_id -> entry, in registry order */
    public Map<String, JsonNode> secretSuites() {
        Map<String, JsonNode> out = new LinkedHashMap<>();
        JsonNode suites = document.get("suites");
        if (suites == null || !suites.isArray()) return out;
        for (JsonNode s : suites) {
            if (!s.isObject()) continue;
            JsonNode level = s.get("secrecy_level");
            JsonNode id = s.get("suite_id");
            if (level != null && SECRET.equals(level.asText()) && id != null && !id.isNull() && !id.asText().isEmpty()) {
                out.put(id.asText(), s);
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
