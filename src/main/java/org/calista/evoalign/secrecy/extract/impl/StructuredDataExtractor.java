package org.calista.evoalign.secrecy.extract.impl;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.secrecy.SecrecyFingerprinter;
import org.calista.evoalign.secrecy.extract.FingerprintExtractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * JSON / YAML documents.
 *
 * Items are taken from the first list-valued key in {@link #LIST_KEYS} order; a top-level
 * list is itself the item list; a null document has none; anything else is one item.
 */
public final class StructuredDataExtractor implements FingerprintExtractor {

    public static final List<String> LIST_KEYS = List.of("items", "examples", "prompts", "test_cases", "records");

    private final DataFiles data;

    public StructuredDataExtractor(DataFiles data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    @Override
    public Set<String> suffixes() {
        return DataFiles.DATA_SUFFIXES;
    }

    @Override
    public List<String> extract(Path file, SecrecyFingerprinter fingerprinter) throws IOException {
        JsonNode doc = data.read(file);
        List<String> out = new ArrayList<>();
        for (JsonNode item : items(doc)) {
            FingerprintExtractor.fingerprintValue(item, fingerprinter, out);
        }
        return out;
    }

    static List<JsonNode> items(JsonNode doc) {
        if (doc == null || doc.isNull() || doc.isMissingNode()) return List.of();
        if (doc.isArray()) return elements(doc);
        if (doc.isObject()) {
            for (String key : LIST_KEYS) {
                JsonNode v = doc.get(key);
                if (v != null && v.isArray()) return elements(v);
            }
        }
        return List.of(doc);
    }

    private static List<JsonNode> elements(JsonNode array) {
        List<JsonNode> out = new ArrayList<>(array.size());
        array.forEach(out::add);
        return out;
    }
}
