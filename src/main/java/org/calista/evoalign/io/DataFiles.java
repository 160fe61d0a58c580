package org.calista.evoalign.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structured data files (.json / .yaml / .yml) read into Jackson trees.
 *
 * An empty document reads as {@link NullNode}, never as a missing node.
 */
public final class DataFiles {

    public static final Set<String> DATA_SUFFIXES = Set.of(".json", ".yaml", ".yml");

    private final FileIO io;
    private final ObjectMapper json;
    private final ObjectMapper yaml;

    public DataFiles(FileIO io) {
        this(io, defaultJsonMapper());
    }

    public DataFiles(FileIO io, ObjectMapper json) {
        this.io = Objects.requireNonNull(io, "io");
        this.json = Objects.requireNonNull(json, "json");
        this.yaml = new ObjectMapper(new YAMLFactory());
    }

    public static ObjectMapper defaultJsonMapper() {
        ObjectMapper om = new ObjectMapper();
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        om.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        return om;
    }

    public FileIO io() { return io; }
    public ObjectMapper jsonMapper() { return json; }
    public ObjectMapper yamlMapper() { return yaml; }

    public static boolean isStructured(Path file) {
        return DATA_SUFFIXES.contains(FileIO.suffixOf(file));
    }

    /**
     * Parses by suffix: ".json" strictly as JSON, everything else as YAML.
     */
    public JsonNode read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        String text = io.readString(file);
        ObjectMapper m = ".json".equals(FileIO.suffixOf(file)) ? json : yaml;
        return orNull(m.readTree(text));
    }

    public JsonNode parseJson(String text) throws IOException {
        return orNull(json.readTree(text));
    }

    /**
     * All data files under {@code dir}, recursively, sorted.
     */
    public List<Path> list(Path dir) throws IOException {
        return io.walk(dir, DATA_SUFFIXES);
    }

    private static JsonNode orNull(JsonNode n) {
        return (n == null || n.isMissingNode()) ? NullNode.getInstance() : n;
    }
}
