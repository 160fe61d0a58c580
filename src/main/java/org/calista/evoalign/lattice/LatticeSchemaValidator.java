package org.calista.evoalign.lattice;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.calista.evoalign.io.DataFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON-Schema (draft 7) gate for lattice documents. Fails closed: an unreadable schema is
 * a load failure, not a skipped check.
 */
public final class LatticeSchemaValidator {

    private final JsonSchema schema;
    private final Path source;

    private LatticeSchemaValidator(JsonSchema schema, Path source) {
        this.schema = schema;
        this.source = source;
    }

    public static LatticeSchemaValidator load(DataFiles data, Path schemaFile) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(schemaFile, "schemaFile");
        if (!data.io().exists(schemaFile)) {
            throw new LatticeException("Schema file not found: " + schemaFile);
        }
        JsonNode node;
        try {
            node = data.read(schemaFile);
        } catch (IOException e) {
            throw new LatticeException("Schema file not readable: " + schemaFile + ": " + e.getMessage(), e);
        }
        return fromTree(node, schemaFile);
    }

    public static LatticeSchemaValidator fromTree(JsonNode schemaNode, Path source) {
        if (schemaNode == null || !schemaNode.isObject()) {
            throw new LatticeException("Schema must be a JSON object: " + source);
        }
        try {
            JsonSchema s = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7).getSchema(schemaNode);
            return new LatticeSchemaValidator(s, source);
        } catch (RuntimeException e) {
            throw new LatticeException("Invalid lattice schema " + source + ": " + e.getMessage(), e);
        }
    }

    /** Validation messages, sorted; empty when the document conforms. */
    public List<String> problems(JsonNode document) {
        Set<ValidationMessage> msgs = schema.validate(document);
        return msgs.stream().map(ValidationMessage::getMessage).sorted().collect(Collectors.toList());
    }

    public void validate(JsonNode document) {
        List<String> problems = problems(document);
        if (!problems.isEmpty()) {
            throw new LatticeException("Lattice schema validation failed: " + String.join("; ", problems));
        }
    }

    public Path source() {
        return source;
    }
}
