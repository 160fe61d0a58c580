package org.calista.evoalign.secrecy.extract.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.calista.evoalign.io.DataFiles;
import org.calista.evoalign.secrecy.SecrecyFingerprinter;
import org.calista.evoalign.secrecy.extract.FingerprintExtractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One JSON value per non-blank line. A line that is not valid JSON is fingerprinted as
 * raw text so one bad record cannot hide the rest of the file.
 */
public final class JsonLinesExtractor implements FingerprintExtractor {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    private final DataFiles data;

    public JsonLinesExtractor(DataFiles data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    @Override
    public Set<String> suffixes() {
        return Set.of(".jsonl");
    }

    @Override
    public List<String> extract(Path file, SecrecyFingerprinter fingerprinter) throws IOException {
        String text = data.io().readStringLenient(file);
        List<String> out = new ArrayList<>();
        for (String line : LINE_BREAK.split(text)) {
            if (line.isBlank()) continue;
            FingerprintExtractor.fingerprintValue(parse(line), fingerprinter, out);
        }
        return out;
    }

    private JsonNode parse(String line) {
        try {
            return data.parseJson(line);
        } catch (IOException e) {
            // not JSON: the raw line is the record
            return TextNode.valueOf(line);
        }
    }
}
