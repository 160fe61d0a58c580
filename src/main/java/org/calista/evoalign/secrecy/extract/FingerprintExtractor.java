package org.calista.evoalign.secrecy.extract;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.evoalign.secrecy.SecrecyFingerprinter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Turns one corpus file into fingerprints. Chosen by file suffix.
 */
public interface FingerprintExtractor {

    /** Suffixes handled, with the dot (".jsonl"). */
    Set<String> suffixes();

    /**
     * Fingerprints of the file's content in document order, duplicates allowed.
     */
    List<String> extract(Path file, SecrecyFingerprinter fingerprinter) throws IOException;

    /**
     * Strings are text blocks, everything else a structured item.
     */
    static void fingerprintValue(JsonNode value, SecrecyFingerprinter fingerprinter, List<String> out) {
        if (value != null && value.isTextual()) {
            fingerprinter.fingerprintTextBlock(value.textValue()).ifPresent(out::add);
        } else {
            out.add(fingerprinter.fingerprintItem(value));
        }
    }
}
