package org.calista.evoalign.secrecy.extract.impl;

import org.calista.evoalign.io.FileIO;
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
 * Plain text / markdown: every paragraph (blank-line separated) plus the whole document,
 * so both partial quotes and verbatim copies are caught.
 */
public final class TextBlockExtractor implements FingerprintExtractor {

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\n\\s*\n", Pattern.UNICODE_CHARACTER_CLASS);

    private final FileIO io;

    public TextBlockExtractor(FileIO io) {
        this.io = Objects.requireNonNull(io, "io");
    }

    @Override
    public Set<String> suffixes() {
        return Set.of(".txt", ".md");
    }

    @Override
    public List<String> extract(Path file, SecrecyFingerprinter fingerprinter) throws IOException {
        return extractText(io.readStringLenient(file), fingerprinter);
    }

    static List<String> extractText(String text, SecrecyFingerprinter fingerprinter) {
        String normalized = SecrecyFingerprinter.normalizeLineEndings(text);
        List<String> out = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(normalized)) {
            fingerprinter.fingerprintTextBlock(paragraph).ifPresent(out::add);
        }
        fingerprinter.fingerprintTextBlock(normalized).ifPresent(out::add);
        return out;
    }
}
