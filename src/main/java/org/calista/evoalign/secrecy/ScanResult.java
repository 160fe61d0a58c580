package org.calista.evoalign.secrecy;

import java.util.*;

/**
 * Outcome of one corpus scan: every fingerprint seen, which files produced it, the files
 * scanned and the per-file soft errors. Created fresh per scan.
 *
 * A non-empty error list means the corpus cannot be certified clean.
 */
public final class ScanResult {

    private final SortedSet<String> fingerprints;
    private final SortedMap<String, SortedSet<String>> sources;
    private final List<String> scannedFiles;
    private final List<String> errors;

    ScanResult(SortedMap<String, SortedSet<String>> sources, List<String> scannedFiles, List<String> errors) {
        SortedMap<String, SortedSet<String>> src = new TreeMap<>();
        sources.forEach((fp, files) -> src.put(fp, Collections.unmodifiableSortedSet(new TreeSet<>(files))));
        this.sources = Collections.unmodifiableSortedMap(src);
        this.fingerprints = Collections.unmodifiableSortedSet(new TreeSet<>(src.keySet()));
        this.scannedFiles = List.copyOf(scannedFiles);
        this.errors = List.copyOf(errors);
    }

    public SortedSet<String> fingerprints() {
        return fingerprints;
    }

    /** fingerprint -> repo-relative files that produced it */
    public SortedMap<String, SortedSet<String>> sources() {
        return sources;
    }

    public SortedSet<String> sourcesOf(String fingerprint) {
        SortedSet<String> s = sources.get(fingerprint);
        return s == null ? Collections.emptySortedSet() : s;
    }

    public List<String> scannedFiles() {
        return scannedFiles;
    }

    public List<String> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "ScanResult{files=" + scannedFiles.size() + ", fingerprints=" + fingerprints.size()
                + ", errors=" + errors.size() + "}";
    }
}
