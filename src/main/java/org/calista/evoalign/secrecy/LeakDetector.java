package org.calista.evoalign.secrecy;

import java.util.*;

/**
 * Intersects declared secret fingerprints with a scan.
 */
public final class LeakDetector {

    private LeakDetector() {}

    public static List<Leak> detect(SecretHashRegistry registry, ScanResult scan) {
        Objects.requireNonNull(registry, "registry");
        return detect(registry.fingerprintIndex(), scan);
    }

    /**
     * @param declared fingerprint -> declaring suite ids
     * @return leaks sorted by fingerprint, suite ids and files sorted
     */
    public static List<Leak> detect(Map<String, ? extends Collection<String>> declared, ScanResult scan) {
        Objects.requireNonNull(declared, "declared");
        Objects.requireNonNull(scan, "scan");

        SortedSet<String> hits = new TreeSet<>(declared.keySet());
        hits.retainAll(scan.fingerprints());

        List<Leak> leaks = new ArrayList<>(hits.size());
        for (String fp : hits) {
            List<String> suites = new ArrayList<>(new TreeSet<>(declared.get(fp)));
            leaks.add(new Leak(fp, suites, new ArrayList<>(scan.sourcesOf(fp))));
        }
        return leaks;
    }
}
