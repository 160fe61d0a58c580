package org.calista.evoalign.secrecy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A secret fingerprint found in the scanned corpus: who declared it, where it was found.
 */
public record Leak(String fingerprint, List<String> suiteIds, List<String> files) {

    public Leak {
        suiteIds = List.copyOf(suiteIds);
        files = List.copyOf(files);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("fingerprint", fingerprint);
        out.put("suite_ids", suiteIds);
        out.put("files", files);
        return out;
    }
}
