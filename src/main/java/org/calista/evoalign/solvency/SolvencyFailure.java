package org.calista.evoalign.solvency;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One reason a plan is not provably solvent for a hazard/severity pair.
 */
public record SolvencyFailure(String plan, String reason, String hazardId, String severityId, String file) {

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("plan", plan);
        out.put("reason", reason);
        out.put("hazard_id", hazardId);
        out.put("severity_id", severityId);
        out.put("file", file);
        return out;
    }
}
