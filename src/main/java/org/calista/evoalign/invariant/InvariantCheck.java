package org.calista.evoalign.invariant;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one invariant check.
 *
 * @param details optional structured payload (failures, audit report); null when absent
 */
public record InvariantCheck(String name, InvariantResult result, String message, Map<String, Object> details) {

    public InvariantCheck {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(result, "result");
        message = message == null ? "" : message;
        details = details == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static InvariantCheck pass(String name, String message) {
        return new InvariantCheck(name, InvariantResult.PASS, message, null);
    }

    public static InvariantCheck skip(String name, String message) {
        return new InvariantCheck(name, InvariantResult.SKIP, message, null);
    }

    public static InvariantCheck fail(String name, String message) {
        return new InvariantCheck(name, InvariantResult.FAIL, message, null);
    }

    /** FAIL with {@code details.failures}. */
    public static InvariantCheck failures(String name, String message, List<Map<String, Object>> failures) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("failures", failures);
        return new InvariantCheck(name, InvariantResult.FAIL, message, d);
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> failureList() {
        if (details == null) return List.of();
        Object f = details.get("failures");
        return f instanceof List<?> l ? (List<Map<String, Object>>) l : List.of();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("name", name);
        out.put("result", result.name());
        out.put("message", message);
        out.put("details", details);
        return out;
    }
}
