package org.calista.evoalign.merkle;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One inclusion-proof step: the sibling hash and which side of the current node it sits on.
 * Position is kept as written so that malformed proofs can be reported as unverified
 * instead of failing to parse.
 */
public record ProofStep(String hash, String position) {

    public static final String LEFT = "left";
    public static final String RIGHT = "right";

    public static ProofStep left(String hash) {
        return new ProofStep(hash, LEFT);
    }

    public static ProofStep right(String hash) {
        return new ProofStep(hash, RIGHT);
    }

    /** {@code {"hash": ..., "position": ...}}; absent fields read as "". */
    public static ProofStep fromTree(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        JsonNode h = node.get("hash");
        JsonNode p = node.get("position");
        return new ProofStep(h == null || h.isNull() ? "" : h.asText(), p == null || p.isNull() ? "" : p.asText());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("hash", hash);
        out.put("position", position);
        return out;
    }
}
