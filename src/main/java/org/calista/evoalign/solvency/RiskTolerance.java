package org.calista.evoalign.solvency;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maximum acceptable risk (tau) for a hazard/severity pair in a context class, as declared
 * by a safety contract. {@code tau} stays raw until evaluation.
 */
public record RiskTolerance(String hazardId, String severityId, String contextClass, JsonNode tau, String file) {

    public double tauValue() {
        return Numbers.numeric(tau, "tau", file);
    }
}
