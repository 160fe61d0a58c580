package org.calista.evoalign.solvency;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A deployment's oversight configuration for one context class.
 *
 * @param channelAllocations raw {@code channel -> allocation} object; never null (empty object when absent)
 */
public record OversightPlan(String planId, String contextClass, JsonNode channelAllocations, String file) {

    /** plan_id, or the context class for unnamed plans. */
    public String label() {
        return planId != null && !planId.isEmpty() ? planId : contextClass;
    }
}
