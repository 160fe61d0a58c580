package org.calista.evoalign.solvency;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Fitted worst-case risk estimate for a hazard/severity pair in a context class.
 *
 * <pre>
 * risk = conservative_epsilon_high (fallback epsilon_high)
 *      + sum over channels of k_low(channel) / allocation(channel)
 *
 * k_low(channel) = k_low_by_channel[channel], else conservative_k_low, else k_low
 * </pre>
 *
 * Channels without a k_low contribute nothing. An allocation {@code <= 0} is an error.
 */
public final class RiskFit {

    private final JsonNode data;
    private final String file;

    public RiskFit(JsonNode data, String file) {
        this.data = Objects.requireNonNull(data, "data");
        this.file = Objects.requireNonNull(file, "file");
    }

    public String hazardId() { return text("hazard_id"); }
    public String severityId() { return text("severity_id"); }
    public String contextClass() { return text("context_class"); }
    public JsonNode data() { return data; }
    public String file() { return file; }

    /**
     * @throws IllegalArgumentException on non-numeric values or non-positive allocations
     */
    public double risk(JsonNode channelAllocations) {
        JsonNode epsilon = data.has("conservative_epsilon_high") ? data.get("conservative_epsilon_high") : data.get("epsilon_high");
        double risk = Numbers.numeric(epsilon, "conservative_epsilon_high", file);

        if (channelAllocations == null || channelAllocations.isNull()) return risk;
        if (!channelAllocations.isObject()) {
            throw new IllegalArgumentException("channel_allocations must be a dict in " + file);
        }

        JsonNode kLowDefault = data.has("conservative_k_low") ? data.get("conservative_k_low") : data.get("k_low");
        JsonNode byChannel = data.get("k_low_by_channel");
        if (byChannel != null && !byChannel.isNull() && !byChannel.isObject()) {
            throw new IllegalArgumentException("k_low_by_channel must be a dict in " + file);
        }

        Iterator<Map.Entry<String, JsonNode>> it = channelAllocations.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String channel = e.getKey();
            double allocation = Numbers.numeric(e.getValue(), "channel_allocations[" + channel + "]", file);
            if (allocation <= 0) {
                throw new IllegalArgumentException("channel_allocations[" + channel + "] must be > 0 in " + file);
            }
            JsonNode kLow = (byChannel != null && byChannel.isObject() && byChannel.has(channel))
                    ? byChannel.get(channel)
                    : kLowDefault;
            if (kLow == null || kLow.isNull()) continue;
            risk += Numbers.numeric(kLow, "k_low[" + channel + "]", file) / allocation;
        }
        return risk;
    }

    private String text(String field) {
        JsonNode v = data.get(field);
        if (v == null || v.isNull()) return null;
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    @Override
    public String toString() {
        return "RiskFit{" + hazardId() + "/" + severityId() + "@" + contextClass() + ", file=" + file + "}";
    }
}
