package org.calista.evoalign.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.evoalign.invariant.InvariantCheck;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public final class CheckEvent {
    public static final String TYPE_CHECK = "CHECK";
    public static final String TYPE_RUN = "RUN";

    public String type;        // "CHECK" per invariant result, "RUN" per finished run
    public long tsEpochMs;
    public String runId;
    public String name;        // invariant name, or "ALL" for RUN
    public String result;      // PASS / FAIL / WARN / SKIP
    public String message;
    public Map<String, Object> details;

    public static CheckEvent of(String runId, InvariantCheck check, long tsEpochMs) {
        CheckEvent e = new CheckEvent();
        e.type = TYPE_CHECK;
        e.runId = runId;
        e.name = check.name();
        e.result = check.result().name();
        e.message = check.message();
        e.details = check.details();
        e.tsEpochMs = tsEpochMs;
        return e;
    }

    public static CheckEvent run(String runId, boolean allPassed, String message, long tsEpochMs) {
        CheckEvent e = new CheckEvent();
        e.type = TYPE_RUN;
        e.runId = runId;
        e.name = "ALL";
        e.result = allPassed ? "PASS" : "FAIL";
        e.message = message;
        e.tsEpochMs = tsEpochMs;
        return e;
    }
}
