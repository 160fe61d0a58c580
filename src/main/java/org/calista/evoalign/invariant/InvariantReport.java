package org.calista.evoalign.invariant;

import java.util.List;
import java.util.Optional;

/**
 * All check results of one run. Passes unless some check FAILed; WARN and SKIP do not block.
 */
public record InvariantReport(List<InvariantCheck> results) {

    public InvariantReport {
        results = List.copyOf(results);
    }

    public boolean allPassed() {
        return results.stream().noneMatch(r -> r.result() == InvariantResult.FAIL);
    }

    public Optional<InvariantCheck> find(String name) {
        return results.stream().filter(r -> r.name().equals(name)).findFirst();
    }

    public long count(InvariantResult result) {
        return results.stream().filter(r -> r.result() == result).count();
    }
}
