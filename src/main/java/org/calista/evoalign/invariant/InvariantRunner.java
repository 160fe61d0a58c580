package org.calista.evoalign.invariant;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs checks in order. A check that throws becomes a FAIL with the exception message;
 * one broken check never hides the others.
 */
public final class InvariantRunner {

    private static final Logger log = LogManager.getLogger(InvariantRunner.class);

    private final List<InvariantChecker> checkers;

    public InvariantRunner(List<InvariantChecker> checkers) {
        this.checkers = List.copyOf(Objects.requireNonNull(checkers, "checkers"));
    }

    public List<InvariantChecker> checkers() {
        return checkers;
    }

    public InvariantReport run() {
        List<InvariantCheck> results = new ArrayList<>(checkers.size());
        for (InvariantChecker c : checkers) {
            InvariantCheck r = runOne(c);
            log.info("{}: {} - {}", r.name(), r.result(), r.message());
            results.add(r);
        }
        return new InvariantReport(results);
    }

    static InvariantCheck runOne(InvariantChecker c) {
        try {
            InvariantCheck r = c.check();
            return r != null ? r : InvariantCheck.fail(c.name(), "Check produced no result");
        } catch (IOException | RuntimeException e) {
            log.warn("Invariant {} aborted", c.name(), e);
            String m = e.getMessage();
            return InvariantCheck.fail(c.name(), (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m);
        }
    }
}
