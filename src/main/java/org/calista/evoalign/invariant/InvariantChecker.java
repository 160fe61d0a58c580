package org.calista.evoalign.invariant;

import java.io.IOException;

/**
 * One CI invariant over the repository's governance artifacts.
 */
public interface InvariantChecker {

    /** Stable check name, e.g. {@code BUDGET_SOLVENCY}. */
    String name();

    /**
     * Domain problems are reported as FAIL results; I/O errors may propagate and are
     * turned into FAIL by {@link InvariantRunner}.
     */
    InvariantCheck check() throws IOException;
}
