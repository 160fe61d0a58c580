package org.calista.evoalign.solvency;

import java.util.List;

/**
 * Outcome of a budget-solvency evaluation over all plans and hazard/severity pairs.
 */
public record SolvencyReport(int plansChecked, int hazardPairs, List<SolvencyFailure> failures) {

    public SolvencyReport {
        failures = List.copyOf(failures);
    }

    public boolean solvent() {
        return failures.isEmpty();
    }
}
