package org.calista.evoalign.invariant.impl;

import org.calista.evoalign.invariant.GovernanceArtifacts;
import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantChecker;
import org.calista.evoalign.lattice.LatticeException;
import org.calista.evoalign.solvency.BudgetSolvency;
import org.calista.evoalign.solvency.OversightPlan;
import org.calista.evoalign.solvency.RiskFit;
import org.calista.evoalign.solvency.RiskTolerance;
import org.calista.evoalign.solvency.SolvencyFailure;
import org.calista.evoalign.solvency.SolvencyReport;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Oversight plans satisfy the strictest tolerances under worst-case risk fits.
 */
public final class BudgetSolvencyInvariant implements InvariantChecker {

    public static final String NAME = "BUDGET_SOLVENCY";

    private final GovernanceArtifacts artifacts;

    public BudgetSolvencyInvariant(GovernanceArtifacts artifacts) {
        this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public InvariantCheck check() throws IOException {
        GovernanceArtifacts.LoadedLattice loaded;
        try {
            loaded = artifacts.loadLattice();
        } catch (LatticeException e) {
            return InvariantCheck.fail(NAME, e.getMessage());
        }

        List<OversightPlan> plans = artifacts.oversightPlans();
        if (plans.isEmpty()) {
            return InvariantCheck.skip(NAME, "No oversight plans found (lattice: " + loaded.file().getFileName() + ")");
        }

        List<RiskTolerance> tolerances = artifacts.tolerances();
        if (tolerances.isEmpty()) {
            return InvariantCheck.fail(NAME, "No safety contract tolerances found");
        }

        List<RiskFit> fits = artifacts.riskFits();
        if (fits.isEmpty()) {
            return InvariantCheck.fail(NAME, "No risk fits found");
        }

        SolvencyReport report = new BudgetSolvency(loaded.lattice()).evaluate(plans, tolerances, fits);
        if (!report.solvent()) {
            List<Map<String, Object>> failures = report.failures().stream()
                    .map(SolvencyFailure::toMap)
                    .collect(Collectors.toList());
            return InvariantCheck.failures(NAME, failures.size() + " budget solvency issue(s) detected", failures);
        }

        return InvariantCheck.pass(NAME, "Verified " + report.plansChecked() + " oversight plan(s) across "
                + report.hazardPairs() + " hazard/severity pair(s)");
    }
}
