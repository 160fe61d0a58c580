package org.calista.evoalign.solvency;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.evoalign.lattice.ContextLattice;
import org.calista.evoalign.lattice.LatticeException;

import java.util.*;

/**
 * BudgetSolvency: does every oversight plan keep worst-case risk within the strictest
 * applicable tolerance?
 *
 * <p>For each plan and each hazard/severity pair declared by any tolerance:</p>
 * <ul>
 *   <li>applicable tolerances: those whose context covers the plan's context;
 *       strictest tau = min</li>
 *   <li>applicable fits: those whose context covers the plan's context;
 *       worst-case risk = max of {@link RiskFit#risk}</li>
 *   <li>solvent iff worst-case risk {@code <=} strictest tau</li>
 * </ul>
 *
 * Aggregation is min/max, never an average.
 */
public final class BudgetSolvency {

    private static final Logger log = LogManager.getLogger(BudgetSolvency.class);

    private final ContextLattice lattice;

    public BudgetSolvency(ContextLattice lattice) {
        this.lattice = Objects.requireNonNull(lattice, "lattice");
    }

    public SolvencyReport evaluate(List<OversightPlan> plans, List<RiskTolerance> tolerances, List<RiskFit> fits) {
        Objects.requireNonNull(plans, "plans");
        Objects.requireNonNull(tolerances, "tolerances");
        Objects.requireNonNull(fits, "fits");

        SortedSet<HazardPair> pairs = new TreeSet<>();
        for (RiskTolerance t : tolerances) {
            if (notBlank(t.hazardId()) && notBlank(t.severityId())) {
                pairs.add(new HazardPair(t.hazardId(), t.severityId()));
            }
        }

        List<SolvencyFailure> failures = new ArrayList<>();
        for (OversightPlan plan : plans) {
            for (HazardPair pair : pairs) {
                evaluatePair(plan, pair, tolerances, fits, failures);
            }
        }

        log.info("Budget solvency: plans={}, hazardPairs={}, failures={}", plans.size(), pairs.size(), failures.size());
        return new SolvencyReport(plans.size(), pairs.size(), failures);
    }

    private void evaluatePair(OversightPlan plan, HazardPair pair,
                              List<RiskTolerance> tolerances, List<RiskFit> fits,
                              List<SolvencyFailure> failures) {
        String label = plan.label();
        String planContext = plan.contextClass();

        // ---- tolerances: strictest tau ----
        List<RiskTolerance> applicable = new ArrayList<>();
        for (RiskTolerance t : tolerances) {
            if (!pair.matches(t.hazardId(), t.severityId())) continue;
            if (!notBlank(t.contextClass())) {
                failures.add(failure(label, "Tolerance missing context_class", pair, t.file()));
                continue;
            }
            try {
                if (lattice.covers(t.contextClass(), planContext)) applicable.add(t);
            } catch (LatticeException e) {
                failures.add(failure(label, e.getMessage(), pair, t.file()));
            }
        }
        if (applicable.isEmpty()) {
            failures.add(failure(label, "No tolerance covers plan context", pair, plan.file()));
            return;
        }

        double strictestTau = Double.POSITIVE_INFINITY;
        boolean anyTau = false;
        for (RiskTolerance t : applicable) {
            try {
                strictestTau = Math.min(strictestTau, t.tauValue());
                anyTau = true;
            } catch (IllegalArgumentException e) {
                failures.add(failure(label, e.getMessage(), pair, t.file()));
            }
        }
        if (!anyTau) {
            failures.add(failure(label, "No valid tau values found", pair, plan.file()));
            return;
        }

        // ---- fits: worst-case risk ----
        List<RiskFit> applicableFits = new ArrayList<>();
        for (RiskFit f : fits) {
            if (!pair.matches(f.hazardId(), f.severityId())) continue;
            if (!notBlank(f.contextClass())) {
                failures.add(failure(label, "Risk fit missing context_class", pair, f.file()));
                continue;
            }
            try {
                if (lattice.covers(f.contextClass(), planContext)) applicableFits.add(f);
            } catch (LatticeException e) {
                failures.add(failure(label, e.getMessage(), pair, f.file()));
            }
        }
        if (applicableFits.isEmpty()) {
            failures.add(failure(label, "No risk fit covers plan context", pair, plan.file()));
            return;
        }

        double worstRisk = Double.NEGATIVE_INFINITY;
        boolean anyRisk = false;
        for (RiskFit f : applicableFits) {
            try {
                worstRisk = Math.max(worstRisk, f.risk(plan.channelAllocations()));
                anyRisk = true;
            } catch (IllegalArgumentException e) {
                failures.add(failure(label, e.getMessage(), pair, f.file()));
            }
        }
        if (!anyRisk) {
            failures.add(failure(label, "No computable risk from applicable fits", pair, plan.file()));
            return;
        }

        if (worstRisk > strictestTau) {
            failures.add(failure(label,
                    "Risk " + Numbers.g6(worstRisk) + " exceeds tau " + Numbers.g6(strictestTau),
                    pair, plan.file()));
        }
    }

    private static SolvencyFailure failure(String plan, String reason, HazardPair pair, String file) {
        return new SolvencyFailure(plan, reason, pair.hazardId, pair.severityId, file == null ? "" : file);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isEmpty();
    }

    private record HazardPair(String hazardId, String severityId) implements Comparable<HazardPair> {
        boolean matches(String h, String s) {
            return hazardId.equals(h) && severityId.equals(s);
        }

        @Override
        public int compareTo(HazardPair o) {
            int c = hazardId.compareTo(o.hazardId);
            return c != 0 ? c : severityId.compareTo(o.severityId);
        }
    }
}
