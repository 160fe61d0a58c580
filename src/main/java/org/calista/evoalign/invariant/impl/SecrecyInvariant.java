package org.calista.evoalign.invariant.impl;

import org.calista.evoalign.invariant.InvariantCheck;
import org.calista.evoalign.invariant.InvariantChecker;
import org.calista.evoalign.invariant.InvariantResult;
import org.calista.evoalign.secrecy.SecrecyAudit;
import org.calista.evoalign.secrecy.SecrecyAuditReport;

import java.util.Objects;

/**
 * Secret suite fingerprints do not appear in protected artifacts.
 * The full audit report travels in the check details.
 */
public final class SecrecyInvariant implements InvariantChecker {

    public static final String NAME = "SECRECY";

    private final SecrecyAudit audit;

    public SecrecyInvariant(SecrecyAudit audit) {
        this.audit = Objects.requireNonNull(audit, "audit");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public InvariantCheck check() {
        SecrecyAuditReport report = audit.run();
        return switch (report.status) {
            case SKIP -> new InvariantCheck(NAME, InvariantResult.SKIP, report.message, report.toMap());
            case FAIL -> new InvariantCheck(NAME, InvariantResult.FAIL, report.message, report.toMap());
            case PASS -> new InvariantCheck(NAME, InvariantResult.PASS,
                    "Secret suite fingerprints not found in protected artifacts", report.toMap());
        };
    }
}
