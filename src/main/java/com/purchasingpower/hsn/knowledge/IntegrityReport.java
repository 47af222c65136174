package com.purchasingpower.hsn.knowledge;

import java.util.List;

/**
 * Result of a graph health check. Violations are warnings; they never stop a
 * running session.
 *
 * @since 1.0.0
 */
public record IntegrityReport(int checkedCodes, List<Violation> violations) {

    public IntegrityReport {
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    public record Violation(String nodeId, Kind kind, String detail) {
    }

    public enum Kind {
        /**
         * Code node without an incoming edge from a Subheading.
         */
        MISSING_PARENT,

        /**
         * Code node with more than one incoming hierarchy edge; its ancestor
         * path is ambiguous.
         */
        MULTIPLE_PARENTS
    }
}
