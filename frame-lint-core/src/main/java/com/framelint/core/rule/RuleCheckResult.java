package com.framelint.core.rule;

import com.framelint.core.model.Violation;

import java.util.List;

/**
 * Outcome of checking one node against one rule.
 *
 * @param passed true when the node satisfies the rule
 * @param violations violations found (empty when passed)
 */
public record RuleCheckResult(
    boolean passed,
    List<Violation> violations
) {
    private static final RuleCheckResult PASSED = new RuleCheckResult(true, List.of());

    /**
     * Compact constructor with validation.
     */
    public RuleCheckResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
        if (passed && !violations.isEmpty()) {
            throw new IllegalArgumentException("a passed result cannot carry violations");
        }
        if (!passed && violations.isEmpty()) {
            throw new IllegalArgumentException("a failed result needs at least one violation");
        }
    }

    /**
     * Passing result with no violations.
     *
     * @return shared passing result
     */
    public static RuleCheckResult pass() {
        return PASSED;
    }

    /**
     * Failing result.
     *
     * @param violations one or more violations
     * @return failing result
     */
    public static RuleCheckResult fail(List<Violation> violations) {
        return new RuleCheckResult(false, violations);
    }
}
