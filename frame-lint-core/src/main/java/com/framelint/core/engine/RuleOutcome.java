package com.framelint.core.engine;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.RuleFailure;
import com.framelint.core.model.Violation;
import com.framelint.core.rule.CheckContext;
import com.framelint.core.rule.Rule;
import com.framelint.core.rule.RuleCheckResult;

import java.util.List;
import java.util.Objects;

/**
 * Result of running one rule against one node: either the rule's verdict or the
 * exception it threw.
 *
 * @param ruleId rule that ran
 * @param nodeId node that was checked
 * @param result the verdict, null on failure
 * @param error what the rule threw, null on success
 */
public record RuleOutcome(
    String ruleId,
    String nodeId,
    RuleCheckResult result,
    Throwable error
) {
    /**
     * Compact constructor with validation.
     */
    public RuleOutcome {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of result and error must be set");
        }
    }

    /**
     * Runs a rule, capturing what it throws instead of propagating it.
     *
     * <p>Any exception is captured, checked ones included. Of the errors only stack
     * overflows and linkage errors are captured; other virtual machine errors propagate.
     *
     * @param rule rule to run
     * @param node node to check
     * @param context node context
     * @return the outcome
     */
    public static RuleOutcome evaluate(Rule rule, DesignNode node, CheckContext context) {
        String ruleId = rule.getId();
        try {
            RuleCheckResult result = rule.check(node, context);
            if (result == null) {
                return new RuleOutcome(ruleId, node.id(), null,
                    new IllegalStateException("Rule " + ruleId + " returned no result"));
            }
            return new RuleOutcome(ruleId, node.id(), result, null);
        } catch (Exception | StackOverflowError | LinkageError e) {
            return new RuleOutcome(ruleId, node.id(), null, e);
        }
    }

    public boolean failed() {
        return error != null;
    }

    /**
     * Violations found, none on failure.
     *
     * @return violations in the order the rule reported them
     */
    public List<Violation> violations() {
        return failed() ? List.of() : result.violations();
    }

    /**
     * Describes a failed outcome.
     *
     * @return failure record
     * @throws IllegalStateException if the rule succeeded
     */
    public RuleFailure toFailure() {
        if (!failed()) {
            throw new IllegalStateException("Rule " + ruleId + " did not fail on node " + nodeId);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new RuleFailure(ruleId, nodeId, message);
    }
}
