package com.framelint.core.model;

import java.util.Objects;

/**
 * A rule that threw while checking a node. The pair contributed no violations.
 *
 * @param ruleId id of the failing rule
 * @param nodeId id of the node being checked
 * @param message exception message
 */
public record RuleFailure(
    String ruleId,
    String nodeId,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public RuleFailure {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        if (message == null) {
            message = "";
        }
    }
}
