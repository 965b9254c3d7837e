package com.framelint.core.model;

import java.util.Objects;

/**
 * A single rule failure recorded against one node.
 *
 * <p>The rule's identity (id, name, severity, category) is stamped onto every violation
 * so that consumers never need the rule catalogue to interpret a result.</p>
 *
 * @param ruleId id of the rule that fired
 * @param ruleName human-readable rule name
 * @param severity severity of the rule
 * @param category category of the rule
 * @param frameName name of the offending node
 * @param frameId id of the offending node
 * @param nodeType kind of the offending node
 * @param description what was detected
 * @param impact consequence for generated code
 * @param suggestion how to fix it, may be null
 * @param detectedValue value found on the node, may be null
 * @param expectedValue value the rule expects, may be null
 */
public record Violation(
    String ruleId,
    String ruleName,
    Severity severity,
    RuleCategory category,
    String frameName,
    String frameId,
    NodeType nodeType,
    String description,
    String impact,
    String suggestion,
    String detectedValue,
    String expectedValue
) {
    /**
     * Compact constructor with validation.
     */
    public Violation {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(frameId, "frameId must not be null");
        Objects.requireNonNull(description, "description must not be null");
        if (frameName == null) {
            frameName = "";
        }
        if (impact == null) {
            impact = "";
        }
    }
}
