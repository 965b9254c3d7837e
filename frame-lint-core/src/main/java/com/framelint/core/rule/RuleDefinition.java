package com.framelint.core.rule;

import com.framelint.core.model.RuleCategory;
import com.framelint.core.model.Severity;

import java.util.Objects;

/**
 * Static description of a rule.
 *
 * <p>Created once when the rule is constructed and never changed afterwards.</p>
 *
 * @param id stable rule identifier (e.g. {@code AUTO_LAYOUT_REQUIRED})
 * @param name human-readable name
 * @param category category the rule's violations are scored under
 * @param severity severity of the rule's violations
 * @param description what the rule requires
 * @param impactTemplate what breaks when the rule is not met
 * @param scoreWeight relative importance (1-10)
 */
public record RuleDefinition(
    String id,
    String name,
    RuleCategory category,
    Severity severity,
    String description,
    String impactTemplate,
    int scoreWeight
) {
    /**
     * Compact constructor with validation.
     */
    public RuleDefinition {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (description == null) {
            description = "";
        }
        if (impactTemplate == null) {
            impactTemplate = "";
        }
        if (scoreWeight < 1 || scoreWeight > 10) {
            throw new IllegalArgumentException("scoreWeight must be within 1..10: " + scoreWeight);
        }
    }
}
