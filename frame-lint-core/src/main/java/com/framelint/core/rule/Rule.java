package com.framelint.core.rule;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;

import java.util.Set;

/**
 * A structural, responsiveness or naming rule evaluated against design nodes.
 *
 * <p>Rules are discovered via Java Service Provider Interface (SPI) and run by the
 * rule engine in {@link #getOrder()} order against every node of the evaluation set.
 * A rule only looks at its inputs: implementations must be stateless, side-effect free
 * and safe to call concurrently for different nodes and trees.</p>
 *
 * <p>A rule must pass every node whose type is not in {@link #getSupportedNodeTypes()}.
 * Extending {@link com.framelint.core.rule.base.AbstractRule} takes care of that.</p>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.framelint.core.rule.Rule}</p>
 *
 * @see RuleDefinition
 * @see CheckContext
 * @see RuleCheckResult
 */
public interface Rule {

    /**
     * Returns the immutable definition of this rule.
     *
     * @return rule definition
     */
    RuleDefinition getDefinition();

    /**
     * Returns the rule id.
     *
     * @return id from the definition
     */
    default String getId() {
        return getDefinition().id();
    }

    /**
     * Returns the node kinds this rule inspects.
     *
     * @return supported node types
     */
    Set<NodeType> getSupportedNodeTypes();

    /**
     * Returns the position of this rule in the catalogue.
     *
     * <p>Lower values run first. Violations of one node are reported in this order.</p>
     *
     * @return order value
     */
    int getOrder();

    /**
     * Checks whether this rule inspects the given node at all.
     *
     * @param node node to test
     * @return true if the node's type is supported
     */
    default boolean appliesTo(DesignNode node) {
        return getSupportedNodeTypes().contains(node.type());
    }

    /**
     * Checks a node.
     *
     * <p>Implementations should not throw; if one does, the engine records the failure
     * and treats the rule as having found nothing for this node.</p>
     *
     * @param node node under check
     * @param context ancestry and depth of the node
     * @return passing result, or failing result with one or more violations
     */
    RuleCheckResult check(DesignNode node, CheckContext context);
}
