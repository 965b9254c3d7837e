package com.framelint.core.rule.base;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.model.Violation;
import com.framelint.core.rule.CheckContext;
import com.framelint.core.rule.Rule;
import com.framelint.core.rule.RuleCheckResult;
import com.framelint.core.rule.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Abstract base class for rule implementations providing common functionality.
 *
 * <p>This class reduces code duplication across rules by providing:
 * <ul>
 *   <li>Logger initialization (one logger per rule class)</li>
 *   <li>Node-type filtering: {@link #check(DesignNode, CheckContext)} passes every node
 *       the rule does not support before {@link #inspect(DesignNode, CheckContext)} runs</li>
 *   <li>Result helpers ({@link #passed()}, {@link #failed(Violation...)})</li>
 *   <li>{@link #createViolation(DesignNode, String, String, String, String, String)}, which
 *       stamps this rule's id, name, severity and category onto a new violation</li>
 * </ul>
 *
 * <p><b>Usage Example</b></p>
 * <pre>{@code
 * public class WrapOffRule extends AbstractRule {
 *     public WrapOffRule() {
 *         super(new RuleDefinition(...), 40, NodeType.FRAME);
 *     }
 *
 *     @Override
 *     protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
 *         if (!node.hasAutoLayout()) {
 *             return passed();
 *         }
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @see Rule
 * @see NodePredicates
 * @since 1.0.0
 */
public abstract class AbstractRule implements Rule {

    /**
     * Logger instance for this rule.
     * Automatically initialized with the concrete rule class name.
     */
    protected final Logger log;

    private final RuleDefinition definition;
    private final int order;
    private final Set<NodeType> supportedNodeTypes;

    /**
     * Creates a rule.
     *
     * @param definition immutable rule definition
     * @param order catalogue position
     * @param firstType first supported node type
     * @param otherTypes further supported node types
     */
    protected AbstractRule(RuleDefinition definition, int order, NodeType firstType, NodeType... otherTypes) {
        this.log = LoggerFactory.getLogger(getClass());
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.order = order;
        this.supportedNodeTypes = Set.copyOf(EnumSet.of(firstType, otherTypes));
    }

    @Override
    public RuleDefinition getDefinition() {
        return definition;
    }

    @Override
    public int getOrder() {
        return order;
    }

    @Override
    public Set<NodeType> getSupportedNodeTypes() {
        return supportedNodeTypes;
    }

    @Override
    public final RuleCheckResult check(DesignNode node, CheckContext context) {
        if (!appliesTo(node)) {
            return passed();
        }
        return inspect(node, context);
    }

    /**
     * Checks a node whose type this rule supports.
     *
     * @param node node under check
     * @param context ancestry and depth of the node
     * @return check result
     */
    protected abstract RuleCheckResult inspect(DesignNode node, CheckContext context);

    // ==================== Result Helpers ====================

    /**
     * Passing result.
     *
     * @return result with no violations
     */
    protected RuleCheckResult passed() {
        return RuleCheckResult.pass();
    }

    /**
     * Failing result.
     *
     * @param violations one or more violations
     * @return result carrying the violations
     */
    protected RuleCheckResult failed(Violation... violations) {
        return RuleCheckResult.fail(List.of(violations));
    }

    /**
     * Creates a violation of this rule against a node.
     *
     * @param node offending node
     * @param description what was detected
     * @param impact consequence for generated code
     * @param suggestion how to fix it, may be null
     * @param detectedValue value found, may be null
     * @param expectedValue value expected, may be null
     * @return new violation
     */
    protected Violation createViolation(
            DesignNode node,
            String description,
            String impact,
            String suggestion,
            String detectedValue,
            String expectedValue) {
        return new Violation(
            definition.id(),
            definition.name(),
            definition.severity(),
            definition.category(),
            node.name(),
            node.id(),
            node.type(),
            description,
            impact,
            suggestion,
            detectedValue,
            expectedValue
        );
    }

    /**
     * Creates a violation with no suggestion or debug values.
     *
     * @param node offending node
     * @param description what was detected
     * @param impact consequence for generated code
     * @return new violation
     */
    protected Violation createViolation(DesignNode node, String description, String impact) {
        return createViolation(node, description, impact, null, null, null);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + definition.id() + "]";
    }
}
