package com.framelint.core.rule.impl.component;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.model.RuleCategory;
import com.framelint.core.model.Severity;
import com.framelint.core.rule.CheckContext;
import com.framelint.core.rule.RuleCheckResult;
import com.framelint.core.rule.RuleDefinition;
import com.framelint.core.rule.RuleIds;
import com.framelint.core.rule.base.AbstractRule;
import com.framelint.core.rule.base.NodePredicates;

/**
 * Plain frames named like reusable elements (buttons, cards, tags, ...) should be components.
 */
public class ComponentNotUsedRule extends AbstractRule {

    public ComponentNotUsedRule() {
        super(new RuleDefinition(
            RuleIds.COMPONENT_NOT_USED,
            "Use components",
            RuleCategory.COMPONENT,
            Severity.MINOR,
            "Turn reusable patterns into components",
            "Copies of the same element drift apart and are costly to maintain",
            2
        ), 90, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (!NodePredicates.shouldBeComponent(node)) {
            return passed();
        }
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" looks like a reusable element but is not a component",
            "Every copy has to be updated by hand when the design changes",
            "Create a component from the frame and use instances of it",
            "Frame",
            "Component"
        ));
    }
}
