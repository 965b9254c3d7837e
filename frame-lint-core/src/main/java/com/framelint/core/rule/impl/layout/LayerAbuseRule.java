package com.framelint.core.rule.impl.layout;

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
 * Containers with more than {@value NodePredicates#MAX_DIRECT_CHILDREN} direct children.
 *
 * <p>Components and instances are checked as well as frames.</p>
 */
public class LayerAbuseRule extends AbstractRule {

    public LayerAbuseRule() {
        super(new RuleDefinition(
            RuleIds.LAYER_ABUSE,
            "Layer count limit",
            RuleCategory.LAYOUT,
            Severity.MAJOR,
            "Do not place more than " + NodePredicates.MAX_DIRECT_CHILDREN + " layers in one container",
            "Too many layers slow down rendering and make the design hard to maintain",
            5
        ), 100, NodeType.FRAME, NodeType.COMPONENT, NodeType.INSTANCE);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (!NodePredicates.hasLayerAbuse(node)) {
            return passed();
        }
        int childCount = node.childCount();
        return failed(createViolation(
            node,
            "\"" + node.name() + "\" has " + childCount + " layers",
            "Rendering performance drops and the layer tree becomes hard to maintain",
            "Group related layers, extract components or restructure the container",
            childCount + " layers",
            "at most " + NodePredicates.MAX_DIRECT_CHILDREN + " layers"
        ));
    }
}
