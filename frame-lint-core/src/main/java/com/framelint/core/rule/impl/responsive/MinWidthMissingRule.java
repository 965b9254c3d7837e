package com.framelint.core.rule.impl.responsive;

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
 * Interactive auto-layout frames (buttons, cards, inputs, selects) need a minimum width.
 */
public class MinWidthMissingRule extends AbstractRule {

    public MinWidthMissingRule() {
        super(new RuleDefinition(
            RuleIds.MIN_WIDTH_MISSING,
            "Minimum width",
            RuleCategory.RESPONSIVE,
            Severity.MINOR,
            "Give interactive elements a minimum width",
            "Without a minimum width, elements shrink too far on mobile",
            3
        ), 80, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (!node.hasAutoLayout() || !NodePredicates.isInteractiveName(node.name())) {
            return passed();
        }
        if (NodePredicates.hasMinWidth(node)) {
            return passed();
        }
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" has no minimum width",
            "The element can shrink until it becomes hard to use",
            "Set a minimum width (120px or more is recommended for buttons)",
            "not set",
            "Min width: 120px or more"
        ));
    }
}
