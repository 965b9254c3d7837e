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
 * Flags frames that position content absolutely: no auto layout, or scale constraints.
 */
public class AbsolutePositioningRule extends AbstractRule {

    public AbsolutePositioningRule() {
        super(new RuleDefinition(
            RuleIds.ABSOLUTE_POSITIONING,
            "No absolute positioning",
            RuleCategory.LAYOUT,
            Severity.CRITICAL,
            "Absolute positioning must not be used",
            "Absolutely positioned content cannot adapt to the viewport size",
            10
        ), 20, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (!NodePredicates.hasAbsolutePositioning(node)) {
            return passed();
        }
        String detected = node.hasAutoLayout() ? "SCALE constraint" : "Absolute position";
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" uses absolute positioning",
            "Responsive behaviour is lost and the layout is likely to break on mobile",
            "Switch to auto layout so children are positioned relative to each other",
            detected,
            "Auto layout (relative positioning)"
        ));
    }
}
