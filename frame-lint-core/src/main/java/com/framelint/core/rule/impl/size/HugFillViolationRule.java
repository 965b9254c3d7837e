package com.framelint.core.rule.impl.size;

import com.framelint.core.model.AxisSizingMode;
import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.model.RuleCategory;
import com.framelint.core.model.Severity;
import com.framelint.core.rule.CheckContext;
import com.framelint.core.rule.RuleCheckResult;
import com.framelint.core.rule.RuleDefinition;
import com.framelint.core.rule.RuleIds;
import com.framelint.core.rule.base.AbstractRule;

/**
 * An auto-layout frame inside an auto-layout parent that hugs more than
 * {@value #MAX_HUG_CHILDREN} children along its primary axis.
 */
public class HugFillViolationRule extends AbstractRule {

    /** Children a hugging container may hold before it should fill instead. */
    public static final int MAX_HUG_CHILDREN = 3;

    public HugFillViolationRule() {
        super(new RuleDefinition(
            RuleIds.HUG_FILL_VIOLATION,
            "Hug and fill usage",
            RuleCategory.SIZE,
            Severity.MAJOR,
            "Use hug contents and fill container where each belongs",
            "Wrong sizing modes make layouts collapse or overflow",
            5
        ), 70, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (!node.hasAutoLayout()) {
            return passed();
        }
        boolean parentHasAutoLayout = context.parent()
            .map(DesignNode::hasAutoLayout)
            .orElse(false);
        if (!parentHasAutoLayout) {
            return passed();
        }
        if (node.childCount() <= MAX_HUG_CHILDREN || node.primaryAxisSizingMode() != AxisSizingMode.AUTO) {
            return passed();
        }
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" hugs its contents although it holds " + node.childCount() + " children",
            "The layout may break when the viewport changes",
            "Switch to fill container or review the sizing of the children",
            "Hug contents",
            "Fill container"
        ));
    }
}
