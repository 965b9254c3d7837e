package com.framelint.core.rule.impl.size;

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
 * Frames sized with fixed width or height instead of hug or fill.
 */
public class FixedSizeDetectedRule extends AbstractRule {

    public FixedSizeDetectedRule() {
        super(new RuleDefinition(
            RuleIds.FIXED_SIZE_DETECTED,
            "Fixed size detected",
            RuleCategory.SIZE,
            Severity.MAJOR,
            "Avoid fixed widths and heights",
            "Fixed sizes do not adapt to the available space",
            5
        ), 30, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (!NodePredicates.hasFixedSize(node)) {
            return passed();
        }
        String detected = node.absoluteBoundingBox() != null
            ? node.absoluteBoundingBox().formatSize()
            : "Fixed";
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" uses a fixed size",
            "The frame will not resize correctly on other screen sizes",
            "Use hug contents or fill container instead",
            detected,
            "Hug or Fill"
        ));
    }
}
