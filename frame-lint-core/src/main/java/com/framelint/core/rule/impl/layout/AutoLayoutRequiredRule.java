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

/**
 * Every frame needs an auto-layout direction; flexbox and grid output is derived from it.
 */
public class AutoLayoutRequiredRule extends AbstractRule {

    public AutoLayoutRequiredRule() {
        super(new RuleDefinition(
            RuleIds.AUTO_LAYOUT_REQUIRED,
            "Auto layout required",
            RuleCategory.LAYOUT,
            Severity.CRITICAL,
            "Frames must use auto layout",
            "Without auto layout the frame cannot be converted into responsive markup",
            10
        ), 10, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (node.hasAutoLayout()) {
            return passed();
        }
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" has no auto layout",
            "The frame cannot be mapped to a flexbox or grid container, so code generation is blocked",
            "Add auto layout to the frame",
            "NONE",
            "HORIZONTAL or VERTICAL"
        ));
    }
}
