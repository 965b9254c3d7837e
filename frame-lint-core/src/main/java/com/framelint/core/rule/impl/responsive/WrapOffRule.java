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
 * Auto-layout frames with {@value #MIN_CHILDREN} or more children should wrap.
 */
public class WrapOffRule extends AbstractRule {

    /** Child count from which wrapping is expected. */
    public static final int MIN_CHILDREN = 3;

    public WrapOffRule() {
        super(new RuleDefinition(
            RuleIds.WRAP_OFF,
            "Wrap recommended",
            RuleCategory.RESPONSIVE,
            Severity.MAJOR,
            "Enable wrap on auto layouts holding several children",
            "Without wrap, narrow screens get a horizontal scrollbar",
            5
        ), 40, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (!node.hasAutoLayout() || node.childCount() < MIN_CHILDREN) {
            return passed();
        }
        if (NodePredicates.hasWrapEnabled(node)) {
            return passed();
        }
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" does not wrap (" + node.childCount() + " children)",
            "Children will not reflow on mobile and may overflow horizontally",
            "Enable wrap in the auto layout settings",
            "Wrap: OFF",
            "Wrap: ON"
        ));
    }
}
