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
 * Frames nested more than {@value #MAX_DEPTH} levels below the root.
 */
public class DepthTooDeepRule extends AbstractRule {

    /** Deepest allowed nesting level. */
    public static final int MAX_DEPTH = 8;

    public DepthTooDeepRule() {
        super(new RuleDefinition(
            RuleIds.DEPTH_TOO_DEEP,
            "Nesting depth limit",
            RuleCategory.LAYOUT,
            Severity.MAJOR,
            "Keep frame hierarchies within " + MAX_DEPTH + " levels",
            "Deep hierarchies produce deeply nested markup that is slow to render",
            5
        ), 60, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (context.depth() <= MAX_DEPTH) {
            return passed();
        }
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" is nested too deeply (depth " + context.depth() + ")",
            "Rendering slows down and the structure becomes hard to maintain",
            "Flatten the structure or extract nested parts into components",
            context.depth() + " levels",
            "at most " + MAX_DEPTH + " levels"
        ));
    }
}
