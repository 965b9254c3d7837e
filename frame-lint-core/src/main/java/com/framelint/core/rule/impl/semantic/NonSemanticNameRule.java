package com.framelint.core.rule.impl.semantic;

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
 * Frames must carry a role-based or kebab-case name, not a tool default.
 */
public class NonSemanticNameRule extends AbstractRule {

    public NonSemanticNameRule() {
        super(new RuleDefinition(
            RuleIds.NON_SEMANTIC_NAME,
            "Semantic naming",
            RuleCategory.SEMANTIC,
            Severity.MINOR,
            "Give frames meaningful names",
            "Layer names become class names, ids and accessibility hints",
            2
        ), 50, NodeType.FRAME);
    }

    @Override
    protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
        if (NodePredicates.isSemanticName(node.name())) {
            return passed();
        }
        return failed(createViolation(
            node,
            "Frame \"" + node.name() + "\" does not have a semantic name",
            "Generated class names, ids and accessibility attributes will be meaningless",
            "Rename it to something like header, section-hero or card-product",
            node.name(),
            "section-* / header / nav / card-*"
        ));
    }
}
