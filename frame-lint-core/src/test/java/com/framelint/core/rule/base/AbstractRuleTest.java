package com.framelint.core.rule.base;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.model.RuleCategory;
import com.framelint.core.model.Severity;
import com.framelint.core.model.Violation;
import com.framelint.core.rule.CheckContext;
import com.framelint.core.rule.RuleCheckResult;
import com.framelint.core.rule.RuleDefinition;
import com.framelint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import static com.framelint.core.DesignTrees.frame;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AbstractRule}.
 */
class AbstractRuleTest extends RuleTestBase {

    /** Flags every node it is asked to inspect. */
    private static final class AlwaysFails extends AbstractRule {
        private int inspected;

        AlwaysFails() {
            super(new RuleDefinition("ALWAYS", "Always", RuleCategory.SEMANTIC, Severity.INFO,
                "fires on every frame", "none", 1), 5, NodeType.FRAME, NodeType.GROUP);
        }

        @Override
        protected RuleCheckResult inspect(DesignNode node, CheckContext context) {
            inspected++;
            return failed(createViolation(node, "found " + node.name(), "impact"));
        }
    }

    @Test
    void check_unsupportedType_skipsInspection() {
        AlwaysFails rule = new AlwaysFails();
        DesignNode text = DesignNode.builder("t", "label", NodeType.TEXT).build();

        assertPassed(rule.check(text, rootContext(text)));
        assertThat(rule.inspected).isZero();
    }

    @Test
    void createViolation_stampsRuleIdentity() {
        AlwaysFails rule = new AlwaysFails();
        DesignNode node = frame("1:9", "hero").build();

        Violation violation = assertSingleViolation(rule.check(node, rootContext(node)), "ALWAYS");

        assertThat(violation.ruleName()).isEqualTo("Always");
        assertThat(violation.severity()).isEqualTo(Severity.INFO);
        assertThat(violation.category()).isEqualTo(RuleCategory.SEMANTIC);
        assertThat(violation.frameId()).isEqualTo("1:9");
        assertThat(violation.nodeType()).isEqualTo(NodeType.FRAME);
        assertThat(violation.suggestion()).isNull();
    }

    @Test
    void supportedNodeTypes_combineFirstAndOtherTypes() {
        assertThat(new AlwaysFails().getSupportedNodeTypes())
            .containsExactlyInAnyOrder(NodeType.FRAME, NodeType.GROUP);
    }
}
