package com.framelint.core.rule.impl.layout;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.model.Severity;
import com.framelint.core.model.Violation;
import com.framelint.core.rule.RuleIds;
import com.framelint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import static com.framelint.core.DesignTrees.autoFrame;
import static com.framelint.core.DesignTrees.frame;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AutoLayoutRequiredRule}.
 */
class AutoLayoutRequiredRuleTest extends RuleTestBase {

    private final AutoLayoutRequiredRule rule = new AutoLayoutRequiredRule();

    @Test
    void check_frameWithoutAutoLayout_reportsCriticalViolation() {
        DesignNode hero = frame("1:2", "Hero").build();

        Violation violation = assertSingleViolation(rule.check(hero, rootContext(hero)), RuleIds.AUTO_LAYOUT_REQUIRED);

        assertThat(violation.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(violation.frameId()).isEqualTo("1:2");
        assertThat(violation.frameName()).isEqualTo("Hero");
        assertThat(violation.detectedValue()).isEqualTo("NONE");
    }

    @Test
    void check_frameWithAutoLayout_passes() {
        DesignNode hero = autoFrame("1:2", "Hero").build();

        assertPassed(rule.check(hero, rootContext(hero)));
    }

    @Test
    void check_unsupportedNodeType_passes() {
        DesignNode group = DesignNode.builder("1:3", "Group 1", NodeType.GROUP).build();

        assertPassed(rule.check(group, rootContext(group)));
    }

    @Test
    void definition_matchesCatalogueEntry() {
        assertThat(rule.getOrder()).isEqualTo(10);
        assertThat(rule.getDefinition().scoreWeight()).isEqualTo(10);
        assertThat(rule.getSupportedNodeTypes()).containsExactly(NodeType.FRAME);
    }
}
