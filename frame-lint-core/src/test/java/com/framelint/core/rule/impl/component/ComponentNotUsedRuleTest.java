package com.framelint.core.rule.impl.component;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.rule.RuleIds;
import com.framelint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import static com.framelint.core.DesignTrees.frame;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ComponentNotUsedRule}.
 */
class ComponentNotUsedRuleTest extends RuleTestBase {

    private final ComponentNotUsedRule rule = new ComponentNotUsedRule();

    @Test
    void check_cardNamedFrame_reportsViolation() {
        DesignNode card = frame("1", "card-product").build();

        assertThat(assertSingleViolation(rule.check(card, rootContext(card)), RuleIds.COMPONENT_NOT_USED)
            .expectedValue()).isEqualTo("Component");
    }

    @Test
    void check_componentNode_passes() {
        DesignNode component = DesignNode.builder("1", "card-product", NodeType.COMPONENT).build();

        assertPassed(rule.check(component, rootContext(component)));
    }

    @Test
    void check_unrelatedName_passes() {
        DesignNode section = frame("1", "section-hero").build();

        assertPassed(rule.check(section, rootContext(section)));
    }
}
