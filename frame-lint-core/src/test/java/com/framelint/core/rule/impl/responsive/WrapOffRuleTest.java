package com.framelint.core.rule.impl.responsive;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.LayoutMode;
import com.framelint.core.model.LayoutWrap;
import com.framelint.core.model.Severity;
import com.framelint.core.model.Violation;
import com.framelint.core.rule.RuleIds;
import com.framelint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import static com.framelint.core.DesignTrees.autoFrame;
import static com.framelint.core.DesignTrees.frame;
import static com.framelint.core.DesignTrees.texts;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link WrapOffRule}.
 */
class WrapOffRuleTest extends RuleTestBase {

    private final WrapOffRule rule = new WrapOffRule();

    @Test
    void check_horizontalRowOfFourWithoutWrap_reportsMajorViolation() {
        DesignNode row = frame("1", "section-features")
            .layoutMode(LayoutMode.HORIZONTAL)
            .children(texts("t", 4))
            .build();

        Violation violation = assertSingleViolation(rule.check(row, rootContext(row)), RuleIds.WRAP_OFF);

        assertThat(violation.severity()).isEqualTo(Severity.MAJOR);
        assertThat(violation.description()).contains("4 children");
        assertThat(violation.detectedValue()).isEqualTo("Wrap: OFF");
    }

    @Test
    void check_twoChildren_passes() {
        DesignNode row = autoFrame("1", "row").children(texts("t", 2)).build();

        assertPassed(rule.check(row, rootContext(row)));
    }

    @Test
    void check_wrapEnabled_passes() {
        DesignNode row = autoFrame("1", "row")
            .layoutWrap(LayoutWrap.WRAP)
            .children(texts("t", 5))
            .build();

        assertPassed(rule.check(row, rootContext(row)));
    }

    @Test
    void check_noAutoLayout_passes() {
        DesignNode row = frame("1", "row").children(texts("t", 5)).build();

        assertPassed(rule.check(row, rootContext(row)));
    }
}
