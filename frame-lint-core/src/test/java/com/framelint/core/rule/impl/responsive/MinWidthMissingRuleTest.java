package com.framelint.core.rule.impl.responsive;

import com.framelint.core.model.AxisSizingMode;
import com.framelint.core.model.DesignNode;
import com.framelint.core.rule.RuleIds;
import com.framelint.core.rule.RuleTestBase;
import org.junit.jupiter.api.Test;

import static com.framelint.core.DesignTrees.autoFrame;
import static com.framelint.core.DesignTrees.frame;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MinWidthMissingRule}.
 */
class MinWidthMissingRuleTest extends RuleTestBase {

    private final MinWidthMissingRule rule = new MinWidthMissingRule();

    @Test
    void check_buttonWithoutMinWidth_reportsViolation() {
        DesignNode button = autoFrame("1", "button-primary").build();

        assertThat(assertSingleViolation(rule.check(button, rootContext(button)), RuleIds.MIN_WIDTH_MISSING)
            .detectedValue()).isEqualTo("not set");
    }

    @Test
    void check_buttonWithExplicitMinWidth_passes() {
        DesignNode button = autoFrame("1", "button-primary").minWidth(120).build();

        assertPassed(rule.check(button, rootContext(button)));
    }

    @Test
    void check_buttonHuggingCounterAxis_passes() {
        DesignNode button = autoFrame("1", "button-primary")
            .counterAxisSizingMode(AxisSizingMode.AUTO)
            .build();

        assertPassed(rule.check(button, rootContext(button)));
    }

    @Test
    void check_nonInteractiveName_passes() {
        DesignNode section = autoFrame("1", "section-hero").build();

        assertPassed(rule.check(section, rootContext(section)));
    }

    @Test
    void check_withoutAutoLayout_passes() {
        DesignNode button = frame("1", "button-primary").build();

        assertPassed(rule.check(button, rootContext(button)));
    }
}
