package com.framelint.core.rule;

import com.framelint.core.model.BoundingBox;
import com.framelint.core.model.DesignNode;
import com.framelint.core.model.LayoutConstraints;
import com.framelint.core.model.NodeType;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static com.framelint.core.DesignTrees.autoFrame;
import static com.framelint.core.DesignTrees.texts;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Every catalogue rule passes nodes of a kind it does not support, however badly
 * laid out they are.
 */
class RuleNodeTypeTest {

    static Stream<Arguments> unsupportedPairs() {
        return RuleCatalogue.baseline().rules().stream()
            .flatMap(rule -> Arrays.stream(NodeType.values())
                .filter(type -> !rule.getSupportedNodeTypes().contains(type))
                .map(type -> Arguments.of(rule, type)));
    }

    @ParameterizedTest(name = "{0} on {1}")
    @MethodSource("unsupportedPairs")
    void check_unsupportedNodeType_passesWithoutViolations(Rule rule, NodeType type) {
        DesignNode node = DesignNode.builder("n", "Frame 1", type)
            .children(texts("t", 60))
            .absoluteBoundingBox(new BoundingBox(0, 0, 320, 180))
            .constraints(new LayoutConstraints("SCALE", "SCALE"))
            .build();
        DesignNode parent = autoFrame("p", "section-main").children(node).build();
        CheckContext context = new CheckContext(12, parent, parent, List.of(parent, node));

        assertThat(rule.appliesTo(node)).isFalse();
        RuleCheckResult result = rule.check(node, context);

        assertThat(result.passed()).isTrue();
        assertThat(result.violations()).isEmpty();
    }
}
