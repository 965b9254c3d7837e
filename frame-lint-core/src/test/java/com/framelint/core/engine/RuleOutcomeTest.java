package com.framelint.core.engine;

import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.model.RuleCategory;
import com.framelint.core.model.RuleFailure;
import com.framelint.core.model.Severity;
import com.framelint.core.rule.CheckContext;
import com.framelint.core.rule.Rule;
import com.framelint.core.rule.RuleCheckResult;
import com.framelint.core.rule.RuleDefinition;
import com.framelint.core.rule.impl.layout.AutoLayoutRequiredRule;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;

import static com.framelint.core.DesignTrees.frame;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RuleOutcome}.
 */
class RuleOutcomeTest {

    private final DesignNode node = frame("1", "hero").build();
    private final CheckContext context = new CheckContext(0, null, node, List.of(node));

    @Test
    void evaluate_ruleReturnsResult_succeeds() {
        RuleOutcome outcome = RuleOutcome.evaluate(new AutoLayoutRequiredRule(), node, context);

        assertThat(outcome.failed()).isFalse();
        assertThat(outcome.violations()).hasSize(1);
    }

    @Test
    void evaluate_ruleThrows_capturesError() {
        RuleOutcome outcome = RuleOutcome.evaluate(new BrokenRule(), node, context);

        assertThat(outcome.failed()).isTrue();
        assertThat(outcome.violations()).isEmpty();
        assertThat(outcome.toFailure()).isEqualTo(new RuleFailure("BROKEN", "1", "boom"));
    }

    @Test
    void toFailure_onSuccess_throwsException() {
        RuleOutcome outcome = RuleOutcome.evaluate(new AutoLayoutRequiredRule(), node, context);

        assertThatThrownBy(outcome::toFailure).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void evaluate_ruleOverflowsStack_capturesError() {
        RuleOutcome outcome = RuleOutcome.evaluate(
            new BrokenRule("DEEP", new StackOverflowError("deep")), node, context);

        assertThat(outcome.failed()).isTrue();
        assertThat(outcome.toFailure()).isEqualTo(new RuleFailure("DEEP", "1", "deep"));
    }

    @Test
    void evaluate_ruleThrowsCheckedException_capturesError() {
        RuleOutcome outcome = RuleOutcome.evaluate(
            new BrokenRule("IO", new IOException("disk gone")), node, context);

        assertThat(outcome.failed()).isTrue();
        assertThat(outcome.error()).isInstanceOf(IOException.class);
    }

    @Test
    void evaluate_ruleThrowsLinkageError_capturesError() {
        RuleOutcome outcome = RuleOutcome.evaluate(
            new BrokenRule("LINK", new NoClassDefFoundError("com/example/Missing")), node, context);

        assertThat(outcome.toFailure().message()).isEqualTo("com/example/Missing");
    }

    @Test
    void evaluate_ruleRunsOutOfMemory_propagates() {
        BrokenRule rule = new BrokenRule("OOM", new OutOfMemoryError("heap"));

        assertThatThrownBy(() -> RuleOutcome.evaluate(rule, node, context))
            .isInstanceOf(OutOfMemoryError.class)
            .hasMessage("heap");
    }

    @Test
    void evaluate_errorWithoutMessage_usesTypeName() {
        RuleOutcome outcome = RuleOutcome.evaluate(new BrokenRule("DEEP", new StackOverflowError()), node, context);

        assertThat(outcome.toFailure().message()).isEqualTo("StackOverflowError");
    }

    /** Rule implemented directly against the interface that always throws. */
    static final class BrokenRule implements Rule {
        private final String id;
        private final Throwable failure;

        BrokenRule() {
            this("BROKEN", new IllegalStateException("boom"));
        }

        BrokenRule(String id, Throwable failure) {
            this.id = id;
            this.failure = failure;
        }

        @Override
        public RuleDefinition getDefinition() {
            return new RuleDefinition(id, "Broken", RuleCategory.LAYOUT,
                Severity.MAJOR, "always throws", "none", 5);
        }

        @Override
        public Set<NodeType> getSupportedNodeTypes() {
            return Set.of(NodeType.FRAME);
        }

        @Override
        public int getOrder() {
            return 15;
        }

        @Override
        public RuleCheckResult check(DesignNode node, CheckContext context) {
            return BrokenRule.<RuntimeException>rethrow(failure);
        }

        // lets the rule throw checked exceptions through the unchecked interface
        @SuppressWarnings("unchecked")
        private static <T extends Throwable> RuleCheckResult rethrow(Throwable failure) throws T {
            throw (T) failure;
        }
    }
}
