package com.framelint.core.engine;

import com.framelint.core.model.AnalysisStats;
import com.framelint.core.model.AnalysisSummary;
import com.framelint.core.model.DesignNode;
import com.framelint.core.model.NodeType;
import com.framelint.core.model.RuleFailure;
import com.framelint.core.model.ScoreResult;
import com.framelint.core.model.Violation;
import com.framelint.core.model.ViolationCounts;
import com.framelint.core.rule.CheckContext;
import com.framelint.core.rule.Rule;
import com.framelint.core.rule.RuleCatalogue;
import com.framelint.core.rule.RuleDefinition;
import com.framelint.core.rule.base.NodePredicates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a rule catalogue over every frame of a design tree.
 *
 * <p>The evaluation set is every FRAME node plus COMPONENT and INSTANCE nodes; only
 * frames count towards {@code totalFrames}. Each rule invocation is isolated: a rule
 * that throws is logged and recorded as a {@link RuleFailure}, contributes no
 * violations, and does not stop the remaining rules or nodes.</p>
 *
 * <p>The returned summary is unscored. Pass it to
 * {@link com.framelint.core.scoring.ScoreCalculator#calculateScores} to fill in scores
 * and gates.</p>
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    /** Frames between two progress log lines. */
    static final int PROGRESS_INTERVAL = 100;

    private final RuleCatalogue catalogue;

    public RuleEngine(RuleCatalogue catalogue) {
        this.catalogue = Objects.requireNonNull(catalogue, "catalogue must not be null");
    }

    /**
     * Evaluates every rule against the tree.
     *
     * @param root tree root (usually the DOCUMENT node)
     * @param projectId caller-supplied id echoed in the summary
     * @return unscored summary
     */
    public AnalysisSummary analyze(DesignNode root, String projectId) {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(projectId, "projectId must not be null");

        TreeIndex index = TreeIndex.build(root);
        List<DesignNode> evaluationSet = index.nodes().stream()
            .filter(RuleEngine::isEvaluated)
            .toList();
        List<DesignNode> frames = evaluationSet.stream()
            .filter(NodePredicates::isFrame)
            .toList();

        log.info("Analyzing project {}: {} frames, {} rules", projectId, frames.size(), catalogue.size());

        List<Violation> violations = new ArrayList<>();
        List<RuleFailure> failures = new ArrayList<>();
        int analyzedFrames = 0;

        for (DesignNode node : evaluationSet) {
            CheckContext context = index.contextFor(node);
            for (Rule rule : catalogue.rules()) {
                RuleOutcome outcome = RuleOutcome.evaluate(rule, node, context);
                if (outcome.failed()) {
                    log.error("Rule {} failed on node {}: {}", rule.getId(), node.id(),
                        outcome.error().getMessage(), outcome.error());
                    failures.add(outcome.toFailure());
                } else {
                    violations.addAll(outcome.violations());
                }
            }
            if (node.type() == NodeType.FRAME) {
                analyzedFrames++;
                if (analyzedFrames % PROGRESS_INTERVAL == 0) {
                    log.info("Progress: {}/{} frames analyzed", analyzedFrames, frames.size());
                }
            }
        }

        AnalysisStats stats = computeStats(index.nodes(), frames);
        ViolationCounts counts = ViolationCounts.of(violations);

        log.info("Analysis of {} finished: {} violations ({} critical, {} major, {} minor), {} rule failures",
            projectId, violations.size(), counts.critical(), counts.major(), counts.minor(), failures.size());

        return new AnalysisSummary(
            projectId,
            frames.size(),
            analyzedFrames,
            ScoreResult.unscored(counts),
            violations,
            stats,
            failures
        );
    }

    public int getRulesCount() {
        return catalogue.size();
    }

    public List<RuleDefinition> getAllRuleDefinitions() {
        return catalogue.definitions();
    }

    private static boolean isEvaluated(DesignNode node) {
        return node.type() == NodeType.FRAME || node.type().isComponentLike();
    }

    /**
     * Summary statistics. The depth figure is the average number of direct children per
     * frame, a coarse proxy kept for comparability with earlier reports.
     */
    static AnalysisStats computeStats(List<DesignNode> allNodes, List<DesignNode> frames) {
        int autoLayoutFrames = 0;
        int semanticNames = 0;
        long childTotal = 0;
        for (DesignNode frame : frames) {
            if (frame.hasAutoLayout()) {
                autoLayoutFrames++;
            }
            if (!NodePredicates.isDefaultLayerName(frame.name())) {
                semanticNames++;
            }
            childTotal += frame.childCount();
        }
        int componentUsage = (int) allNodes.stream()
            .filter(NodePredicates::isComponent)
            .count();
        double depthAverage = frames.isEmpty()
            ? 0.0
            : Math.round((double) childTotal / frames.size() * 10) / 10.0;
        return new AnalysisStats(autoLayoutFrames, componentUsage, semanticNames, depthAverage);
    }
}
