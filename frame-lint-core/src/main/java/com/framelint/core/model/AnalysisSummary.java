package com.framelint.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Output of one analysis run.
 *
 * <p>Produced unscored by the rule engine and completed by the score calculator. The
 * summary is a pure function of the input tree and the rule catalogue; nothing in the
 * core keeps it after returning it.</p>
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * AnalysisSummary summary = analyzer.analyze(root, "landing-page");
 * if (summary.scoreResult().canGenerateCode()) {
 *     // hand the tree to code generation
 * }
 * }</pre>
 *
 * @param projectId caller-supplied project id
 * @param totalFrames frame nodes in the tree
 * @param analyzedFrames frame nodes the rules ran against
 * @param scoreResult scores and gates
 * @param violations every violation, in evaluation order
 * @param stats summary statistics
 * @param ruleFailures rules that threw during evaluation
 */
public record AnalysisSummary(
    String projectId,
    int totalFrames,
    int analyzedFrames,
    ScoreResult scoreResult,
    List<Violation> violations,
    AnalysisStats stats,
    List<RuleFailure> ruleFailures
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisSummary {
        Objects.requireNonNull(projectId, "projectId must not be null");
        if (totalFrames < 0) {
            throw new IllegalArgumentException("totalFrames must be >= 0");
        }
        if (analyzedFrames < 0) {
            throw new IllegalArgumentException("analyzedFrames must be >= 0");
        }
        Objects.requireNonNull(scoreResult, "scoreResult must not be null");
        violations = violations == null ? List.of() : List.copyOf(violations);
        if (stats == null) {
            stats = AnalysisStats.empty();
        }
        ruleFailures = ruleFailures == null ? List.of() : List.copyOf(ruleFailures);
    }

    /**
     * Copy of this summary with a new score result.
     *
     * @param scored the calculated scores
     * @return updated summary
     */
    public AnalysisSummary withScoreResult(ScoreResult scored) {
        return new AnalysisSummary(projectId, totalFrames, analyzedFrames, scored, violations, stats, ruleFailures);
    }
}
