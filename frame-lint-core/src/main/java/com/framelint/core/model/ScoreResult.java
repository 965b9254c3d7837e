package com.framelint.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Scores and gating decisions of one analysis.
 *
 * <p>An unscored result (straight out of the rule engine) has no category scores,
 * an overall score of 0 and both gates closed.</p>
 *
 * @param overallScore weighted overall score (0-100)
 * @param categoryScores one entry per {@link RuleCategory} once scored, empty before
 * @param violationCounts violations by severity
 * @param canGenerateCode whether the score permits code generation
 * @param canUseGridLayout whether the score permits grid layout generation
 */
public record ScoreResult(
    int overallScore,
    List<CategoryScore> categoryScores,
    ViolationCounts violationCounts,
    boolean canGenerateCode,
    boolean canUseGridLayout
) {
    /**
     * Compact constructor with validation.
     */
    public ScoreResult {
        if (overallScore < 0 || overallScore > 100) {
            throw new IllegalArgumentException("overallScore must be within 0..100: " + overallScore);
        }
        categoryScores = categoryScores == null ? List.of() : List.copyOf(categoryScores);
        Objects.requireNonNull(violationCounts, "violationCounts must not be null");
        if (canUseGridLayout && !canGenerateCode) {
            throw new IllegalArgumentException("grid layout cannot be allowed without code generation");
        }
    }

    /**
     * Result before scoring.
     *
     * @param violationCounts violations by severity
     * @return unscored result
     */
    public static ScoreResult unscored(ViolationCounts violationCounts) {
        return new ScoreResult(0, List.of(), violationCounts, false, false);
    }

    /**
     * Whether category scores have been calculated.
     *
     * @return true once scored
     */
    public boolean scored() {
        return !categoryScores.isEmpty();
    }

    /**
     * Score of one category.
     *
     * @param category the category
     * @return the category score, or 100 when not scored yet
     */
    public int scoreOf(RuleCategory category) {
        return categoryScores.stream()
            .filter(categoryScore -> categoryScore.category() == category)
            .mapToInt(CategoryScore::score)
            .findFirst()
            .orElse(100);
    }
}
