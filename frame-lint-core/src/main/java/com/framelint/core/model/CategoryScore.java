package com.framelint.core.model;

import java.util.Objects;

/**
 * Score of one rule category.
 *
 * @param category the category
 * @param score score after penalties (0-100, rounded)
 * @param maxScore maximum attainable score (100)
 * @param violationCount number of violations in this category
 * @param weight share of the overall score (0-1)
 */
public record CategoryScore(
    RuleCategory category,
    int score,
    int maxScore,
    int violationCount,
    double weight
) {
    /**
     * Compact constructor with validation.
     */
    public CategoryScore {
        Objects.requireNonNull(category, "category must not be null");
        if (score < 0 || score > maxScore) {
            throw new IllegalArgumentException("score must be within 0.." + maxScore + ": " + score);
        }
        if (violationCount < 0) {
            throw new IllegalArgumentException("violationCount must be >= 0");
        }
        if (weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException("weight must be within 0..1: " + weight);
        }
    }
}
