package com.framelint.core.model;

/**
 * Summary statistics of an analysed tree.
 *
 * @param autoLayoutFrames frames with an auto-layout direction
 * @param componentUsage component and instance nodes
 * @param semanticNames frames not carrying a design-tool default name
 * @param depthAverage average child count per frame, one decimal (coarse depth proxy)
 */
public record AnalysisStats(
    int autoLayoutFrames,
    int componentUsage,
    int semanticNames,
    double depthAverage
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisStats {
        if (autoLayoutFrames < 0 || componentUsage < 0 || semanticNames < 0) {
            throw new IllegalArgumentException("statistics counts must be >= 0");
        }
        if (depthAverage < 0.0) {
            depthAverage = 0.0;
        }
    }

    /**
     * Statistics of an empty tree.
     *
     * @return zero statistics
     */
    public static AnalysisStats empty() {
        return new AnalysisStats(0, 0, 0, 0.0);
    }
}
