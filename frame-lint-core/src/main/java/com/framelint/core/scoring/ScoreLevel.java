package com.framelint.core.scoring;

/**
 * Presentation band of an overall score.
 *
 * <p>The message of every band below {@link #EXCELLENT} states that code generation is
 * blocked, in line with the code generation gate.</p>
 */
public enum ScoreLevel {

    PERFECT(100, "S", "Perfect",
        "Fully conformant. Code and grid layout generation are available."),
    EXCELLENT(90, "A", "Excellent",
        "Conformance of 90% or more. Code generation is available."),
    GOOD(75, "B", "Good",
        "Conformance of 75% or more. Code generation is blocked until the remaining issues are fixed."),
    FAIR(60, "C", "Needs improvement",
        "Conformance of 60% or more. Code generation is blocked; many issues need fixing."),
    POOR(0, "D", "Poor",
        "Conformance below 60%. Code generation is blocked; rework the design before generating code.");

    private final int minimumScore;
    private final String grade;
    private final String label;
    private final String message;

    ScoreLevel(int minimumScore, String grade, String label, String message) {
        this.minimumScore = minimumScore;
        this.grade = grade;
        this.label = label;
        this.message = message;
    }

    /**
     * Band of a score.
     *
     * @param score overall score (0-100)
     * @return the highest band whose minimum the score reaches
     */
    public static ScoreLevel of(int score) {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score must be within 0..100: " + score);
        }
        for (ScoreLevel level : values()) {
            if (score >= level.minimumScore) {
                return level;
            }
        }
        return POOR;
    }

    public String getGrade() {
        return grade;
    }

    public String getLabel() {
        return label;
    }

    public String getMessage() {
        return message;
    }
}
