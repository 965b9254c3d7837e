package com.framelint.core.scoring;

import com.framelint.core.model.AnalysisSummary;
import com.framelint.core.model.CategoryScore;
import com.framelint.core.model.RuleCategory;
import com.framelint.core.model.ScoreResult;
import com.framelint.core.model.Severity;
import com.framelint.core.model.Violation;
import com.framelint.core.model.ViolationCounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the violations of an analysis into category scores, an overall score and the
 * two generation gates.
 *
 * <p><b>Algorithm:</b></p>
 * <ol>
 *   <li>Per category, sum the severity penalties of its violations
 *       (CRITICAL 10, MAJOR 5, MINOR 2, INFO 0).</li>
 *   <li>Normalize by tree size: {@code penalty / totalFrames * 10}, or the raw sum for a
 *       tree without frames.</li>
 *   <li>Category score is {@code round(max(0, 100 - normalized))}.</li>
 *   <li>Overall score is the weighted sum of category scores, rounded.</li>
 *   <li>Code generation needs an overall score of {@value #CODE_GENERATION_THRESHOLD};
 *       grid layout needs {@value #GRID_LAYOUT_THRESHOLD}.</li>
 * </ol>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class ScoreCalculator {

    private static final Logger log = LoggerFactory.getLogger(ScoreCalculator.class);

    public static final int MAX_SCORE = 100;
    public static final int CODE_GENERATION_THRESHOLD = 90;
    public static final int GRID_LAYOUT_THRESHOLD = 100;

    /** Penalty points per violation severity. */
    public static final Map<Severity, Integer> SEVERITY_PENALTIES;

    /** Category weights in whole percent; they add up to 100. */
    private static final Map<RuleCategory, Integer> CATEGORY_WEIGHT_PERCENT;

    static {
        Map<Severity, Integer> penalties = new EnumMap<>(Severity.class);
        penalties.put(Severity.CRITICAL, 10);
        penalties.put(Severity.MAJOR, 5);
        penalties.put(Severity.MINOR, 2);
        penalties.put(Severity.INFO, 0);
        SEVERITY_PENALTIES = Collections.unmodifiableMap(penalties);

        Map<RuleCategory, Integer> weights = new EnumMap<>(RuleCategory.class);
        weights.put(RuleCategory.LAYOUT, 30);
        weights.put(RuleCategory.SIZE, 20);
        weights.put(RuleCategory.RESPONSIVE, 25);
        weights.put(RuleCategory.SEMANTIC, 10);
        weights.put(RuleCategory.COMPONENT, 15);
        CATEGORY_WEIGHT_PERCENT = Collections.unmodifiableMap(weights);
    }

    /**
     * Weight of a category in the overall score.
     *
     * @param category the category
     * @return weight between 0 and 1
     */
    public static double weightOf(RuleCategory category) {
        return CATEGORY_WEIGHT_PERCENT.get(category) / 100.0;
    }

    /**
     * Scores an analysed summary.
     *
     * @param summary summary from the rule engine
     * @return a copy carrying the scores; the input is left untouched
     */
    public AnalysisSummary calculateScores(AnalysisSummary summary) {
        Objects.requireNonNull(summary, "summary must not be null");
        log.debug("Scoring project {}: {} violations over {} frames",
            summary.projectId(), summary.violations().size(), summary.totalFrames());

        List<CategoryScore> categoryScores = calculateCategoryScores(summary.violations(), summary.totalFrames());
        int overall = calculateOverallScore(categoryScores);
        ScoreResult result = new ScoreResult(
            overall,
            categoryScores,
            ViolationCounts.of(summary.violations()),
            overall >= CODE_GENERATION_THRESHOLD,
            overall >= GRID_LAYOUT_THRESHOLD
        );

        log.info("Project {} scored {} ({}): code generation {}, grid layout {}",
            summary.projectId(), overall, getScoreGrade(overall),
            result.canGenerateCode() ? "allowed" : "blocked",
            result.canUseGridLayout() ? "allowed" : "blocked");
        return summary.withScoreResult(result);
    }

    /**
     * Scores each category.
     *
     * @param violations all violations of the analysis
     * @param totalFrames frame count used for normalization
     * @return one score per category, in {@link RuleCategory} order
     */
    public List<CategoryScore> calculateCategoryScores(List<Violation> violations, int totalFrames) {
        Map<RuleCategory, Integer> penalties = new EnumMap<>(RuleCategory.class);
        Map<RuleCategory, Integer> counts = new EnumMap<>(RuleCategory.class);
        for (Violation violation : violations) {
            penalties.merge(violation.category(), SEVERITY_PENALTIES.get(violation.severity()), Integer::sum);
            counts.merge(violation.category(), 1, Integer::sum);
        }

        List<CategoryScore> scores = new ArrayList<>();
        for (RuleCategory category : RuleCategory.values()) {
            int penalty = penalties.getOrDefault(category, 0);
            double normalized = totalFrames > 0
                ? (double) penalty / totalFrames * 10
                : penalty;
            int score = (int) Math.round(Math.max(0, MAX_SCORE - normalized));
            scores.add(new CategoryScore(
                category,
                score,
                MAX_SCORE,
                counts.getOrDefault(category, 0),
                weightOf(category)
            ));
        }
        return List.copyOf(scores);
    }

    /**
     * Weighted overall score.
     *
     * @param categoryScores category scores
     * @return overall score (0-100)
     */
    public int calculateOverallScore(List<CategoryScore> categoryScores) {
        long weightedSum = 0;
        for (CategoryScore categoryScore : categoryScores) {
            weightedSum += (long) categoryScore.score() * CATEGORY_WEIGHT_PERCENT.get(categoryScore.category());
        }
        return (int) Math.round(weightedSum / 100.0);
    }

    public ScoreLevel getScoreLevel(int score) {
        return ScoreLevel.of(score);
    }

    public String getScoreMessage(int score) {
        return ScoreLevel.of(score).getMessage();
    }

    public String getScoreGrade(int score) {
        return ScoreLevel.of(score).getGrade();
    }
}
