package com.framelint.core;

import com.framelint.core.engine.RuleEngine;
import com.framelint.core.model.AnalysisSummary;
import com.framelint.core.model.DesignDocument;
import com.framelint.core.model.DesignNode;
import com.framelint.core.rule.RuleCatalogue;
import com.framelint.core.scoring.ScoreCalculator;

import java.util.Objects;

/**
 * Entry point of the analysis pipeline: rule evaluation followed by scoring.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * DesignAnalyzer analyzer = DesignAnalyzer.withBaselineRules();
 * AnalysisSummary summary = analyzer.analyze(document.document(), "landing-page");
 * int score = summary.scoreResult().overallScore();
 * }</pre>
 */
public class DesignAnalyzer {

    private final RuleEngine ruleEngine;
    private final ScoreCalculator scoreCalculator;

    public DesignAnalyzer(RuleEngine ruleEngine, ScoreCalculator scoreCalculator) {
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine must not be null");
        this.scoreCalculator = Objects.requireNonNull(scoreCalculator, "scoreCalculator must not be null");
    }

    /**
     * Analyzer running the built-in rules.
     *
     * @return new analyzer
     */
    public static DesignAnalyzer withBaselineRules() {
        return new DesignAnalyzer(new RuleEngine(RuleCatalogue.baseline()), new ScoreCalculator());
    }

    /**
     * Analyzes and scores a tree.
     *
     * @param root tree root
     * @param projectId id echoed in the summary
     * @return scored summary
     */
    public AnalysisSummary analyze(DesignNode root, String projectId) {
        return scoreCalculator.calculateScores(ruleEngine.analyze(root, projectId));
    }

    /**
     * Analyzes and scores a loaded design file.
     *
     * @param document design file
     * @param projectId id echoed in the summary
     * @return scored summary
     */
    public AnalysisSummary analyze(DesignDocument document, String projectId) {
        return analyze(document.document(), projectId);
    }

    public RuleEngine getRuleEngine() {
        return ruleEngine;
    }

    public ScoreCalculator getScoreCalculator() {
        return scoreCalculator;
    }
}
