package com.framelint.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.framelint.core.model.AnalysisStats;
import com.framelint.core.model.AnalysisSummary;
import com.framelint.core.model.CategoryScore;
import com.framelint.core.model.RuleFailure;
import com.framelint.core.model.ScoreResult;
import com.framelint.core.model.Severity;
import com.framelint.core.model.Violation;
import com.framelint.core.query.ViolationQuery;
import com.framelint.core.renderer.GeneratedFile;
import com.framelint.core.renderer.GeneratedOutput;
import com.framelint.core.scoring.ScoreLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders a scored analysis summary as report files.
 *
 * <p>Each format yields one {@link GeneratedFile}; hand the resulting
 * {@link GeneratedOutput} to an {@link com.framelint.core.renderer.OutputRenderer}.</p>
 */
public class ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    private static final ObjectMapper JSON_MAPPER = JsonMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .build();

    /**
     * Generates one file per requested format, in {@link ReportFormat} order.
     *
     * @param summary scored summary
     * @param formats formats to produce
     * @return generated files
     */
    public GeneratedOutput generate(AnalysisSummary summary, Collection<ReportFormat> formats) {
        Objects.requireNonNull(summary, "summary must not be null");
        if (!summary.scoreResult().scored()) {
            log.warn("Generating report for unscored summary of project {}", summary.projectId());
        }
        EnumSet<ReportFormat> wanted = formats.isEmpty()
            ? EnumSet.noneOf(ReportFormat.class)
            : EnumSet.copyOf(formats);
        List<GeneratedFile> files = new ArrayList<>();
        for (ReportFormat format : wanted) {
            files.add(generate(summary, format));
        }
        log.debug("Generated {} report files for project {}", files.size(), summary.projectId());
        return new GeneratedOutput(files);
    }

    /**
     * Generates a single report file.
     *
     * @param summary scored summary
     * @param format report format
     * @return the file
     */
    public GeneratedFile generate(AnalysisSummary summary, ReportFormat format) {
        String content = switch (format) {
            case CONSOLE -> toText(summary);
            case MARKDOWN -> toMarkdown(summary);
            case JSON -> toJson(summary);
        };
        return new GeneratedFile(format.getFileName(), content, format.getContentType());
    }

    String toJson(AnalysisSummary summary) {
        try {
            return JSON_MAPPER.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize summary of project " + summary.projectId(), e);
        }
    }

    String toMarkdown(AnalysisSummary summary) {
        ScoreResult score = summary.scoreResult();
        ScoreLevel level = ScoreLevel.of(score.overallScore());
        StringBuilder md = new StringBuilder();

        md.append("# Design Lint Report: ").append(summary.projectId()).append("\n\n");
        md.append("**Score:** ").append(score.overallScore()).append("/100 (")
            .append(level.getGrade()).append(", ").append(level.getLabel()).append(")\n\n");
        md.append("> ").append(level.getMessage()).append("\n\n");
        md.append("| Gate | Status |\n|---|---|\n");
        md.append("| Code generation | ").append(yesNo(score.canGenerateCode())).append(" |\n");
        md.append("| Grid layout | ").append(yesNo(score.canUseGridLayout())).append(" |\n\n");

        md.append("## Categories\n\n");
        md.append("| Category | Score | Weight | Violations |\n|---|---:|---:|---:|\n");
        for (CategoryScore category : score.categoryScores()) {
            md.append("| ").append(category.category())
                .append(" | ").append(category.score()).append('/').append(category.maxScore())
                .append(" | ").append(Math.round(category.weight() * 100)).append('%')
                .append(" | ").append(category.violationCount()).append(" |\n");
        }
        md.append('\n');

        AnalysisStats stats = summary.stats();
        md.append("## Statistics\n\n");
        md.append("- Frames: ").append(summary.totalFrames()).append(" (analyzed ")
            .append(summary.analyzedFrames()).append(")\n");
        md.append("- Auto layout frames: ").append(stats.autoLayoutFrames()).append('\n');
        md.append("- Components and instances: ").append(stats.componentUsage()).append('\n');
        md.append("- Frames with named layers: ").append(stats.semanticNames()).append('\n');
        md.append("- Average children per frame: ").append(formatDecimal(stats.depthAverage())).append("\n\n");

        md.append("## Violations (").append(summary.violations().size()).append(")\n");
        List<Violation> ordered = summary.violations().stream()
            .sorted(ViolationQuery.DISPLAY_ORDER)
            .toList();
        for (Severity severity : Severity.values()) {
            List<Violation> group = ordered.stream()
                .filter(violation -> violation.severity() == severity)
                .toList();
            if (group.isEmpty()) {
                continue;
            }
            md.append("\n### ").append(severity).append(" (").append(group.size()).append(")\n\n");
            for (Violation violation : group) {
                md.append("- **").append(violation.frameName()).append("** `").append(violation.ruleId())
                    .append("`: ").append(violation.description()).append('\n');
                if (violation.detectedValue() != null || violation.expectedValue() != null) {
                    md.append("  - detected: ").append(orDash(violation.detectedValue()))
                        .append(", expected: ").append(orDash(violation.expectedValue())).append('\n');
                }
                if (violation.suggestion() != null) {
                    md.append("  - fix: ").append(violation.suggestion()).append('\n');
                }
            }
        }

        if (!summary.ruleFailures().isEmpty()) {
            md.append("\n## Rule failures\n\n");
            for (RuleFailure failure : summary.ruleFailures()) {
                md.append("- `").append(failure.ruleId()).append("` on node `").append(failure.nodeId())
                    .append("`: ").append(failure.message()).append('\n');
            }
        }
        return md.toString();
    }

    String toText(AnalysisSummary summary) {
        ScoreResult score = summary.scoreResult();
        ScoreLevel level = ScoreLevel.of(score.overallScore());
        StringBuilder text = new StringBuilder();

        text.append("Project ").append(summary.projectId()).append(": score ")
            .append(score.overallScore()).append("/100 [").append(level.getGrade()).append("]\n");
        text.append(level.getMessage()).append('\n');
        text.append("Code generation: ").append(yesNo(score.canGenerateCode()))
            .append(", grid layout: ").append(yesNo(score.canUseGridLayout())).append('\n');
        for (CategoryScore category : score.categoryScores()) {
            text.append(String.format(Locale.ROOT, "  %-11s %3d  (%d violations)%n",
                category.category(), category.score(), category.violationCount()));
        }
        text.append("Violations by severity:");
        for (Severity severity : Severity.values()) {
            text.append(' ').append(severity).append(' ').append(score.violationCounts().countOf(severity));
        }
        text.append("\n\n");
        for (Violation violation : summary.violations().stream().sorted(ViolationQuery.DISPLAY_ORDER).toList()) {
            text.append(String.format(Locale.ROOT, "%-8s %-22s %s: %s%n",
                violation.severity(), violation.ruleId(), violation.frameName(), violation.description()));
        }
        text.append(score.violationCounts().total()).append(" violation(s) in ")
            .append(summary.totalFrames()).append(" frame(s)\n");
        return text.toString();
    }

    private static String yesNo(boolean value) {
        return value ? "allowed" : "blocked";
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    private static String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
