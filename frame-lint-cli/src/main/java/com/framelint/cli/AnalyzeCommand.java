package com.framelint.cli;

import com.framelint.core.DesignAnalyzer;
import com.framelint.core.config.ConfigLoader;
import com.framelint.core.config.LintConfig;
import com.framelint.core.document.DesignDocumentLoader;
import com.framelint.core.engine.RuleEngine;
import com.framelint.core.model.AnalysisSummary;
import com.framelint.core.model.DesignDocument;
import com.framelint.core.model.ScoreResult;
import com.framelint.core.renderer.GeneratedOutput;
import com.framelint.core.renderer.OutputRenderer;
import com.framelint.core.renderer.RenderContext;
import com.framelint.core.report.ReportFormat;
import com.framelint.core.report.ReportGenerator;
import com.framelint.core.rule.RuleCatalogue;
import com.framelint.core.scoring.ScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Command to analyze a design document.
 *
 * <p>Loads the document, runs the enabled rules, scores the result and renders the
 * requested reports. Without {@code -o} the reports go to the console; with it they are
 * written to the given directory.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * framelint analyze landing.json
 * framelint analyze landing.json -c framelint.yaml -f markdown -f json -o ./report
 * framelint analyze landing.json --fail-on code
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze a design document and report its conformance score",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    /**
     * Gate whose failure turns into a non-zero exit code.
     */
    public enum FailOn {
        /** Never fail on the score */
        NONE,
        /** Fail unless code generation is allowed */
        CODE,
        /** Fail unless grid layout generation is allowed */
        GRID
    }

    @Parameters(index = "0", description = "Design document (JSON file export or bare node)")
    private Path documentFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: framelint.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--project-id"}, description = "Project id for the report (overrides config)")
    private String projectId;

    @Option(
        names = {"-f", "--format"},
        description = "Report format: console, markdown or json (repeatable)"
    )
    private List<String> formats = new ArrayList<>();

    @Option(names = {"-o", "--output"}, description = "Write reports to this directory instead of the console")
    private Path outputDir;

    @Option(
        names = {"--fail-on"},
        description = "Exit with code 2 when this gate is closed: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "NONE"
    )
    private FailOn failOn;

    @Option(names = {"--no-color"}, description = "Disable ANSI colors in console output")
    private boolean noColor;

    @Override
    public Integer call() {
        try {
            LintConfig config = ConfigLoader.load(configPath);

            DesignDocument document = DesignDocumentLoader.load(documentFile);
            RuleCatalogue catalogue = RuleCatalogue.discover().filter(config.rules());
            if (catalogue.isEmpty()) {
                log.error("Configuration {} leaves no rule enabled", configPath);
                System.err.println("✗ Analysis failed: configuration disables every rule");
                return ExitCodes.ERROR;
            }
            DesignAnalyzer analyzer = new DesignAnalyzer(new RuleEngine(catalogue), new ScoreCalculator());
            log.info("Analyzing {} with {} rules", documentFile, analyzer.getRuleEngine().getRulesCount());

            AnalysisSummary summary = analyzer.analyze(document, resolveProjectId(config, document));

            Set<ReportFormat> reportFormats = resolveFormats(config);
            GeneratedOutput output = new ReportGenerator().generate(summary, reportFormats);
            render(output, config);

            ScoreResult score = summary.scoreResult();
            if (outputDir != null) {
                System.out.println("✓ Score " + score.overallScore() + "/100, wrote "
                    + output.files().size() + " report(s) to " + outputDir);
                System.out.println("  " + analyzer.getScoreCalculator().getScoreMessage(score.overallScore()));
            }
            if (!summary.ruleFailures().isEmpty()) {
                System.err.println("! " + summary.ruleFailures().size() + " rule check(s) failed; see log");
            }
            return gatePassed(score) ? ExitCodes.OK : ExitCodes.GATE_FAILED;
        } catch (Exception e) {
            log.error("Analysis failed", e);
            System.err.println("✗ Analysis failed: " + e.getMessage());
            return ExitCodes.ERROR;
        }
    }

    private String resolveProjectId(LintConfig config, DesignDocument document) {
        if (projectId != null && !projectId.isBlank()) {
            return projectId;
        }
        String configured = config.project().id();
        if (configured != null && !configured.isBlank() && !"default".equals(configured)) {
            return configured;
        }
        return document.name().isBlank() ? String.valueOf(documentFile.getFileName()) : document.name();
    }

    private Set<ReportFormat> resolveFormats(LintConfig config) {
        List<String> requested = formats;
        if (requested.isEmpty()) {
            requested = outputDir != null && !config.output().formats().isEmpty()
                ? config.output().formats()
                : List.of(outputDir != null ? ReportFormat.MARKDOWN.getId() : ReportFormat.CONSOLE.getId());
        }
        Set<ReportFormat> resolved = new LinkedHashSet<>();
        for (String id : requested) {
            resolved.add(ReportFormat.fromId(id));
        }
        return resolved;
    }

    private void render(GeneratedOutput output, LintConfig config) {
        String rendererId = outputDir != null ? "filesystem" : "console";
        OutputRenderer renderer = findRenderer(rendererId);
        String directory = outputDir != null ? outputDir.toString() : config.output().directory();
        log.debug("Rendering {} files with renderer {}", output.files().size(), rendererId);
        renderer.render(output, new RenderContext(directory, Map.of("console.colors", String.valueOf(!noColor))));
    }

    private static OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalStateException("No renderer registered with id: " + id);
    }

    private boolean gatePassed(ScoreResult score) {
        return switch (failOn) {
            case NONE -> true;
            case CODE -> score.canGenerateCode();
            case GRID -> score.canUseGridLayout();
        };
    }
}
