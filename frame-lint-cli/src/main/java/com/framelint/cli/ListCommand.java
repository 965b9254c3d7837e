package com.framelint.cli;

import com.framelint.core.renderer.OutputRenderer;
import com.framelint.core.rule.Rule;
import com.framelint.core.rule.RuleCatalogue;
import com.framelint.core.rule.RuleDefinition;
import com.framelint.core.scoring.ScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list the available rules or renderers.
 *
 * <p>Both are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * framelint list rules
 * framelint list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available rules or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: rules or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "rules", "rule" -> listRules();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: rules or renderers", type);
                System.err.println("✗ Unknown type: " + type + " (use rules or renderers)");
                yield ExitCodes.ERROR;
            }
        };
    }

    private int listRules() {
        RuleCatalogue catalogue = RuleCatalogue.discover();
        System.out.println("Available Rules (" + catalogue.size() + "):");
        System.out.println();

        for (Rule rule : catalogue.rules()) {
            RuleDefinition definition = rule.getDefinition();
            System.out.printf("  • %s (ID: %s)%n", definition.name(), definition.id());
            System.out.printf("    %s / %s, penalty %d, weight %d%n",
                definition.category(), definition.severity(),
                ScoreCalculator.SEVERITY_PENALTIES.get(definition.severity()), definition.scoreWeight());
            System.out.printf("    Applies to: %s%n", rule.getSupportedNodeTypes());
            System.out.printf("    %s%n", definition.description());
            System.out.println();
        }

        if (catalogue.isEmpty()) {
            System.out.println("  No rules found.");
        }
        return ExitCodes.OK;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s (%s)%n", renderer.getId(), renderer.getClass().getSimpleName());
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return ExitCodes.OK;
    }
}
