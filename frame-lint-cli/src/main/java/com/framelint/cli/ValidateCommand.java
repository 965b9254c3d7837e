package com.framelint.cli;

import com.framelint.core.config.ConfigLoader;
import com.framelint.core.config.LintConfig;
import com.framelint.core.document.DesignDocumentLoader;
import com.framelint.core.engine.TreeIndex;
import com.framelint.core.model.DesignDocument;
import com.framelint.core.report.ReportFormat;
import com.framelint.core.rule.RuleCatalogue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to validate a configuration file and, optionally, a design document.
 *
 * <p>Unlike {@code analyze}, a missing or unparsable configuration is an error here.
 */
@Command(
    name = "validate",
    description = "Validate a configuration file and optionally a design document",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Parameters(index = "0", description = "Config file to validate", defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Option(names = {"-d", "--document"}, description = "Design document to check for loadability")
    private Path documentFile;

    @Override
    public Integer call() {
        log.info("Validating configuration: {}", configFile);
        List<String> problems = new ArrayList<>();

        if (!Files.isRegularFile(configFile)) {
            problems.add("Configuration file not found: " + configFile);
        } else {
            try {
                validateConfig(ConfigLoader.parse(configFile), problems);
            } catch (Exception e) {
                log.debug("Configuration parse error", e);
                problems.add("Configuration is not valid: " + e.getMessage());
            }
        }

        if (documentFile != null) {
            try {
                DesignDocument document = DesignDocumentLoader.load(documentFile);
                int nodes = TreeIndex.build(document.document()).size();
                System.out.println("✓ Document '" + document.name() + "' loads (" + nodes + " nodes)");
            } catch (Exception e) {
                log.debug("Document load error", e);
                problems.add("Document cannot be loaded: " + e.getMessage());
            }
        }

        if (problems.isEmpty()) {
            System.out.println("✓ Configuration is valid: " + configFile);
            return ExitCodes.OK;
        }
        for (String problem : problems) {
            System.err.println("✗ " + problem);
        }
        return ExitCodes.ERROR;
    }

    private void validateConfig(LintConfig config, List<String> problems) {
        RuleCatalogue catalogue = RuleCatalogue.discover();
        for (String ruleId : config.rules().referencedIds()) {
            if (catalogue.find(ruleId).isEmpty()) {
                problems.add("Unknown rule id: " + ruleId);
            }
        }
        if (catalogue.filter(config.rules()).isEmpty()) {
            problems.add("Configuration disables every rule");
        }
        for (String format : config.output().formats()) {
            try {
                ReportFormat.fromId(format);
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
        }
    }
}
