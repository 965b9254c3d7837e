package com.framelint.core.renderer.impl;

import com.framelint.core.renderer.GeneratedFile;
import com.framelint.core.renderer.GeneratedOutput;
import com.framelint.core.renderer.OutputRenderer;
import com.framelint.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Renderer that prints report files to standard output.
 *
 * <p>Plain-text reports get their violation lines colored by severity. Color can be
 * switched off for CI logs or redirected output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.showHeaders} - print a header line per file ("true"/"false", default: "false")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.isEnabled("console.colors", true);
        boolean showHeaders = context.isEnabled("console.showHeaders", false);
        logger.debug("Rendering {} files to console (colors: {})", output.files().size(), useColors);

        PrintStream out = System.out;
        for (GeneratedFile file : output.files()) {
            if (showHeaders) {
                out.println(paint(ANSI_BOLD + ANSI_CYAN, "== " + file.relativePath() + " ==", useColors));
            }
            if ("text/plain".equals(file.contentType())) {
                file.content().lines().forEach(line -> out.println(colorBySeverity(line, useColors)));
            } else {
                out.println(file.content());
            }
        }
        out.flush();
    }

    private static String colorBySeverity(String line, boolean useColors) {
        if (line.startsWith("CRITICAL")) {
            return paint(ANSI_RED, line, useColors);
        }
        if (line.startsWith("MAJOR")) {
            return paint(ANSI_YELLOW, line, useColors);
        }
        if (line.startsWith("MINOR")) {
            return paint(ANSI_CYAN, line, useColors);
        }
        if (line.startsWith("Project ")) {
            return paint(ANSI_BOLD, line, useColors);
        }
        return line;
    }

    private static String paint(String color, String text, boolean useColors) {
        return useColors ? color + text + ANSI_RESET : text;
    }
}
