package com.framelint.core.report;

import java.util.Arrays;
import java.util.Locale;

/**
 * Report formats the generator can produce.
 */
public enum ReportFormat {

    /** Plain-text summary for terminals. */
    CONSOLE("console", "framelint-report.txt", "text/plain"),
    /** Markdown report with tables. */
    MARKDOWN("markdown", "framelint-report.md", "text/markdown"),
    /** Full summary as JSON. */
    JSON("json", "framelint-report.json", "application/json");

    private final String id;
    private final String fileName;
    private final String contentType;

    ReportFormat(String id, String fileName, String contentType) {
        this.id = id;
        this.fileName = fileName;
        this.contentType = contentType;
    }

    /**
     * Looks up a format by id, case-insensitively.
     *
     * @param id format id such as "markdown"
     * @return the format
     * @throws IllegalArgumentException for an unknown id
     */
    public static ReportFormat fromId(String id) {
        String wanted = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(format -> format.id.equals(wanted))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown report format: " + id
                + " (expected console, markdown or json)"));
    }

    public String getId() {
        return id;
    }

    public String getFileName() {
        return fileName;
    }

    public String getContentType() {
        return contentType;
    }
}
