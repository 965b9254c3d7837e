package com.framelint.core.query;

import com.framelint.core.model.RuleCategory;
import com.framelint.core.model.Severity;
import com.framelint.core.model.Violation;

import java.util.Comparator;
import java.util.List;

/**
 * Filter, order and paginate the violations of an analysis.
 *
 * <p>Violations are ordered by severity (CRITICAL first) and then by frame name. The
 * page size defaults to {@value #DEFAULT_LIMIT} and is capped at {@value #MAX_LIMIT}.</p>
 *
 * <pre>{@code
 * ViolationPage page = ViolationQuery.all()
 *     .withSeverity(Severity.CRITICAL)
 *     .page(20, 0)
 *     .apply(summary.violations());
 * }</pre>
 *
 * @param severity only this severity, or null for any
 * @param category only this category, or null for any
 * @param ruleId only this rule, or null for any
 * @param limit page size
 * @param offset violations to skip
 */
public record ViolationQuery(
    Severity severity,
    RuleCategory category,
    String ruleId,
    int limit,
    int offset
) {
    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    /** Severity first (CRITICAL before INFO), then frame name. */
    public static final Comparator<Violation> DISPLAY_ORDER = Comparator
        .comparing(Violation::severity)
        .thenComparing(Violation::frameName);

    /**
     * Compact constructor normalizing the page bounds.
     */
    public ViolationQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
        offset = Math.max(0, offset);
    }

    /**
     * First page of all violations.
     *
     * @return unfiltered query
     */
    public static ViolationQuery all() {
        return new ViolationQuery(null, null, null, DEFAULT_LIMIT, 0);
    }

    public ViolationQuery withSeverity(Severity severity) {
        return new ViolationQuery(severity, category, ruleId, limit, offset);
    }

    public ViolationQuery withCategory(RuleCategory category) {
        return new ViolationQuery(severity, category, ruleId, limit, offset);
    }

    public ViolationQuery withRuleId(String ruleId) {
        return new ViolationQuery(severity, category, ruleId, limit, offset);
    }

    public ViolationQuery page(int limit, int offset) {
        return new ViolationQuery(severity, category, ruleId, limit, offset);
    }

    /**
     * Whether a violation passes the filters.
     *
     * @param violation candidate
     * @return true if it matches every set filter
     */
    public boolean matches(Violation violation) {
        return (severity == null || violation.severity() == severity)
            && (category == null || violation.category() == category)
            && (ruleId == null || violation.ruleId().equals(ruleId));
    }

    /**
     * Runs the query.
     *
     * @param violations violations of an analysis
     * @return the requested page
     */
    public ViolationPage apply(List<Violation> violations) {
        List<Violation> matching = violations.stream()
            .filter(this::matches)
            .sorted(DISPLAY_ORDER)
            .toList();
        int from = Math.min(offset, matching.size());
        int to = Math.min(from + limit, matching.size());
        List<Violation> page = matching.subList(from, to);
        return new ViolationPage(page, matching.size(), limit, offset, offset + page.size() < matching.size());
    }
}
