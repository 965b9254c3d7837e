package com.framelint.core.query;

import com.framelint.core.model.Violation;

import java.util.List;

/**
 * One page of violations.
 *
 * @param violations violations on this page
 * @param total violations matching the filters, over all pages
 * @param limit page size used
 * @param offset index of the first violation on this page
 * @param hasMore whether further pages exist
 */
public record ViolationPage(
    List<Violation> violations,
    int total,
    int limit,
    int offset,
    boolean hasMore
) {
    public ViolationPage {
        violations = violations == null ? List.of() : List.copyOf(violations);
        if (total < 0 || limit < 1 || offset < 0) {
            throw new IllegalArgumentException("invalid page bounds: total=" + total
                + ", limit=" + limit + ", offset=" + offset);
        }
    }
}
