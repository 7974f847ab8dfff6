package com.ryuqq.tabular.core.exception;

/**
 * A filter matched more rows than the single-row policy allows.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class MultiplicityException extends TabularException {

    private final long matched;

    public MultiplicityException(String message, long matched) {
        super(message + " (matched: " + matched + ")");
        this.matched = matched;
    }

    /**
     * @return number of rows the filter matched, or -1 when the scan stopped early
     */
    public long getMatched() {
        return matched;
    }
}
