package com.ryuqq.tabular.core.exception;

/**
 * A caller-side precondition was violated, such as updating before reading or deleting every row without an explicit override.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class PreconditionException extends TabularException {

    public PreconditionException(String message) {
        super(message);
    }
}
