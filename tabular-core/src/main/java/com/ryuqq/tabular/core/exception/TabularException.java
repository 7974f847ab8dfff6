package com.ryuqq.tabular.core.exception;

/**
 * Base type of every error raised by the persistence layer.
 *
 * <p>All subtypes are unchecked. Mutation paths let them propagate to the
 * transaction coordinator, which rolls back and rethrows them unchanged.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public abstract class TabularException extends RuntimeException {

    protected TabularException(String message) {
        super(message);
    }

    protected TabularException(String message, Throwable cause) {
        super(message, cause);
    }
}
