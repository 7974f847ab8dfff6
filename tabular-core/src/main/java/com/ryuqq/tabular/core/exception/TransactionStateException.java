package com.ryuqq.tabular.core.exception;

/**
 * Mutation attempted outside an edit session that is required, or the audit shadow table diverges from its parent.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class TransactionStateException extends TabularException {

    public TransactionStateException(String message) {
        super(message);
    }

    public TransactionStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
