package com.ryuqq.tabular.core.exception;

/**
 * A write was rejected by the store: wrong column names, data types, string truncation or locks.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class SchemaMismatchException extends TabularException {

    public SchemaMismatchException(String message) {
        super(message);
    }

    public SchemaMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
