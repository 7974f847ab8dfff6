package com.ryuqq.tabular.core.exception;

/**
 * Insert was required but a matching row already exists.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class InsertTargetExistsException extends TabularException {

    public InsertTargetExistsException(String message) {
        super(message);
    }
}
