package com.ryuqq.tabular.core.exception;

/**
 * An update or delete matched no rows while the caller required one.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class NotFoundException extends TabularException {

    public NotFoundException(String message) {
        super(message);
    }
}
