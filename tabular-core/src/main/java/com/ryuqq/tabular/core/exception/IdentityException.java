package com.ryuqq.tabular.core.exception;

/**
 * Key definition references unknown columns, or an update/delete has no usable identity.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class IdentityException extends TabularException {

    public IdentityException(String message) {
        super(message);
    }
}
