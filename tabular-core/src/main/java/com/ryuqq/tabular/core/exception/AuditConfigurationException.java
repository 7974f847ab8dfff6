package com.ryuqq.tabular.core.exception;

/**
 * The audited table is not compatible with audit logging (it declares its own {@code action} column).
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class AuditConfigurationException extends TabularException {

    public AuditConfigurationException(String message) {
        super(message);
    }
}
