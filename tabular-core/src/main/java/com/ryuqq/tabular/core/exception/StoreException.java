package com.ryuqq.tabular.core.exception;

/**
 * Raised by {@link com.ryuqq.tabular.core.spi.TabularStore} implementations when the
 * underlying store refuses an operation (unknown column, type violation, lock).
 *
 * <p>The engine translates write-side occurrences into {@link SchemaMismatchException}.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public class StoreException extends TabularException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
