package com.ryuqq.tabular.core.filter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Objects;

/**
 * One {@code column operator value} term of a {@link Filter}.
 *
 * <p>Matching follows SQL null semantics: a null column value never satisfies a
 * binary comparison. Numbers compare by value regardless of their boxed type.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 * @param column column name
 * @param operator comparison operator
 * @param value operand (must be null for unary operators, non-null otherwise)
 */
public record Condition(String column, Operator operator, Object value) {

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public Condition {
        if (column == null || column.isBlank()) {
            throw new IllegalArgumentException("Condition column cannot be null or blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("Condition operator cannot be null (column: " + column + ")");
        }
        if (operator.isUnary() && value != null) {
            throw new IllegalArgumentException(operator.symbol() + " takes no value (column: " + column + ")");
        }
        if (!operator.isUnary() && value == null) {
            throw new IllegalArgumentException(
                "Comparison with null is never true, use IS NULL instead (column: " + column + ")"
            );
        }
    }

    public static Condition eq(String column, Object value) {
        return new Condition(column, Operator.EQ, value);
    }

    /**
     * Evaluates this condition against a column value.
     *
     * @param actual the row's value for {@link #column()}
     * @return true if the value satisfies the condition
     * @throws IllegalArgumentException if the values cannot be ordered
     */
    public boolean matches(Object actual) {
        switch (operator) {
            case IS_NULL:
                return actual == null;
            case IS_NOT_NULL:
                return actual != null;
            default:
                break;
        }
        if (actual == null) {
            return false;
        }
        if (operator == Operator.EQ) {
            return valueEquals(actual, value);
        }
        if (operator == Operator.NE) {
            return !valueEquals(actual, value);
        }
        int cmp = compare(actual, value);
        return switch (operator) {
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            default -> throw new IllegalStateException("unreachable: " + operator);
        };
    }

    static boolean valueEquals(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers((Number) left, (Number) right) == 0;
        }
        return Objects.equals(left, right);
    }

    private int compare(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers((Number) left, (Number) right);
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        if (left instanceof LocalDateTime && right instanceof LocalDateTime) {
            return ((LocalDateTime) left).compareTo((LocalDateTime) right);
        }
        if (left instanceof LocalDate && right instanceof LocalDate) {
            return ((LocalDate) left).compareTo((LocalDate) right);
        }
        if (left instanceof Instant && right instanceof Instant) {
            return ((Instant) left).compareTo((Instant) right);
        }
        if (left instanceof Date && right instanceof Date) {
            return ((Date) left).compareTo((Date) right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        throw new IllegalArgumentException(
            "Cannot compare " + left.getClass().getSimpleName() + " with "
                + right.getClass().getSimpleName() + " (column: " + column + ")"
        );
    }

    private static int compareNumbers(Number left, Number right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        return Double.compare(left.doubleValue(), right.doubleValue());
    }

    private static boolean isIntegral(Number number) {
        return number instanceof Long || number instanceof Integer
            || number instanceof Short || number instanceof Byte;
    }

    /**
     * Renders a value as a where-clause literal.
     *
     * <p>Strings are single-quoted with embedded quotes doubled; dates use the
     * {@code date '...'} form; everything else uses {@code toString()}.</p>
     *
     * @param value the value
     * @return literal text
     */
    static String literal(Object value) {
        if (value instanceof String) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        if (value instanceof LocalDate) {
            return "date '" + value + "'";
        }
        if (value instanceof LocalDateTime) {
            return "date '" + DATE_TIME.format((LocalDateTime) value) + "'";
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        if (operator.isUnary()) {
            return column + " " + operator.symbol();
        }
        return column + operator.symbol() + literal(value);
    }
}
