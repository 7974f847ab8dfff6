package com.ryuqq.tabular.core.filter;

import com.ryuqq.tabular.core.model.ColumnLayout;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Row filter: a conjunction of {@link Condition}s.
 *
 * <p><strong>Construction:</strong></p>
 * <ul>
 *   <li>{@link #of(Map)}: equality terms from key/value pairs. Null values and the
 *       geometry token are skipped.</li>
 *   <li>{@link #parse(String)}: where-clause text such as
 *       {@code orderid=993 AND supplier='Acme'}. {@code *} or blank means every row.</li>
 * </ul>
 *
 * <p>{@link #toString()} renders the where clause; string literals are single-quoted
 * with embedded quotes doubled.</p>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
public final class Filter {

    /**
     * Wildcard where clause meaning "every row".
     */
    public static final String WILDCARD = "*";

    private static final Filter ALL = new Filter(List.of());

    private static final Pattern TERM = Pattern.compile(
        "^\\s*([A-Za-z_][A-Za-z0-9_.]*)\\s*(IS\\s+NOT\\s+NULL|IS\\s+NULL|<>|!=|<=|>=|=|<|>)\\s*(.*?)\\s*$",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern INTEGER = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL = Pattern.compile("^-?\\d*\\.\\d+([eE][-+]?\\d+)?$|^-?\\d+\\.\\d*([eE][-+]?\\d+)?$");
    private static final Pattern DATE_LITERAL = Pattern.compile("^date\\s+'(.*)'$", Pattern.CASE_INSENSITIVE);

    private final List<Condition> conditions;

    private Filter(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    /**
     * @return filter matching every row
     */
    public static Filter all() {
        return ALL;
    }

    /**
     * Equality filter from key/value pairs, in map iteration order.
     *
     * @param values column name to value (may be null or empty)
     * @return the filter, {@link #all()} when no non-null value remains
     */
    public static Filter of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return ALL;
        }
        List<Condition> conditions = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            if (entry.getValue() == null || ColumnLayout.isGeometryToken(entry.getKey())) {
                continue;
            }
            conditions.add(Condition.eq(entry.getKey(), entry.getValue()));
        }
        return conditions.isEmpty() ? ALL : new Filter(conditions);
    }

    public static Filter of(Condition... conditions) {
        return new Filter(List.of(conditions));
    }

    /**
     * Parses a where clause.
     *
     * <p>Supported grammar: {@code term [AND term]*} where a term is
     * {@code column op literal} ({@code = <> != < <= > >=}) or
     * {@code column IS [NOT] NULL}. Literals are single-quoted strings,
     * integers, decimals, {@code TRUE}/{@code FALSE} and {@code date '...'}.</p>
     *
     * @param where clause text, {@code *} or blank for every row
     * @return parsed filter
     * @throws IllegalArgumentException on double-quoted literals, OR, or unparseable terms
     */
    public static Filter parse(String where) {
        if (where == null || where.isBlank() || WILDCARD.equals(where.trim())) {
            return ALL;
        }
        List<String> terms = splitTerms(where);
        List<Condition> conditions = new ArrayList<>(terms.size());
        for (String term : terms) {
            conditions.add(parseTerm(term, where));
        }
        return new Filter(conditions);
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public boolean isAll() {
        return conditions.isEmpty();
    }

    /**
     * @return every column referenced by this filter, in first-use order
     */
    public Set<String> columns() {
        Set<String> columns = new LinkedHashSet<>();
        for (Condition condition : conditions) {
            columns.add(condition.column());
        }
        return Collections.unmodifiableSet(columns);
    }

    /**
     * Combines two filters with AND.
     *
     * @param other the other filter
     * @return conjunction of both
     */
    public Filter and(Filter other) {
        if (other == null || other.isAll()) {
            return this;
        }
        List<Condition> combined = new ArrayList<>(conditions);
        combined.addAll(other.conditions);
        return new Filter(combined);
    }

    /**
     * Evaluates the filter.
     *
     * @param valueOf column name to the row's value
     * @return true when every condition matches
     */
    public boolean matches(Function<String, Object> valueOf) {
        for (Condition condition : conditions) {
            if (!condition.matches(valueOf.apply(condition.column()))) {
                return false;
            }
        }
        return true;
    }

    private static List<String> splitTerms(String where) {
        List<String> terms = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (i < where.length()) {
            char c = where.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            } else if (!quoted && c == '"') {
                throw new IllegalArgumentException("String literals must be single quoted: " + where);
            } else if (!quoted && keywordAt(where, i, "OR")) {
                throw new IllegalArgumentException("OR is not supported in where clauses: " + where);
            } else if (!quoted && keywordAt(where, i, "AND")) {
                terms.add(current.toString());
                current.setLength(0);
                i += 3;
                continue;
            }
            current.append(c);
            i++;
        }
        if (quoted) {
            throw new IllegalArgumentException("Unterminated string literal: " + where);
        }
        terms.add(current.toString());
        return terms;
    }

    private static boolean keywordAt(String text, int index, String keyword) {
        if (!text.regionMatches(true, index, keyword, 0, keyword.length())) {
            return false;
        }
        boolean startBoundary = index == 0 || Character.isWhitespace(text.charAt(index - 1));
        int end = index + keyword.length();
        boolean endBoundary = end == text.length() || Character.isWhitespace(text.charAt(end));
        return startBoundary && endBoundary;
    }

    private static Condition parseTerm(String term, String where) {
        Matcher matcher = TERM.matcher(term);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Cannot parse term '" + term.trim() + "' in: " + where);
        }
        String column = matcher.group(1);
        Operator operator = Operator.fromSymbol(matcher.group(2));
        String operand = matcher.group(3);
        if (operator.isUnary()) {
            if (!operand.isEmpty()) {
                throw new IllegalArgumentException("Unexpected text after " + operator.symbol() + ": " + term.trim());
            }
            return new Condition(column, operator, null);
        }
        return new Condition(column, operator, parseLiteral(operand, where));
    }

    private static Object parseLiteral(String literal, String where) {
        if (literal.length() >= 2 && literal.startsWith("'") && literal.endsWith("'")) {
            return literal.substring(1, literal.length() - 1).replace("''", "'");
        }
        Matcher date = DATE_LITERAL.matcher(literal);
        if (date.matches()) {
            return parseDate(date.group(1), where);
        }
        if (INTEGER.matcher(literal).matches()) {
            return Long.parseLong(literal);
        }
        if (DECIMAL.matcher(literal).matches()) {
            return Double.parseDouble(literal);
        }
        if ("TRUE".equalsIgnoreCase(literal) || "FALSE".equalsIgnoreCase(literal)) {
            return Boolean.parseBoolean(literal);
        }
        throw new IllegalArgumentException("Unsupported literal '" + literal + "' in: " + where);
    }

    private static Object parseDate(String text, String where) {
        try {
            if (text.length() > 10) {
                return LocalDateTime.parse(text.replace(' ', 'T'));
            }
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date literal '" + text + "' in: " + where, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return conditions.equals(((Filter) o).conditions);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode();
    }

    @Override
    public String toString() {
        if (conditions.isEmpty()) {
            return WILDCARD;
        }
        StringBuilder sb = new StringBuilder();
        for (Condition condition : conditions) {
            if (sb.length() > 0) {
                sb.append(" AND ");
            }
            sb.append(condition);
        }
        return sb.toString();
    }
}
