package com.ryuqq.tabular.core.filter;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Filter 테스트.
 *
 * <ul>
 *   <li>값 맵 → 등호 조건 AND 결합 (null 값, SHAPE@ 제외)</li>
 *   <li>where 절 파싱: 리터럴 종류, 따옴표 안의 AND, 지원하지 않는 구문</li>
 *   <li>행 평가</li>
 * </ul>
 *
 * @author Tabular Team
 * @since 1.0.0
 */
class FilterTest {

    // ========== 값 맵 ==========

    @Test
    void of_ValueMap_BuildsEqualityConditionsInOrder() {
        // Given
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("orderid", 993);
        values.put("supplier", "Acme");

        // When
        Filter filter = Filter.of(values);

        // Then
        assertEquals("orderid=993 AND supplier='Acme'", filter.toString());
        assertEquals(List.of("orderid", "supplier"), List.copyOf(filter.columns()));
    }

    @Test
    void of_NullValuesAndGeometry_AreSkipped() {
        // Given
        Map<String, Object> values = new HashMap<>();
        values.put("orderid", null);
        values.put("SHAPE@", "POINT (1 2)");

        // When
        Filter filter = Filter.of(values);

        // Then
        assertTrue(filter.isAll());
        assertEquals(Filter.WILDCARD, filter.toString());
    }

    @Test
    void of_EmptyOrNullMap_MatchesEverything() {
        // When & Then
        assertTrue(Filter.of(Map.of()).isAll());
        assertTrue(Filter.of((Map<String, ?>) null).isAll());
        assertTrue(Filter.all().matches(column -> null));
    }

    // ========== 파싱 ==========

    @Test
    void parse_WildcardAndBlank_MatchEverything() {
        // When & Then
        assertTrue(Filter.parse("*").isAll());
        assertTrue(Filter.parse("  ").isAll());
        assertTrue(Filter.parse(null).isAll());
    }

    @Test
    void parse_LiteralKinds_AreTyped() {
        // When
        Filter filter = Filter.parse("orderid = 993 AND total >= 10.5 AND supplier = 'Acme' "
            + "AND placed < date '2024-01-31' AND active = TRUE");

        // Then
        List<Condition> conditions = filter.conditions();
        assertEquals(5, conditions.size());
        assertEquals(new Condition("orderid", Operator.EQ, 993L), conditions.get(0));
        assertEquals(new Condition("total", Operator.GE, 10.5), conditions.get(1));
        assertEquals(new Condition("supplier", Operator.EQ, "Acme"), conditions.get(2));
        assertEquals(new Condition("placed", Operator.LT, LocalDate.of(2024, 1, 31)), conditions.get(3));
        assertEquals(new Condition("active", Operator.EQ, Boolean.TRUE), conditions.get(4));
    }

    @Test
    void parse_AndInsideQuotes_IsPartOfLiteral() {
        // When
        Filter filter = Filter.parse("supplier = 'Smith AND Sons' AND note = 'it''s'");

        // Then
        assertEquals(2, filter.conditions().size());
        assertEquals("Smith AND Sons", filter.conditions().get(0).value());
        assertEquals("it's", filter.conditions().get(1).value());
    }

    @Test
    void parse_NullChecksAndNotEqual_AreRecognised() {
        // When
        Filter filter = Filter.parse("status is not null and closed IS NULL and code != 'X'");

        // Then
        assertEquals(Operator.IS_NOT_NULL, filter.conditions().get(0).operator());
        assertEquals(Operator.IS_NULL, filter.conditions().get(1).operator());
        assertEquals(Operator.NE, filter.conditions().get(2).operator());
    }

    @Test
    void parse_DoubleQuotedString_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Filter.parse("supplier = \"Acme\"")
        );
        assertTrue(exception.getMessage().contains("single quoted"));
    }

    @Test
    void parse_Or_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Filter.parse("a = 1 OR b = 2"));
    }

    @Test
    void parse_UnterminatedString_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Filter.parse("supplier = 'Acme"));
    }

    @Test
    void parse_Garbage_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> Filter.parse("just some words"));
        assertThrows(IllegalArgumentException.class, () -> Filter.parse("a = b"));
    }

    @Test
    void parse_ToStringRoundTrip_ProducesEqualFilter() {
        // Given
        Filter original = Filter.parse("supplier = 'O''Brien' AND total > 3 AND closed IS NULL");

        // When
        Filter reparsed = Filter.parse(original.toString());

        // Then
        assertEquals(original, reparsed);
        assertEquals(original.hashCode(), reparsed.hashCode());
    }

    // ========== 평가 / 결합 ==========

    @Test
    void matches_AllConditionsMustHold() {
        // Given
        Filter filter = Filter.parse("supplier = 'Acme' AND total > 100");
        Map<String, Object> big = Map.of("supplier", "Acme", "total", 150.0);
        Map<String, Object> small = Map.of("supplier", "Acme", "total", 50.0);

        // When & Then
        assertTrue(filter.matches(big::get));
        assertFalse(filter.matches(small::get));
    }

    @Test
    void and_CombinesConditions() {
        // Given
        Filter left = Filter.parse("a = 1");
        Filter right = Filter.parse("b = 2");

        // When
        Filter combined = left.and(right);

        // Then
        assertEquals(Set.of("a", "b"), combined.columns());
        assertSame(left, left.and(Filter.all()));
    }
}
