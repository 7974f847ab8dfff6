package com.ryuqq.tabular.core.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Row / ColumnLayout 테스트.
 *
 * @author Tabular Team
 * @since 1.0.0
 */
class RowTest {

    @Test
    void getAndSet_ByNameAndIndex() {
        // Given
        Row row = new Row(ColumnLayout.of(List.of("orderid", "supplier")), List.of(1, "Acme"));

        // When
        row.set("supplier", "Other");
        row.set(0, 2);

        // Then
        assertEquals(2, row.get("orderid"));
        assertEquals("Other", row.get(1));
        assertEquals(List.of(2, "Other"), row.values());
    }

    @Test
    void geometry_ExposedThroughShapeToken() {
        // Given
        Row row = new Row(ColumnLayout.of(List.of("owner", ColumnLayout.GEOMETRY)), Arrays.asList("Kim", null));

        // When
        row.setGeometry("POINT (1 2)");

        // Then
        assertEquals("POINT (1 2)", row.geometry());
        assertEquals(Map.of("owner", "Kim"), row.toMap());
    }

    @Test
    void setGeometry_WithoutShapeToken_ThrowsException() {
        // Given
        Row row = new Row(ColumnLayout.of(List.of("owner")), List.of("Kim"));

        // When & Then
        assertNull(row.geometry());
        assertThrows(IllegalStateException.class, () -> row.setGeometry("POINT (1 2)"));
    }

    @Test
    void values_AreACopy() {
        // Given
        Row row = new Row(ColumnLayout.of(List.of("a")), List.of(1));

        // When
        List<Object> values = row.values();
        row.set(0, 2);

        // Then
        assertEquals(List.of(1), values);
        assertThrows(UnsupportedOperationException.class, () -> values.set(0, 3));
    }

    @Test
    void constructor_SizeMismatch_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new Row(ColumnLayout.of(List.of("a", "b")), List.of(1)));
    }

    @Test
    void layout_UnknownOrDuplicateColumn_ThrowsException() {
        // Given
        ColumnLayout layout = ColumnLayout.of(List.of("a", "shape@"));

        // When & Then
        assertTrue(layout.hasGeometry());
        assertThrows(IllegalArgumentException.class, () -> layout.indexOf("b"));
        assertThrows(IllegalArgumentException.class, () -> ColumnLayout.of(List.of("a", "a")));
    }
}
