package com.surveyprep.surveyprep.table;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableTest {

    @Test
    void shouldRejectDuplicateColumns() {
        assertThrows(IllegalArgumentException.class, () -> Table.empty(List.of("Q1", "Q1")));
    }

    @Test
    void shouldRejectRowsOfWrongWidth() {
        assertThrows(IllegalArgumentException.class,
                () -> Table.of(List.of("a", "b"), List.of(Arrays.asList((Object) "x"))));
    }

    @Test
    void shouldLeaveSourceUntouchedWhenBuilderChangesCopy() {
        Table source = Table.of(List.of("a", "b"), List.of(Arrays.asList("x", null)));

        Table derived = source.toBuilder()
                .set(0, "b", "y")
                .addColumn("c", Arrays.asList((Object) 1))
                .renameColumn("a", "alpha")
                .build();

        assertNull(source.get(0, "b"));
        assertEquals(List.of("a", "b"), source.columns());
        assertEquals(List.of("alpha", "b", "c"), derived.columns());
        assertEquals("y", derived.get(0, "b"));
        assertEquals(1, derived.get(0, "c"));
    }

    @Test
    void shouldRemoveColumnWithItsCells() {
        Table table = Table.of(List.of("a", "b", "c"), List.of(Arrays.asList(1, 2, 3), Arrays.asList(4, 5, 6)));

        Table trimmed = table.toBuilder().removeColumn("b").build();

        assertFalse(trimmed.hasColumn("b"));
        assertTrue(trimmed.hasColumn("c"));
        assertEquals(Arrays.asList(4, 6), trimmed.row(1));
    }

    @Test
    void shouldKeepColumnLookupConsistentAcrossBuilderEdits() {
        Table table = Table.of(List.of("a", "b", "c", "d"), List.of(Arrays.asList(1, 2, 3, 4)));

        Table.Builder builder = table.toBuilder()
                .removeColumn("b")
                .renameColumn("c", "gamma")
                .addColumn("e", Arrays.asList((Object) 5));

        assertFalse(builder.hasColumn("b"));
        assertFalse(builder.hasColumn("c"));
        assertEquals(3, builder.get(0, "gamma"));
        assertEquals(4, builder.get(0, "d"));
        assertEquals(5, builder.get(0, "e"));
        builder.set(0, "d", 40);
        assertThrows(IllegalArgumentException.class, () -> builder.get(0, "c"));
        assertThrows(IllegalArgumentException.class, () -> builder.renameColumn("a", "d"));
        assertEquals(Arrays.asList(1, 3, 40, 5), builder.build().row(0));
    }
}
