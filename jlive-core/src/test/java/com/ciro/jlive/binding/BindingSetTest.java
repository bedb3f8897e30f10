package com.ciro.jlive.binding;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BindingSetTest {

    @Test
    void initialBindingsAreAllChanged() {
        var b = BindingSet.of(Map.of("name", "Ada"));
        assertTrue(b.changed().isAll());
        assertEquals("Ada", b.get("name"));
        assertTrue(BindingSet.empty().changed().isAll());
    }

    @Test
    void assigningTheSameValueIsNotAChange() {
        var b = BindingSet.of(Map.of("name", "Ada")).clearChanged();
        assertSame(b, b.assign("name", "Ada"));
        var changed = b.assign("name", "Grace");
        assertEquals(List.of("name"), List.copyOf(changed.changed().keys()));
        assertEquals("Grace", changed.get("name"));
        // inmutable
        assertEquals("Ada", b.get("name"));
    }

    @Test
    void newKeysAreChanged() {
        var b = BindingSet.of(Map.of()).clearChanged().assign("count", 1);
        assertTrue(b.changed().isChanged("count"));
        assertTrue(b.contains("count"));
    }

    @Test
    void mapValuesProduceNestedChanges() {
        var b = BindingSet.of(Map.of("user", Map.of("name", "Ada", "age", 36))).clearChanged()
                .assign("user", Map.of("name", "Ada", "age", 37));
        assertTrue(b.changed().isChanged(List.of("user", "age")));
        assertFalse(b.changed().isChanged(List.of("user", "name")));
    }

    @Test
    void forceAssignMarksEqualValues() {
        var b = BindingSet.of(Map.of("list", List.of(1))).clearChanged();
        var forced = b.forceAssign("list", List.of(1));
        assertTrue(forced.changed().isChanged("list"));
    }

    @Test
    void bulkAssignAndClear() {
        var b = BindingSet.of(Map.of("a", 1, "b", 2)).clearChanged()
                .assign(Map.of("a", 1, "b", 3));
        assertFalse(b.changed().isChanged("a"));
        assertTrue(b.changed().isChanged("b"));
        assertTrue(b.clearChanged().changed().isEmpty());
        assertTrue(b.markAllChanged().changed().isAll());
    }

    @Test
    void assignNewOnlyFillsMissingKeys() {
        var calls = new AtomicInteger();
        var b = BindingSet.of(Map.of("name", "Ada")).clearChanged();

        assertSame(b, b.assignNew("name", () -> "x" + calls.incrementAndGet()));
        assertEquals(0, calls.get());

        var filled = b.assignNew("theme", () -> "dark" + calls.incrementAndGet());
        assertEquals(1, calls.get());
        assertEquals("dark1", filled.get("theme"));
        assertEquals(List.of("theme"), List.copyOf(filled.changed().keys()));
    }

    @Test
    void assignNewTreatsNullValueAsPresent() {
        var initial = new HashMap<String, Object>();
        initial.put("user", null);
        var b = BindingSet.of(initial).clearChanged();
        assertSame(b, b.assignNew("user", () -> "Ada"));
    }

    @Test
    void updateUsesTheSameChangeDetectionAsAssign() {
        var b = BindingSet.of(Map.of("count", 1, "tags", List.of("a"))).clearChanged();

        var bumped = b.update("count", v -> (Integer) v + 1);
        assertEquals(2, bumped.get("count"));
        assertTrue(bumped.changed().isChanged("count"));
        assertFalse(bumped.changed().isChanged("tags"));

        assertSame(b, b.update("tags", v -> List.of("a")));
    }

    @Test
    void updateOfMissingKeyFails() {
        var b = BindingSet.of(Map.of("count", 1));
        var e = assertThrows(IllegalArgumentException.class, () -> b.update("total", v -> v));
        assertEquals("cannot update assign @total: key not found in [count]", e.getMessage());
    }
}
