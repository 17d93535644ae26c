package com.ethnicthv.lesser.core.compare;

import com.ethnicthv.lesser.core.IndexedLess;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for predicates over Java arrays and lists
 */
public class HeapSourceTest {

    enum Color { RED, GREEN, BLUE }

    enum Op {
        PLUS {
            @Override
            int apply(int a, int b) {
                return a + b;
            }
        },
        MINUS {
            @Override
            int apply(int a, int b) {
                return a - b;
            }
        },
        TIMES {
            @Override
            int apply(int a, int b) {
                return a * b;
            }
        };

        abstract int apply(int a, int b);
    }

    record Inner(int v) { }

    record Outer(Inner in, int k) { }

    record Tagged(Color color, Character initial, Long weight) { }

    record Dated(LocalDate date) { }

    static class Base {
        private int a;

        Base(int a) {
            this.a = a;
        }
    }

    static class Derived extends Base {
        private final String b;

        Derived(int a, String b) {
            super(a);
            this.b = b;
        }
    }

    @Test
    @DisplayName("null elements sort first and tie with each other")
    void testNullStrings() {
        String[] values = {"b", null, "a", null};
        IndexedLess less = HeapSource.ofArray(values).build();

        assertTrue(less.less(1, 0));
        assertTrue(less.less(1, 2));
        assertFalse(less.less(0, 1));
        assertFalse(less.less(1, 3));
        assertFalse(less.less(3, 1));
        assertTrue(less.less(2, 0));
    }

    @Test
    void testBoxedIntegers() {
        Integer[] values = {5, null, 3, -7};
        IndexedLess less = HeapSource.ofArray(values).build();

        assertTrue(less.less(1, 3));
        assertTrue(less.less(3, 2));
        assertTrue(less.less(2, 0));
        assertFalse(less.less(0, 2));
    }

    @Test
    @DisplayName("null nested objects sort first; two nulls defer to later fields")
    void testNullNested() {
        Outer[] values = {
            new Outer(null, 5),
            new Outer(null, 3),
            new Outer(new Inner(1), 0),
            new Outer(new Inner(0), 9),
        };
        IndexedLess less = HeapSource.ofArray(values).build();

        assertTrue(less.less(1, 0), "both null, decided by k");
        assertFalse(less.less(0, 1));
        assertTrue(less.less(0, 2), "null before non-null");
        assertTrue(less.less(3, 2), "decided by in.v");
        assertFalse(less.less(2, 3));
    }

    @Test
    @DisplayName("enums by ordinal, chars unsigned, boxed longs by value")
    void testEnumCharLong() {
        Tagged[] values = {
            new Tagged(Color.BLUE, 'a', 1L),
            new Tagged(Color.RED, 'z', 1L),
            new Tagged(Color.RED, 'z', null),
            new Tagged(Color.RED, '\uFFFF', 0L),
        };
        IndexedLess less = HeapSource.ofArray(values).build();

        assertTrue(less.less(1, 0));
        assertTrue(less.less(2, 1), "null weight first");
        assertTrue(less.less(1, 3), "char compares unsigned");
        assertFalse(less.less(0, 0));
    }

    @Test
    @DisplayName("private fields of plain classes, superclass first")
    void testPlainClasses() {
        Derived[] values = {new Derived(2, "a"), new Derived(1, "z"), new Derived(1, "y")};
        HeapSource source = HeapSource.ofArray(values);
        IndexedLess less = source.build();

        assertEquals(2, source.leafCount());
        assertTrue(less.less(1, 0));
        assertTrue(less.less(2, 1));
    }

    @Test
    void testPrimitiveArrays() {
        char[] chars = {'b', 'a'};
        assertTrue(HeapSource.ofArray(chars).build().less(1, 0));

        byte[] bytes = {1, -1};
        assertTrue(HeapSource.ofArray(bytes).build().less(1, 0));

        short[] shorts = {-300, 300};
        assertTrue(HeapSource.ofArray(shorts).build().less(0, 1));

        float[] floats = {2f, Float.NaN};
        assertTrue(HeapSource.ofArray(floats).build().less(1, 0));
    }

    @Test
    @DisplayName("platform objects are ordered by identity")
    void testPlatformObjects() {
        LocalDate d = LocalDate.of(2024, 1, 1);
        Dated[] values = {new Dated(d), new Dated(d), new Dated(LocalDate.of(2020, 5, 5))};
        IndexedLess less = HeapSource.ofArray(values).build();

        assertFalse(less.less(0, 1));
        assertFalse(less.less(1, 0));
        assertFalse(less.less(0, 2) && less.less(2, 0));
    }

    @Test
    @DisplayName("list element class is inferred from the contents")
    void testListInference() {
        List<Outer> list = new ArrayList<>();
        list.add(new Outer(new Inner(2), 0));
        list.add(null);
        list.add(new Outer(new Inner(1), 0));
        IndexedLess less = HeapSource.ofList(list).build();

        assertTrue(less.less(1, 0));
        assertTrue(less.less(2, 0));

        assertThrows(IllegalArgumentException.class,
            () -> HeapSource.ofList(Arrays.<Object>asList(1, "one")));
        assertSame(IndexedLess.EMPTY, HeapSource.ofList(Arrays.asList(null, null)).build());
        assertThrows(IllegalArgumentException.class,
            () -> HeapSource.ofList(new LinkedList<>(List.of(1))));
        assertThrows(IllegalArgumentException.class,
            () -> HeapSource.ofList(List.of(1), int.class));
        assertThrows(IllegalArgumentException.class, () -> HeapSource.ofArray("not an array"));
    }

    @Test
    @DisplayName("enum constants with bodies are ordered with their enum")
    void testEnumConstantBodies() {
        List<Op> ops = new ArrayList<>(List.of(Op.TIMES, Op.PLUS, Op.MINUS));
        assertNotSame(Op.class, Op.PLUS.getClass());

        IndexedLess less = HeapSource.ofList(ops).build();

        assertTrue(less.less(1, 2));
        assertTrue(less.less(2, 0));
        assertFalse(less.less(0, 1));

        List<Object> mixed = new ArrayList<>(List.of(Op.PLUS, Color.RED));
        assertThrows(IllegalArgumentException.class, () -> HeapSource.ofList(mixed));
    }

    @Test
    @DisplayName("a list of nulls has no element class and all elements tie")
    void testAllNullList() {
        List<String> nulls = Arrays.asList(null, null, null);
        HeapSource source = HeapSource.ofList(nulls);

        assertEquals(3, source.length());
        assertSame(IndexedLess.EMPTY, source.build());
    }

    @Test
    @DisplayName("leaf count covers every comparable value")
    void testLeafCount() {
        HeapSource source = HeapSource.ofArray(new Tagged[]{new Tagged(Color.RED, 'a', 1L)});
        source.build();
        assertEquals(3, source.leafCount());

        HeapSource empty = HeapSource.ofArray(new Tagged[0]);
        assertSame(IndexedLess.EMPTY, empty.build());
        assertEquals(0, empty.leafCount());
    }
}
