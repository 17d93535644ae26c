package com.ethnicthv.lesser.core.sort;

import com.ethnicthv.lesser.core.IndexedLess;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class QuickSortTest {

    private static IndexedLess ascending(int[] a) {
        return (i, j) -> a[i] < a[j];
    }

    private static int[] random(int n, int bound, long seed) {
        Random rnd = new Random(seed);
        int[] a = new int[n];
        for (int i = 0; i < n; i++) {
            a[i] = rnd.nextInt(bound);
        }
        return a;
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3, 12, 13, 14, 100, 1000, 10_000})
    @DisplayName("random input matches Arrays.sort")
    void testRandom(int n) {
        int[] a = random(n, Integer.MAX_VALUE, n);
        int[] expected = a.clone();
        Arrays.sort(expected);

        QuickSort.INSTANCE.sort(Sortables.of(a), ascending(a));

        assertArrayEquals(expected, a);
    }

    @Test
    @DisplayName("many duplicates")
    void testDuplicates() {
        int[] a = random(5000, 3, 11);
        int[] expected = a.clone();
        Arrays.sort(expected);

        QuickSort.INSTANCE.sort(Sortables.of(a), ascending(a));

        assertArrayEquals(expected, a);

        int[] same = new int[2000];
        Arrays.fill(same, 4);
        QuickSort.INSTANCE.sort(Sortables.of(same), ascending(same));
        assertTrue(Arrays.stream(same).allMatch(v -> v == 4));
    }

    @Test
    void testSortedAndReversed() {
        int[] a = new int[4096];
        for (int i = 0; i < a.length; i++) {
            a[i] = a.length - i;
        }
        QuickSort.INSTANCE.sort(Sortables.of(a), ascending(a));
        for (int i = 0; i < a.length; i++) {
            assertEquals(i + 1, a[i]);
        }

        QuickSort.INSTANCE.sort(Sortables.of(a), ascending(a));
        for (int i = 0; i < a.length; i++) {
            assertEquals(i + 1, a[i]);
        }
    }

    @Test
    @DisplayName("only the requested range is touched")
    void testSubRange() {
        int[] a = {9, 8, 7, 6, 5, 4, 3, 2, 1};
        QuickSort.INSTANCE.sort(Sortables.of(a), ascending(a), 2, 7);
        assertArrayEquals(new int[]{9, 8, 3, 4, 5, 6, 7, 2, 1}, a);

        assertThrows(IndexOutOfBoundsException.class,
            () -> QuickSort.INSTANCE.sort(Sortables.of(a), ascending(a), 3, 10));
        assertThrows(IndexOutOfBoundsException.class,
            () -> QuickSort.INSTANCE.sort(Sortables.of(a), ascending(a), 5, 4));
    }

    @Test
    void testHeapSortAndInsertionSort() {
        int[] a = random(777, 1000, 3);
        int[] expected = a.clone();
        Arrays.sort(expected);
        QuickSort.heapSort(Sortables.of(a), ascending(a), 0, a.length);
        assertArrayEquals(expected, a);

        int[] b = random(50, 1000, 4);
        int[] sortedTail = b.clone();
        Arrays.sort(sortedTail, 10, 40);
        QuickSort.insertionSort(Sortables.of(b), ascending(b), 10, 40);
        assertArrayEquals(sortedTail, b);
    }

    @Test
    @DisplayName("adapters swap lists and every array type")
    void testSortables() {
        List<String> list = new ArrayList<>(List.of("c", "a", "b"));
        QuickSort.INSTANCE.sort(Sortables.of(list), (i, j) -> list.get(i).compareTo(list.get(j)) < 0);
        assertEquals(List.of("a", "b", "c"), list);

        double[] d = {3.0, 1.0, 2.0};
        Sortables.of(d).swap(0, 1);
        assertArrayEquals(new double[]{1.0, 3.0, 2.0}, d);

        char[] c = {'x', 'y'};
        IndexedSortable s = Sortables.of(c);
        assertEquals(2, s.size());
        s.swap(0, 1);
        assertArrayEquals(new char[]{'y', 'x'}, c);

        Object[] o = {"p", 1};
        Sortables.of(o).swap(0, 1);
        assertArrayEquals(new Object[]{1, "p"}, o);

        assertThrows(IllegalArgumentException.class, () -> Sortables.of("not sortable"));
        assertThrows(NullPointerException.class, () -> Sortables.of(null));
    }
}
