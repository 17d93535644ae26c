package com.ethnicthv.lesser.core.compare;

import com.ethnicthv.lesser.core.IndexedLess;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class LeafComparatorsTest {

    private static final IndexedLess ALWAYS = (i, j) -> true;

    @Test
    @DisplayName("ties defer to the continuation, decisions do not")
    void testContinuation() {
        int[] v = {5, 5, 6};
        IndexedLess withNext = LeafComparators.ofInt(i -> v[i], ALWAYS);
        IndexedLess withoutNext = LeafComparators.ofInt(i -> v[i], null);

        assertTrue(withNext.less(0, 1));
        assertFalse(withNext.less(2, 0));
        assertFalse(withoutNext.less(0, 1));
        assertTrue(withoutNext.less(0, 2));
    }

    @Test
    void testUnsigned() {
        int[] ints = {-1, 1};
        IndexedLess u32 = LeafComparators.ofUnsignedInt(i -> ints[i], null);
        IndexedLess s32 = LeafComparators.ofInt(i -> ints[i], null);
        assertTrue(u32.less(1, 0), "0xffffffff is the largest uint32");
        assertTrue(s32.less(0, 1));

        long[] longs = {Long.MIN_VALUE, Long.MAX_VALUE};
        IndexedLess u64 = LeafComparators.ofUnsignedLong(i -> longs[i], null);
        IndexedLess s64 = LeafComparators.ofLong(i -> longs[i], null);
        assertTrue(u64.less(1, 0));
        assertTrue(s64.less(0, 1));
    }

    @Test
    void testBoolean() {
        boolean[] v = {false, true, true};
        IndexedLess less = LeafComparators.ofBoolean(i -> v[i], ALWAYS);

        assertTrue(less.less(0, 1));
        assertFalse(less.less(1, 0));
        assertTrue(less.less(1, 2), "tie defers");
    }

    @Test
    @DisplayName("NaN first; NaN pairs and signed zeros defer")
    void testFloatNaN() {
        float[] v = {Float.NaN, Float.NaN, -1f, -0f, 0f};
        IndexedLess less = LeafComparators.ofFloat(i -> v[i], ALWAYS);

        assertTrue(less.less(0, 2));
        assertFalse(less.less(2, 0));
        assertTrue(less.less(0, 1), "two NaNs tie");
        assertTrue(less.less(3, 4), "-0 ties with +0");
        assertTrue(less.less(2, 3));
        assertFalse(less.less(4, 2));

        double[] d = {Double.NaN, Double.NEGATIVE_INFINITY};
        IndexedLess dl = LeafComparators.ofDouble(i -> d[i], null);
        assertTrue(dl.less(0, 1));
        assertFalse(dl.less(1, 0));
    }

    @ParameterizedTest
    @CsvSource({
        "a, b",
        "ab, abc",
        "'', a",
        "Z, a",
        "\u00E9, \u4E2D",
        "\uFFFF, \uD83D\uDE00",
        "\uD83D\uDE00, \uD83D\uDE01",
    })
    @DisplayName("code point order equals UTF-8 byte order")
    void testCodePointOrder(String lo, String hi) {
        assertTrue(LeafComparators.compareCodePoints(lo, hi) < 0);
        assertTrue(LeafComparators.compareCodePoints(hi, lo) > 0);
        assertEquals(0, LeafComparators.compareCodePoints(lo, new String(lo)));
        assertTrue(Arrays.compareUnsigned(lo.getBytes(StandardCharsets.UTF_8),
            hi.getBytes(StandardCharsets.UTF_8)) < 0);
    }

    @Test
    @DisplayName("supplementary characters order above the whole BMP")
    void testDiffersFromCompareTo() {
        String bmp = "\uFFFF";
        String emoji = "\uD83D\uDE00";

        assertTrue(bmp.compareTo(emoji) > 0);
        assertTrue(LeafComparators.compareCodePoints(bmp, emoji) < 0);

        String[] v = {emoji, bmp};
        IndexedLess less = LeafComparators.ofString(i -> v[i], null);
        assertTrue(less.less(1, 0));
    }
}
