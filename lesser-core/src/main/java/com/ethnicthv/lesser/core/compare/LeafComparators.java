package com.ethnicthv.lesser.core.compare;

import com.ethnicthv.lesser.core.IndexedLess;
import com.ethnicthv.lesser.core.compare.Accessors.BooleanAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.DoubleAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.FloatAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.IntAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.LongAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.ObjectAccessor;

/**
 * Terminal comparators, one per leaf kind family.
 * <p>
 * Every comparator reads the leaf of both elements; if they tie it defers to {@code next}
 * (null meaning "no more tie-breakers", i.e. not less), otherwise it decides.
 */
public final class LeafComparators {

    private LeafComparators() {
    }

    /**
     * false sorts before true.
     */
    public static IndexedLess ofBoolean(BooleanAccessor v, IndexedLess next) {
        return (i, j) -> {
            boolean a = v.get(i), b = v.get(j);
            if (a == b) {
                return next != null && next.less(i, j);
            }
            return !a;
        };
    }

    /**
     * Signed integers up to 32 bits, zero-extended narrow unsigned integers and enum ordinals.
     */
    public static IndexedLess ofInt(IntAccessor v, IndexedLess next) {
        return (i, j) -> {
            int a = v.get(i), b = v.get(j);
            if (a == b) {
                return next != null && next.less(i, j);
            }
            return a < b;
        };
    }

    public static IndexedLess ofUnsignedInt(IntAccessor v, IndexedLess next) {
        return (i, j) -> {
            int a = v.get(i), b = v.get(j);
            if (a == b) {
                return next != null && next.less(i, j);
            }
            return Integer.compareUnsigned(a, b) < 0;
        };
    }

    public static IndexedLess ofLong(LongAccessor v, IndexedLess next) {
        return (i, j) -> {
            long a = v.get(i), b = v.get(j);
            if (a == b) {
                return next != null && next.less(i, j);
            }
            return a < b;
        };
    }

    /**
     * UINT64 and opaque identity values (handles, pointers, addresses).
     */
    public static IndexedLess ofUnsignedLong(LongAccessor v, IndexedLess next) {
        return (i, j) -> {
            long a = v.get(i), b = v.get(j);
            if (a == b) {
                return next != null && next.less(i, j);
            }
            return Long.compareUnsigned(a, b) < 0;
        };
    }

    /**
     * NaN sorts before every other value. Two NaNs tie and defer, as do -0.0 and +0.0.
     */
    public static IndexedLess ofFloat(FloatAccessor v, IndexedLess next) {
        return (i, j) -> {
            float a = v.get(i), b = v.get(j);
            if (a == b || (a != a && b != b)) {
                return next != null && next.less(i, j);
            }
            return a < b || (a != a && b == b);
        };
    }

    /**
     * Same NaN rule as {@link #ofFloat}.
     */
    public static IndexedLess ofDouble(DoubleAccessor v, IndexedLess next) {
        return (i, j) -> {
            double a = v.get(i), b = v.get(j);
            if (a == b || (a != a && b != b)) {
                return next != null && next.less(i, j);
            }
            return a < b || (a != a && b == b);
        };
    }

    /**
     * Byte order of the UTF-8 encodings, see {@link #compareCodePoints(String, String)}.
     */
    public static IndexedLess ofString(ObjectAccessor<String> v, IndexedLess next) {
        return (i, j) -> {
            String a = v.get(i), b = v.get(j);
            int c = compareCodePoints(a, b);
            if (c == 0) {
                return next != null && next.less(i, j);
            }
            return c < 0;
        };
    }

    /**
     * Compare two strings by code point, which is the byte order of their UTF-8 encodings.
     * Differs from {@link String#compareTo} only where a surrogate pair meets a char in U+E000..U+FFFF.
     */
    public static int compareCodePoints(String a, String b) {
        if (a == b) {
            return 0;
        }
        int n = Math.min(a.length(), b.length());
        for (int k = 0; k < n; k++) {
            char ca = a.charAt(k), cb = b.charAt(k);
            if (ca != cb) {
                boolean sa = Character.isSurrogate(ca), sb = Character.isSurrogate(cb);
                if (sa != sb) {
                    // a surrogate starts a supplementary code point, above the whole BMP
                    return sa ? 1 : -1;
                }
                return ca - cb;
            }
        }
        return a.length() - b.length();
    }
}
