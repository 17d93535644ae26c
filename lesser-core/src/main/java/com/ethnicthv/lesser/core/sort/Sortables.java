package com.ethnicthv.lesser.core.sort;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Adapters exposing Java arrays and lists as {@link IndexedSortable}s.
 */
public final class Sortables {

    private Sortables() {
    }

    @FunctionalInterface
    private interface Swapper {
        void swap(int i, int j);
    }

    private static IndexedSortable of(int size, Swapper swapper) {
        return new IndexedSortable() {
            @Override
            public int size() {
                return size;
            }

            @Override
            public void swap(int i, int j) {
                swapper.swap(i, j);
            }
        };
    }

    /**
     * Sortable view of an array (primitive or reference), a {@link List}, or an
     * object that already is an {@link IndexedSortable}.
     */
    public static IndexedSortable of(Object collection) {
        Objects.requireNonNull(collection, "collection");
        if (collection instanceof IndexedSortable s) {
            return s;
        }
        if (collection instanceof List<?> list) {
            return of(list.size(), (i, j) -> Collections.swap(list, i, j));
        }
        if (collection instanceof Object[] a) {
            return of(a.length, (i, j) -> { Object t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        if (collection instanceof int[] a) {
            return of(a.length, (i, j) -> { int t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        if (collection instanceof long[] a) {
            return of(a.length, (i, j) -> { long t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        if (collection instanceof double[] a) {
            return of(a.length, (i, j) -> { double t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        if (collection instanceof float[] a) {
            return of(a.length, (i, j) -> { float t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        if (collection instanceof short[] a) {
            return of(a.length, (i, j) -> { short t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        if (collection instanceof char[] a) {
            return of(a.length, (i, j) -> { char t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        if (collection instanceof byte[] a) {
            return of(a.length, (i, j) -> { byte t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        if (collection instanceof boolean[] a) {
            return of(a.length, (i, j) -> { boolean t = a[i]; a[i] = a[j]; a[j] = t; });
        }
        throw new IllegalArgumentException("not a sortable collection: " + collection.getClass().getName());
    }
}
