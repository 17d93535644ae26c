package com.ethnicthv.lesser;

import com.ethnicthv.lesser.core.IndexedLess;
import com.ethnicthv.lesser.core.UnsupportedTypeException;
import com.ethnicthv.lesser.core.compare.HeapSource;
import com.ethnicthv.lesser.core.compare.LessBuilder;
import com.ethnicthv.lesser.core.compare.StructArraySource;
import com.ethnicthv.lesser.core.memory.StructArray;
import com.ethnicthv.lesser.core.sort.QuickSort;
import com.ethnicthv.lesser.core.sort.Sortables;

import java.util.List;

/**
 * Lesser - the single entry point for building index-based less predicates.
 * <p>
 * Ordering rules, applied leaf by leaf in declaration order:
 * <ul>
 *   <li>booleans: false before true</li>
 *   <li>integers, floats and strings: natural order; unsigned kinds as unsigned, strings by code point</li>
 *   <li>NaN before every other float; two NaNs tie</li>
 *   <li>complex numbers: real part, then imaginary part</li>
 *   <li>handles, pointers and addresses: by their raw identity value</li>
 *   <li>enums: by ordinal; on Java collections, null before non-null</li>
 *   <li>structs and records: each field in turn; fixed arrays: each element in turn</li>
 * </ul>
 * Fields named only with underscores are skipped. The returned predicate stays bound to the
 * collection object; it may be reused after the collection's contents are refilled.
 */
public final class Lesser {

    private Lesser() {
    }

    /**
     * Build a less predicate for a Java array, a random-access {@link List} or a {@link StructArray}.
     *
     * @throws IllegalArgumentException if the argument is not one of those
     * @throws UnsupportedTypeException if the element type contains a value that cannot be ordered
     */
    public static IndexedLess of(Object collection) {
        return builderFor(collection).build();
    }

    /**
     * Build a less predicate for a list whose element class is known to the caller.
     */
    public static <T> IndexedLess of(List<? extends T> list, Class<T> elementClass) {
        return HeapSource.ofList(list, elementClass).build();
    }

    /**
     * Sort the collection in place with the predicate {@link #of(Object)} builds for it.
     */
    public static void sort(Object collection) {
        IndexedLess less = of(collection);
        QuickSort.INSTANCE.sort(Sortables.of(collection), less);
    }

    static LessBuilder builderFor(Object collection) {
        if (collection == null) {
            throw new IllegalArgumentException("collection argument is null");
        }
        if (collection instanceof StructArray array) {
            return new StructArraySource(array);
        }
        if (collection.getClass().isArray()) {
            return HeapSource.ofArray(collection);
        }
        if (collection instanceof List<?> list) {
            return HeapSource.ofList(list);
        }
        throw new IllegalArgumentException("collection argument is not an array, List or StructArray: "
            + collection.getClass().getName());
    }
}
