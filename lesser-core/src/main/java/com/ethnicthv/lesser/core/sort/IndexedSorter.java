package com.ethnicthv.lesser.core.sort;

import com.ethnicthv.lesser.core.IndexedLess;

/**
 * In-place sort driven by an index-based less predicate.
 */
public interface IndexedSorter {

    /**
     * Sort the entries of {@code s} between {@code from} (inclusive) and {@code to} (exclusive).
     * {@code less} is consulted with positions in that range and must describe the current contents of {@code s}.
     */
    void sort(IndexedSortable s, IndexedLess less, int from, int to);

    default void sort(IndexedSortable s, IndexedLess less) {
        sort(s, less, 0, s.size());
    }
}
