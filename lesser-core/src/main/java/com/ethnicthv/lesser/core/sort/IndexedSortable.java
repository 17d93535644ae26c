package com.ethnicthv.lesser.core.sort;

/**
 * Collection that can be reordered in place by position.
 */
public interface IndexedSortable {

    /**
     * Number of elements
     */
    int size();

    /**
     * Exchange the elements at positions i and j.
     */
    void swap(int i, int j);
}
