package com.ethnicthv.lesser.core;

/**
 * Index-based strict less-than predicate over the elements of one collection.
 * This is the contract an in-place sort routine needs: {@code less(i, j)} answers whether the
 * element currently at index i sorts strictly before the element currently at index j.
 */
@FunctionalInterface
public interface IndexedLess {

    /**
     * Predicate for collections without elements or without comparable leaves.
     * A conforming sort never calls it for an empty collection; it always answers false.
     */
    IndexedLess EMPTY = (i, j) -> false;

    boolean less(int i, int j);
}
