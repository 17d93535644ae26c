package com.ethnicthv.lesser.core.sort;

import com.ethnicthv.lesser.core.IndexedLess;

/**
 * Introspective quicksort over an {@link IndexedSortable}.
 * <p>
 * Median-of-three pivot selection with Sedgewick partitioning (stops on equal keys, so runs of
 * duplicates stay balanced), insertion sort for short ranges and a heapsort fallback once the
 * recursion depth exceeds 2 * log2(n). Not stable. Stateless; one instance may be shared.
 */
public final class QuickSort implements IndexedSorter {

    public static final QuickSort INSTANCE = new QuickSort();

    private static final int INSERTION_SORT_THRESHOLD = 13;

    @Override
    public void sort(IndexedSortable s, IndexedLess less, int from, int to) {
        if (from < 0 || to > s.size() || from > to) {
            throw new IndexOutOfBoundsException("range [" + from + ", " + to + ") of " + s.size());
        }
        if (to - from < 2) {
            return;
        }
        sortInternal(s, less, from, to, maxDepth(to - from));
    }

    private static int maxDepth(int n) {
        return 2 * (32 - Integer.numberOfLeadingZeros(n - 1));
    }

    private static void sortInternal(IndexedSortable s, IndexedLess less, int lo, int hi, int depth) {
        while (hi - lo >= INSERTION_SORT_THRESHOLD) {
            if (--depth < 0) {
                heapSort(s, less, lo, hi);
                return;
            }
            int last = hi - 1;
            int mid = lo + ((hi - lo) >>> 1);

            // order lo, mid, last; the median ends at mid
            if (less.less(mid, lo)) s.swap(mid, lo);
            if (less.less(last, mid)) {
                s.swap(last, mid);
                if (less.less(mid, lo)) s.swap(mid, lo);
            }
            s.swap(lo, mid); // pivot lives at lo during partitioning

            int i = lo, j = hi;
            while (true) {
                while (less.less(++i, lo)) {
                    if (i == last) break;
                }
                while (less.less(lo, --j)) {
                    if (j == lo) break;
                }
                if (i >= j) break;
                s.swap(i, j);
            }
            s.swap(lo, j);

            // recurse into the smaller side, loop on the larger
            if (j - lo < hi - (j + 1)) {
                sortInternal(s, less, lo, j, depth);
                lo = j + 1;
            } else {
                sortInternal(s, less, j + 1, hi, depth);
                hi = j;
            }
        }
        insertionSort(s, less, lo, hi);
    }

    static void insertionSort(IndexedSortable s, IndexedLess less, int lo, int hi) {
        for (int i = lo + 1; i < hi; i++) {
            for (int j = i; j > lo && less.less(j, j - 1); j--) {
                s.swap(j, j - 1);
            }
        }
    }

    static void heapSort(IndexedSortable s, IndexedLess less, int lo, int hi) {
        int n = hi - lo;
        for (int i = (n >>> 1) - 1; i >= 0; i--) {
            siftDown(s, less, lo, i, n);
        }
        for (int end = n - 1; end > 0; end--) {
            s.swap(lo, lo + end);
            siftDown(s, less, lo, 0, end);
        }
    }

    private static void siftDown(IndexedSortable s, IndexedLess less, int lo, int root, int n) {
        while (true) {
            int child = 2 * root + 1;
            if (child >= n) return;
            if (child + 1 < n && less.less(lo + child, lo + child + 1)) {
                child++;
            }
            if (!less.less(lo + root, lo + child)) return;
            s.swap(lo + root, lo + child);
            root = child;
        }
    }
}
