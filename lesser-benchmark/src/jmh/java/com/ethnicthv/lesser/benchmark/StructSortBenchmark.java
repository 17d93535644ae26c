package com.ethnicthv.lesser.benchmark;

import com.ethnicthv.lesser.Lesser;
import com.ethnicthv.lesser.core.IndexedLess;
import com.ethnicthv.lesser.core.memory.ElementHandle;
import com.ethnicthv.lesser.core.memory.StructArray;
import com.ethnicthv.lesser.core.sort.IndexedSortable;
import com.ethnicthv.lesser.core.sort.QuickSort;
import com.ethnicthv.lesser.core.sort.Sortables;
import com.ethnicthv.lesser.core.type.ElementTypes;
import org.openjdk.jmh.annotations.*;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Sorting 10k (string, int) records:
 * - hand-written predicate vs a predicate built per sort vs one built once and reused.
 * - the same three over a flat StructArray refilled from a byte snapshot.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 1, jvmArgs = {"-Xms1G", "-Xmx1G"})
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
public class StructSortBenchmark {

    @State(Scope.Thread)
    public static class HeapState {
        @Param({"10000"})
        public int count;

        public Entry[] unsorted;
        public Entry[] buf;
        public IndexedSortable sortable;
        public IndexedLess reused;

        @Setup(Level.Trial)
        public void setup() {
            Random rnd = new Random(123);
            unsorted = new Entry[count];
            for (int i = 0; i < count; i++) {
                unsorted[i] = new Entry(String.valueOf(rnd.nextInt(1_000_000_000)), rnd.nextInt(1_000_000_000));
            }
            buf = new Entry[count];
            sortable = Sortables.of(buf);
            reused = Lesser.of(buf);
        }

        void refill() {
            System.arraycopy(unsorted, 0, buf, 0, count);
        }
    }

    @State(Scope.Thread)
    public static class FlatState {
        @Param({"10000"})
        public int count;

        public StructArray buf;
        public byte[] snapshot;
        public IndexedLess reused;

        @Setup(Level.Trial)
        public void setup() {
            Random rnd = new Random(123);
            buf = StructArray.allocate(ElementTypes.layoutOf(Row.class), count);
            ElementHandle h = buf.element(0);
            for (int i = 0; i < count; i++) {
                h.at(i)
                    .setString("s", String.valueOf(rnd.nextInt(1_000_000_000)))
                    .setInt("i", rnd.nextInt(1_000_000_000));
            }
            snapshot = new byte[buf.buffer().capacity()];
            buf.buffer().get(0, snapshot);
            reused = Lesser.of(buf);
        }

        void refill() {
            buf.buffer().put(0, snapshot);
        }
    }

    // ===== Java arrays =====

    @Benchmark
    public Entry[] heap_native(HeapState s) {
        s.refill();
        Entry[] a = s.buf;
        QuickSort.INSTANCE.sort(s.sortable, (i, j) -> {
            Entry x = a[i], y = a[j];
            int c = x.s().compareTo(y.s());
            return c != 0 ? c < 0 : x.i() < y.i();
        });
        return a;
    }

    @Benchmark
    public Entry[] heap_lesser(HeapState s) {
        s.refill();
        QuickSort.INSTANCE.sort(s.sortable, Lesser.of(s.buf));
        return s.buf;
    }

    @Benchmark
    public Entry[] heap_lesser_reuse(HeapState s) {
        s.refill();
        QuickSort.INSTANCE.sort(s.sortable, s.reused);
        return s.buf;
    }

    // ===== StructArray =====

    @Benchmark
    public StructArray flat_native(FlatState s) {
        s.refill();
        StructArray a = s.buf;
        int stride = a.stride();
        QuickSort.INSTANCE.sort(a, (i, j) -> {
            String x = a.stringAt(a.buffer().getInt(i * stride));
            String y = a.stringAt(a.buffer().getInt(j * stride));
            int c = x.compareTo(y);
            return c != 0 ? c < 0 : a.buffer().getInt(i * stride + 4) < a.buffer().getInt(j * stride + 4);
        });
        return a;
    }

    @Benchmark
    public StructArray flat_lesser(FlatState s) {
        s.refill();
        QuickSort.INSTANCE.sort(s.buf, Lesser.of(s.buf));
        return s.buf;
    }

    @Benchmark
    public StructArray flat_lesser_reuse(FlatState s) {
        s.refill();
        QuickSort.INSTANCE.sort(s.buf, s.reused);
        return s.buf;
    }
}
