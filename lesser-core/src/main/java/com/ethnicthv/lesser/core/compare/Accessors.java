package com.ethnicthv.lesser.core.compare;

/**
 * Typed per-leaf readers. Each accessor is resolved once while a predicate is built and reads
 * one leaf of the element at the given index without any further type inspection.
 */
public final class Accessors {

    private Accessors() {
    }

    @FunctionalInterface
    public interface BooleanAccessor {
        boolean get(int index);
    }

    /**
     * Reader for integer leaves up to 32 bits. Narrow unsigned kinds are zero-extended,
     * UINT32 is returned as its raw bits.
     */
    @FunctionalInterface
    public interface IntAccessor {
        int get(int index);
    }

    /**
     * Reader for 64-bit integer leaves and opaque identity values.
     */
    @FunctionalInterface
    public interface LongAccessor {
        long get(int index);
    }

    @FunctionalInterface
    public interface FloatAccessor {
        float get(int index);
    }

    @FunctionalInterface
    public interface DoubleAccessor {
        double get(int index);
    }

    @FunctionalInterface
    public interface ObjectAccessor<T> {
        T get(int index);
    }
}
