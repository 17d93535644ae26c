package com.ethnicthv.lesser.core.compare;

import com.ethnicthv.lesser.core.compare.Accessors.BooleanAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.DoubleAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.FloatAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.IntAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.LongAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.ObjectAccessor;
import com.ethnicthv.lesser.core.memory.StructArray;
import com.ethnicthv.lesser.core.type.ElementType;

import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * StructArraySource - builds predicates over a {@link StructArray}.
 * Each leaf becomes an absolute buffer read at {@code index * stride + offset}, the offset being
 * fixed once from the leaf's path.
 */
public final class StructArraySource extends LessBuilder {
    private final StructArray array;
    private final ByteBuffer buf;
    private final int stride;

    public StructArraySource(StructArray array) {
        this.array = Objects.requireNonNull(array, "array");
        this.buf = array.buffer();
        this.stride = array.stride();
    }

    @Override
    protected int length() {
        return array.length();
    }

    @Override
    protected ElementType elementType() {
        return array.getType();
    }

    @Override
    protected BooleanAccessor booleans(LeafPath path) {
        int off = (int) path.getOffset();
        return i -> buf.get(i * stride + off) != 0;
    }

    @Override
    protected IntAccessor ints(LeafPath path) {
        int off = (int) path.getOffset();
        return switch (path.getType().getKind()) {
            case INT8 -> i -> buf.get(i * stride + off);
            case UINT8 -> i -> buf.get(i * stride + off) & 0xff;
            case INT16 -> i -> buf.getShort(i * stride + off);
            case UINT16 -> i -> buf.getChar(i * stride + off);
            default -> i -> buf.getInt(i * stride + off);
        };
    }

    @Override
    protected LongAccessor longs(LeafPath path) {
        int off = (int) path.getOffset();
        return i -> buf.getLong(i * stride + off);
    }

    @Override
    protected FloatAccessor floats(LeafPath path) {
        int off = (int) path.getOffset();
        return i -> buf.getFloat(i * stride + off);
    }

    @Override
    protected DoubleAccessor doubles(LeafPath path) {
        int off = (int) path.getOffset();
        return i -> buf.getDouble(i * stride + off);
    }

    @Override
    protected ObjectAccessor<String> strings(LeafPath path) {
        int off = (int) path.getOffset();
        return i -> array.stringAt(buf.getInt(i * stride + off));
    }
}
