package com.ethnicthv.lesser.core.type;

/**
 * Kind - the shape category of an {@link ElementType}.
 * Scalar kinds carry their storage size and natural alignment in bytes;
 * composite kinds compute theirs from their children.
 */
public enum Kind {
    INVALID(0),
    BOOL(1),
    INT8(1),
    INT16(2),
    INT32(4),
    INT64(8),
    UINT8(1),
    UINT16(2),
    UINT32(4),
    UINT64(8),
    FLOAT32(4),
    FLOAT64(8),
    COMPLEX64(8, 4),
    COMPLEX128(16, 8),
    // slot holds a handle into the owning StructArray's string table
    STRING(4),
    CHAN(8),
    FUNC(8),
    MAP(8),
    POINTER(8),
    UNSAFE_POINTER(8),
    UINTPTR(8),
    ENUM(4),
    ARRAY(0),
    STRUCT(0),
    SLICE(24, 8),
    INTERFACE(16, 8);

    private final int size;
    private final int alignment;

    Kind(int size) {
        this(size, size);
    }

    Kind(int size, int alignment) {
        this.size = size;
        this.alignment = alignment;
    }

    /**
     * Storage size in bytes (0 for ARRAY/STRUCT, which are sized by their children)
     */
    public int getSize() {
        return size;
    }

    public int getNaturalAlignment() {
        return alignment;
    }

    public boolean isSignedInteger() {
        return this == INT8 || this == INT16 || this == INT32 || this == INT64;
    }

    public boolean isUnsignedInteger() {
        return this == UINT8 || this == UINT16 || this == UINT32 || this == UINT64;
    }

    public boolean isFloat() {
        return this == FLOAT32 || this == FLOAT64;
    }

    public boolean isComplex() {
        return this == COMPLEX64 || this == COMPLEX128;
    }

    /**
     * Opaque handle kinds, ordered by their raw identity value and never dereferenced.
     */
    public boolean isReferenceLike() {
        return switch (this) {
            case CHAN, FUNC, MAP, POINTER, UNSAFE_POINTER, UINTPTR -> true;
            default -> false;
        };
    }

    public boolean isComposite() {
        return this == ARRAY || this == STRUCT;
    }

    /**
     * Kinds the comparator builder refuses to order.
     */
    public boolean isUnsortable() {
        return this == INVALID || this == SLICE || this == INTERFACE;
    }
}
