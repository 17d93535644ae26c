package com.ethnicthv.lesser.core.memory;

import com.ethnicthv.lesser.core.sort.IndexedSortable;
import com.ethnicthv.lesser.core.type.ElementType;
import com.ethnicthv.lesser.core.type.FieldDescriptor;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * StructArray - fixed-stride flat storage for elements described by an {@link ElementType}.
 * <p>
 * Element i occupies bytes {@code [i * stride, (i + 1) * stride)} of the backing buffer, each
 * field at the byte offset its descriptor assigns. STRING slots hold a 4-byte handle into this
 * array's string table; handle 0 is the empty string so zeroed memory reads as "".
 * The table only grows as strings are set; after refilling the array call
 * {@link #compactStrings()} to drop strings no slot refers to any more.
 * Not thread-safe for writers.
 */
public final class StructArray implements IndexedSortable {
    private final ElementType type;
    private final ByteBuffer buffer;
    private final int stride;
    private final int length;

    private final List<String> strings = new ArrayList<>();
    private final Map<String, Integer> stringIds = new HashMap<>();
    // offsets of every STRING slot within one element
    private final int[] stringSlots;

    // scratch for swap
    private final byte[] tmpA;
    private final byte[] tmpB;

    private StructArray(ElementType type, ByteBuffer buffer, int length) {
        this.type = type;
        this.buffer = buffer;
        this.stride = (int) type.getSize();
        this.length = length;
        this.tmpA = new byte[stride];
        this.tmpB = new byte[stride];
        this.stringSlots = stringSlots(type);
        strings.add("");
        stringIds.put("", 0);
    }

    /**
     * Allocate zeroed, native-order storage for {@code length} elements.
     */
    public static StructArray allocate(ElementType type, int length) {
        Objects.requireNonNull(type, "type");
        if (length < 0) {
            throw new IllegalArgumentException("length must be >= 0, got " + length);
        }
        long bytes = type.getSize() * (long) length;
        if (bytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("StructArray too large: " + length + " x " + type.getSize() + " bytes");
        }
        ByteBuffer buf = ByteBuffer.allocate((int) bytes).order(ByteOrder.nativeOrder());
        return new StructArray(type, buf, length);
    }

    /**
     * View an existing buffer as consecutive elements of {@code type}, starting at index 0 of the
     * buffer and using the buffer's byte order. Trailing bytes that do not fill an element are ignored.
     * The type must not contain STRING slots: a foreign buffer has no string table to resolve them.
     */
    public static StructArray wrap(ByteBuffer buffer, ElementType type) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(type, "type");
        if (type.getSize() <= 0) {
            throw new IllegalArgumentException("cannot wrap elements of zero size: " + type);
        }
        if (stringSlots(type).length > 0) {
            throw new IllegalArgumentException("cannot wrap elements with string slots: " + type);
        }
        int n = (int) (buffer.capacity() / type.getSize());
        return new StructArray(type, buffer, n);
    }

    public ElementType getType() {
        return type;
    }

    /**
     * Backing buffer; absolute reads only, the position is never used.
     */
    public ByteBuffer buffer() {
        return buffer;
    }

    public int stride() {
        return stride;
    }

    public int length() {
        return length;
    }

    @Override
    public int size() {
        return length;
    }

    /**
     * Byte index of element {@code index} inside the buffer
     */
    public int base(int index) {
        Objects.checkIndex(index, length);
        return index * stride;
    }

    /**
     * Handle bound to one element; rebind it with {@link ElementHandle#at(int)} to reuse it.
     */
    public ElementHandle element(int index) {
        return new ElementHandle(this, index);
    }

    // =================================================================
    // String table
    // =================================================================

    public String stringAt(int handle) {
        return strings.get(handle);
    }

    /**
     * Handle for {@code s}, adding it to the table on first use
     */
    public int intern(String s) {
        Objects.requireNonNull(s, "s");
        Integer id = stringIds.get(s);
        if (id != null) {
            return id;
        }
        int next = strings.size();
        strings.add(s);
        stringIds.put(s, next);
        return next;
    }

    /**
     * Number of strings in the table, the empty string included
     */
    public int stringCount() {
        return strings.size();
    }

    /**
     * Rebuild the string table from the strings still referenced by some slot and rewrite
     * every slot's handle. Handles obtained earlier become invalid.
     */
    public void compactStrings() {
        List<String> live = new ArrayList<>();
        Map<String, Integer> liveIds = new HashMap<>();
        live.add("");
        liveIds.put("", 0);
        for (int i = 0; i < length; i++) {
            int base = i * stride;
            for (int off : stringSlots) {
                String s = strings.get(buffer.getInt(base + off));
                Integer id = liveIds.get(s);
                if (id == null) {
                    id = live.size();
                    live.add(s);
                    liveIds.put(s, id);
                }
                buffer.putInt(base + off, id);
            }
        }
        strings.clear();
        strings.addAll(live);
        stringIds.clear();
        stringIds.putAll(liveIds);
    }

    private static int[] stringSlots(ElementType type) {
        List<Integer> out = new ArrayList<>();
        collectStringSlots(type, 0, out);
        return out.stream().mapToInt(Integer::intValue).toArray();
    }

    private static void collectStringSlots(ElementType type, long offset, List<Integer> out) {
        switch (type.getKind()) {
            case STRING -> out.add((int) offset);
            case ARRAY -> {
                for (int k = 0; k < type.getLength(); k++) {
                    collectStringSlots(type.getElem(), offset + type.getElem().getSize() * k, out);
                }
            }
            case STRUCT -> {
                for (FieldDescriptor f : type.getFields()) {
                    collectStringSlots(f.type(), offset + f.offset(), out);
                }
            }
            default -> {
            }
        }
    }

    // =================================================================
    // Sorting support
    // =================================================================

    @Override
    public void swap(int i, int j) {
        if (i == j) {
            return;
        }
        int bi = base(i), bj = base(j);
        buffer.get(bi, tmpA);
        buffer.get(bj, tmpB);
        buffer.put(bi, tmpB);
        buffer.put(bj, tmpA);
    }
}
