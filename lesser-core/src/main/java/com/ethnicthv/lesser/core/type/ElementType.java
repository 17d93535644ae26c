package com.ethnicthv.lesser.core.type;

import java.util.*;

/**
 * ElementType - runtime description of the shape of one collection element.
 * <p>
 * Scalars are described by their {@link Kind} alone. ARRAY carries an element type and a
 * fixed length, SLICE an element type, STRUCT an ordered list of {@link FieldDescriptor}s
 * with byte offsets. Descriptors are immutable and may be shared freely.
 */
public final class ElementType {

    private static final EnumMap<Kind, ElementType> SCALARS = new EnumMap<>(Kind.class);

    static {
        for (Kind k : Kind.values()) {
            if (!k.isComposite() && k != Kind.SLICE) {
                SCALARS.put(k, new ElementType(k, k.name().toLowerCase(Locale.ROOT), k.getSize(),
                    Math.max(1, k.getNaturalAlignment()), null, 0, List.of(), null));
            }
        }
    }

    public static final ElementType INTERFACE = SCALARS.get(Kind.INTERFACE);

    private final Kind kind;
    private final String name;
    private final long size;
    private final int alignment;
    private final ElementType elem;
    private final int length;
    private final List<FieldDescriptor> fields;
    private final Class<?> javaType;

    private ElementType(Kind kind, String name, long size, int alignment, ElementType elem,
                        int length, List<FieldDescriptor> fields, Class<?> javaType) {
        this.kind = kind;
        this.name = name;
        this.size = size;
        this.alignment = alignment;
        this.elem = elem;
        this.length = length;
        this.fields = fields;
        this.javaType = javaType;
    }

    // =================================================================
    // Factories
    // =================================================================

    /**
     * Descriptor for a scalar kind (anything but ARRAY, STRUCT and SLICE).
     */
    public static ElementType of(Kind kind) {
        ElementType t = SCALARS.get(Objects.requireNonNull(kind, "kind"));
        if (t == null) {
            throw new IllegalArgumentException(kind + " is not a scalar kind; use arrayOf/sliceOf/struct");
        }
        return t;
    }

    /**
     * Scalar descriptor bound to the Java class that carries its values on the heap.
     */
    static ElementType of(Kind kind, Class<?> javaType) {
        ElementType t = of(kind);
        return new ElementType(kind, javaType.getName(), t.size, t.alignment, null, 0, List.of(), javaType);
    }

    public static ElementType arrayOf(ElementType elem, int length) {
        Objects.requireNonNull(elem, "elem");
        if (length < 0) {
            throw new IllegalArgumentException("Array length must be >= 0, got " + length);
        }
        return new ElementType(Kind.ARRAY, "[" + length + "]" + elem.name, elem.size * length,
            elem.alignment, elem, length, List.of(), null);
    }

    public static ElementType sliceOf(ElementType elem) {
        return sliceOf(elem, null);
    }

    static ElementType sliceOf(ElementType elem, Class<?> javaType) {
        Objects.requireNonNull(elem, "elem");
        return new ElementType(Kind.SLICE, "[]" + elem.name, Kind.SLICE.getSize(),
            Kind.SLICE.getNaturalAlignment(), elem, 0, List.of(), javaType);
    }

    static ElementType openOf(Class<?> javaType) {
        return new ElementType(Kind.INTERFACE, javaType.getName(), INTERFACE.size, INTERFACE.alignment,
            null, 0, List.of(), javaType);
    }

    /**
     * Start building a STRUCT descriptor. Fields keep the order in which they are added.
     */
    public static Builder struct(String name) {
        return new Builder(name);
    }

    // =================================================================
    // Accessors
    // =================================================================

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public long getSize() {
        return size;
    }

    public int getAlignment() {
        return alignment;
    }

    /**
     * Element type of an ARRAY or SLICE, null otherwise
     */
    public ElementType getElem() {
        return elem;
    }

    public int getLength() {
        return length;
    }

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    public int fieldCount() {
        return fields.size();
    }

    public FieldDescriptor getField(int index) {
        return fields.get(index);
    }

    /**
     * Index of the named field, or -1
     */
    public int getFieldIndex(String fieldName) {
        for (int i = 0; i < fields.size(); i++) {
            if (fields.get(i).name().equals(fieldName)) return i;
        }
        return -1;
    }

    /**
     * Java class carrying values of this type on the heap; null for buffer layouts.
     */
    public Class<?> getJavaType() {
        return javaType;
    }

    // =================================================================
    // Path resolution
    // =================================================================

    /**
     * Resolved position of a nested value inside an element.
     */
    public record Location(ElementType type, long offset) { }

    /**
     * Resolve a path such as {@code "pos.x"}, {@code "vals[2]"} or {@code "[1].re"} to the
     * type and byte offset it names. Prefer calling once at setup and reusing the result.
     */
    public Location locate(String path) {
        Objects.requireNonNull(path, "path");
        ElementType current = this;
        long offset = 0;
        int i = 0;
        int n = path.length();
        while (i < n) {
            char c = path.charAt(i);
            if (c == '[') {
                int close = path.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed '[' in path: " + path);
                }
                if (current.kind != Kind.ARRAY) {
                    throw new IllegalArgumentException("Path " + path + " indexes non-array " + current.name);
                }
                int idx;
                try {
                    idx = Integer.parseInt(path.substring(i + 1, close));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Bad index in path: " + path, e);
                }
                if (idx < 0 || idx >= current.length) {
                    throw new IndexOutOfBoundsException("Index " + idx + " out of range for " + current.name);
                }
                offset += current.elem.size * idx;
                current = current.elem;
                i = close + 1;
            } else {
                if (c == '.') {
                    i++;
                }
                int end = i;
                while (end < n && path.charAt(end) != '.' && path.charAt(end) != '[') end++;
                String fieldName = path.substring(i, end);
                if (current.kind != Kind.STRUCT) {
                    throw new IllegalArgumentException("Path " + path + " selects field of non-struct " + current.name);
                }
                int idx = current.getFieldIndex(fieldName);
                if (idx < 0) {
                    throw new IllegalArgumentException("Field " + fieldName + " not found in " + current.name);
                }
                FieldDescriptor f = current.fields.get(idx);
                offset += f.offset();
                current = f.type();
                i = end;
            }
        }
        return new Location(current, offset);
    }

    @Override
    public String toString() {
        return name;
    }

    // =================================================================
    // Builder
    // =================================================================

    /**
     * Fluent STRUCT builder. Offsets are computed by the selected {@link Struct.LayoutType};
     * PADDING (natural alignment) is the default.
     */
    public static final class Builder {
        private final String name;
        private final List<PendingField> pending = new ArrayList<>();
        private Struct.LayoutType layoutType = Struct.LayoutType.PADDING;
        private long sizeOverride = -1;
        private Class<?> javaType;

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder layout(Struct.LayoutType layoutType) {
            this.layoutType = Objects.requireNonNull(layoutType, "layoutType");
            return this;
        }

        public Builder size(long size) {
            this.sizeOverride = size;
            return this;
        }

        Builder javaType(Class<?> javaType) {
            this.javaType = javaType;
            return this;
        }

        public Builder field(String fieldName, ElementType type) {
            return field(fieldName, type, -1, 0, null);
        }

        public Builder field(String fieldName, Kind kind) {
            return field(fieldName, ElementType.of(kind));
        }

        /**
         * Add a field at an explicit offset (only honoured by the EXPLICIT layout).
         */
        public Builder field(String fieldName, ElementType type, long offset) {
            return field(fieldName, type, offset, 0, null);
        }

        Builder field(String fieldName, ElementType type, long offset, int alignment, java.lang.reflect.Field member) {
            pending.add(new PendingField(Objects.requireNonNull(fieldName, "fieldName"),
                Objects.requireNonNull(type, "type"), offset, alignment, member));
            return this;
        }

        public ElementType build() {
            List<FieldDescriptor> out = new ArrayList<>(pending.size());
            long currentOffset = 0;
            long end = 0;
            int maxAlignment = 1;
            for (PendingField p : pending) {
                int align = p.alignment > 0 ? p.alignment : p.type.alignment;
                maxAlignment = Math.max(maxAlignment, align);
                long offset;
                if (layoutType == Struct.LayoutType.EXPLICIT) {
                    if (p.offset < 0) {
                        throw new IllegalArgumentException("Field " + p.name + " of " + name
                            + " needs an explicit offset in an EXPLICIT layout");
                    }
                    offset = p.offset;
                } else if (layoutType == Struct.LayoutType.PADDING) {
                    offset = alignUp(currentOffset, align);
                } else {
                    offset = currentOffset;
                }
                FieldDescriptor f = new FieldDescriptor(p.name, p.type, offset, p.member);
                if (layoutType == Struct.LayoutType.EXPLICIT) {
                    for (FieldDescriptor other : out) {
                        if (f.offset() < other.end() && other.offset() < f.end()) {
                            throw new IllegalArgumentException("Field " + f.name() + " overlaps " + other.name()
                                + " in " + name);
                        }
                    }
                }
                out.add(f);
                currentOffset = offset + p.type.size;
                end = Math.max(end, currentOffset);
            }

            long totalSize;
            if (sizeOverride >= 0) {
                if (sizeOverride < end) {
                    throw new IllegalArgumentException("Size override " + sizeOverride + " of " + name
                        + " is smaller than its fields (" + end + ")");
                }
                totalSize = sizeOverride;
            } else if (layoutType == Struct.LayoutType.PADDING) {
                totalSize = alignUp(end, maxAlignment);
            } else {
                totalSize = end;
            }
            return new ElementType(Kind.STRUCT, name, totalSize, maxAlignment, null, 0,
                Collections.unmodifiableList(out), javaType);
        }

        private static long alignUp(long offset, int alignment) {
            return ((offset + alignment - 1) / alignment) * alignment;
        }

        private record PendingField(String name, ElementType type, long offset, int alignment,
                                    java.lang.reflect.Field member) { }
    }
}
