package com.ethnicthv.lesser.core.type;

import com.ethnicthv.lesser.core.UnsupportedTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ElementTypes - derives {@link ElementType} descriptors from Java classes using reflection.
 * <p>
 * {@link #of(Class)} describes how values of a class live on the heap (records, plain classes,
 * boxed values, strings, enums). {@link #layoutOf(Class)} reads {@link Struct.Field} annotations
 * to describe a flat buffer layout. Both registries are thread-safe and cache one descriptor per class.
 */
public final class ElementTypes {
    private static final Logger LOG = LoggerFactory.getLogger(ElementTypes.class);

    private static final ConcurrentHashMap<Class<?>, ElementType> HEAP = new ConcurrentHashMap<>();
    private static final ConcurrentHashMap<Class<?>, ElementType> LAYOUTS = new ConcurrentHashMap<>();

    private static final Map<Class<?>, Kind> PRIMITIVES = Map.ofEntries(
        Map.entry(boolean.class, Kind.BOOL), Map.entry(Boolean.class, Kind.BOOL),
        Map.entry(byte.class, Kind.INT8), Map.entry(Byte.class, Kind.INT8),
        Map.entry(short.class, Kind.INT16), Map.entry(Short.class, Kind.INT16),
        Map.entry(char.class, Kind.UINT16), Map.entry(Character.class, Kind.UINT16),
        Map.entry(int.class, Kind.INT32), Map.entry(Integer.class, Kind.INT32),
        Map.entry(long.class, Kind.INT64), Map.entry(Long.class, Kind.INT64),
        Map.entry(float.class, Kind.FLOAT32), Map.entry(Float.class, Kind.FLOAT32),
        Map.entry(double.class, Kind.FLOAT64), Map.entry(Double.class, Kind.FLOAT64),
        Map.entry(String.class, Kind.STRING)
    );

    private ElementTypes() {
    }

    // =================================================================
    // Heap descriptors
    // =================================================================

    /**
     * Describe values of {@code cls} as they are stored in Java arrays and lists.
     *
     * @throws UnsupportedTypeException if the class reaches itself through its fields
     */
    public static ElementType of(Class<?> cls) {
        Objects.requireNonNull(cls, "cls");
        ElementType cached = HEAP.get(cls);
        if (cached != null) {
            return cached;
        }
        // not computeIfAbsent: nested classes are registered while the outer one is being built
        ElementType built = describe(cls, new LinkedHashSet<>());
        ElementType prev = HEAP.putIfAbsent(cls, built);
        return prev != null ? prev : built;
    }

    private static ElementType describe(Class<?> cls, Set<Class<?>> inProgress) {
        ElementType cached = HEAP.get(cls);
        if (cached != null) {
            return cached;
        }
        Kind scalar = PRIMITIVES.get(cls);
        if (scalar != null) {
            return ElementType.of(scalar, cls);
        }
        if (Enum.class.isAssignableFrom(cls) && cls != Enum.class) {
            return ElementType.of(Kind.ENUM, cls);
        }
        if (cls.isArray()) {
            return ElementType.sliceOf(describe(cls.getComponentType(), inProgress), cls);
        }
        if (Collection.class.isAssignableFrom(cls)) {
            // element class is erased; any collection is a nested sequence
            return ElementType.sliceOf(ElementType.INTERFACE, cls);
        }
        if (cls == Object.class || cls.isInterface() || Modifier.isAbstract(cls.getModifiers())) {
            return ElementType.openOf(cls);
        }
        if (isPlatformClass(cls)) {
            // not reflectable; ordered by identity only
            return ElementType.of(Kind.POINTER, cls);
        }
        if (!inProgress.add(cls)) {
            throw new UnsupportedTypeException(cls.getName(), cyclePath(inProgress, cls),
                "class reaches itself through its fields");
        }
        try {
            ElementType.Builder b = ElementType.struct(cls.getName()).javaType(cls);
            for (Field f : instanceFields(cls)) {
                b.field(f.getName(), describe(f.getType(), inProgress), -1, 0, f);
            }
            ElementType t = b.build();
            LOG.debug("Derived heap descriptor for {} with {} fields", cls.getName(), t.fieldCount());
            HEAP.putIfAbsent(cls, t);
            return t;
        } finally {
            inProgress.remove(cls);
        }
    }

    /**
     * Instance fields in comparison order: superclass fields first, then declaration order.
     * Record fields follow component order. Static, synthetic and transient fields are skipped.
     */
    static List<Field> instanceFields(Class<?> cls) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = cls; c != null && c != Object.class && c != Record.class && !isPlatformClass(c);
             c = c.getSuperclass()) {
            hierarchy.addFirst(c);
        }
        List<Field> out = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            if (c.isRecord()) {
                for (RecordComponent rc : c.getRecordComponents()) {
                    try {
                        out.add(c.getDeclaredField(rc.getName()));
                    } catch (NoSuchFieldException e) {
                        throw new IllegalStateException("Record " + c.getName() + " has no field for component "
                            + rc.getName(), e);
                    }
                }
                continue;
            }
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (Modifier.isStatic(mod) || Modifier.isTransient(mod) || f.isSynthetic()) {
                    continue;
                }
                out.add(f);
            }
        }
        return out;
    }

    static boolean isPlatformClass(Class<?> cls) {
        String n = cls.getName();
        return n.startsWith("java.") || n.startsWith("javax.") || n.startsWith("jdk.") || n.startsWith("sun.");
    }

    private static String cyclePath(Set<Class<?>> inProgress, Class<?> again) {
        StringJoiner j = new StringJoiner(" -> ");
        for (Class<?> c : inProgress) j.add(c.getSimpleName());
        j.add(again.getSimpleName());
        return j.toString();
    }

    // =================================================================
    // Buffer layouts
    // =================================================================

    /**
     * Build a flat layout descriptor from a {@link Struct} class. Only fields annotated with
     * {@link Struct.Field} take part; static and transient fields are skipped.
     */
    public static ElementType layoutOf(Class<? extends Struct> structClass) {
        Objects.requireNonNull(structClass, "structClass");
        ElementType cached = LAYOUTS.get(structClass);
        if (cached != null) {
            return cached;
        }
        ElementType built = buildLayout(structClass, new LinkedHashSet<>());
        ElementType prev = LAYOUTS.putIfAbsent(structClass, built);
        return prev != null ? prev : built;
    }

    private static ElementType buildLayout(Class<?> structClass, Set<Class<?>> inProgress) {
        if (!Struct.class.isAssignableFrom(structClass)) {
            throw new IllegalArgumentException(structClass.getName() + " must implement Struct interface");
        }
        ElementType cached = LAYOUTS.get(structClass);
        if (cached != null) {
            return cached;
        }
        if (!inProgress.add(structClass)) {
            throw new IllegalArgumentException("Struct " + structClass.getName() + " contains itself: "
                + cyclePath(inProgress, structClass));
        }
        try {
            Struct.Layout layout = structClass.getAnnotation(Struct.Layout.class);
            ElementType.Builder b = ElementType.struct(structClass.getSimpleName())
                .layout(layout != null ? layout.value() : Struct.LayoutType.PADDING);
            if (layout != null && layout.size() >= 0) {
                b.size(layout.size());
            }
            for (Field field : structClass.getDeclaredFields()) {
                int mod = field.getModifiers();
                if (Modifier.isStatic(mod) || Modifier.isTransient(mod)) {
                    continue;
                }
                Struct.Field anno = field.getAnnotation(Struct.Field.class);
                if (anno == null) {
                    continue;
                }
                ElementType type = layoutFieldType(structClass, field, anno, inProgress);
                b.field(field.getName(), type, anno.offset(), anno.alignment(), null);
            }
            ElementType t = b.build();
            LOG.debug("Derived layout for {}: size={} fields={}", structClass.getName(), t.getSize(), t.fieldCount());
            LAYOUTS.putIfAbsent(structClass, t);
            return t;
        } finally {
            inProgress.remove(structClass);
        }
    }

    private static ElementType layoutFieldType(Class<?> owner, Field field, Struct.Field anno, Set<Class<?>> inProgress) {
        Class<?> javaType = field.getType();
        if (anno.length() > 0) {
            if (!javaType.isArray()) {
                throw new IllegalArgumentException("Field " + owner.getSimpleName() + "." + field.getName()
                    + " declares length " + anno.length() + " but is not an array");
            }
            return ElementType.arrayOf(layoutScalar(owner, field, javaType.getComponentType(), anno.kind(), inProgress),
                anno.length());
        }
        if (javaType.isArray() && anno.kind() == Kind.INVALID) {
            throw new IllegalArgumentException("Array field " + owner.getSimpleName() + "." + field.getName()
                + " needs a fixed length");
        }
        return layoutScalar(owner, field, javaType, anno.kind(), inProgress);
    }

    private static ElementType layoutScalar(Class<?> owner, Field field, Class<?> javaType, Kind override,
                                            Set<Class<?>> inProgress) {
        if (override != Kind.INVALID) {
            if (override.isComposite()) {
                throw new IllegalArgumentException("Kind override on " + owner.getSimpleName() + "." + field.getName()
                    + " must be a scalar kind, got " + override);
            }
            // SLICE/INTERFACE are accepted here and rejected when a predicate is built
            return override == Kind.SLICE ? ElementType.sliceOf(ElementType.INTERFACE) : ElementType.of(override);
        }
        if (Struct.class.isAssignableFrom(javaType)) {
            return buildLayout(javaType, inProgress);
        }
        Kind k = javaType.isPrimitive() || javaType == String.class ? PRIMITIVES.get(javaType) : null;
        if (k == null) {
            throw new IllegalArgumentException("Field " + owner.getSimpleName() + "." + field.getName()
                + " of type " + javaType.getName() + " has no flat layout; declare a kind");
        }
        return ElementType.of(k);
    }
}
