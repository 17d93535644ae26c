package com.ethnicthv.lesser.core.compare;

import com.ethnicthv.lesser.core.IndexedLess;
import com.ethnicthv.lesser.core.UnsupportedTypeException;
import com.ethnicthv.lesser.core.compare.Accessors.BooleanAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.DoubleAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.FloatAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.IntAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.LongAccessor;
import com.ethnicthv.lesser.core.compare.Accessors.ObjectAccessor;
import com.ethnicthv.lesser.core.type.ElementType;
import com.ethnicthv.lesser.core.type.ElementTypes;
import com.ethnicthv.lesser.core.type.FieldDescriptor;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * HeapSource - builds predicates over Java arrays and random-access lists.
 * <p>
 * Leaves are read through chains of {@link VarHandle}s resolved once per field. Primitive arrays
 * are read directly. Every reference hop (element, nested object, String, boxed value, enum)
 * is null-guarded: null sorts first and two nulls skip the whole subtree.
 */
public final class HeapSource extends LessBuilder {

    private final Class<?> elementClass;
    private final int length;
    private final Object primitiveArray;
    private final ObjectAccessor<Object> elements;
    private final Map<FieldDescriptor, VarHandle> handles = new HashMap<>();

    private HeapSource(Class<?> elementClass, int length, Object primitiveArray, ObjectAccessor<Object> elements) {
        this.elementClass = elementClass;
        this.length = length;
        this.primitiveArray = primitiveArray;
        this.elements = elements;
    }

    /**
     * Source over any Java array; the element type is the array's component type.
     */
    public static HeapSource ofArray(Object array) {
        Objects.requireNonNull(array, "array");
        Class<?> cls = array.getClass();
        if (!cls.isArray()) {
            throw new IllegalArgumentException("argument is not an array: " + cls.getName());
        }
        Class<?> component = cls.getComponentType();
        if (component.isPrimitive()) {
            return new HeapSource(component, java.lang.reflect.Array.getLength(array), array, null);
        }
        Object[] objects = (Object[]) array;
        return new HeapSource(component, objects.length, null, i -> objects[i]);
    }

    /**
     * Source over a random-access list whose elements are instances of {@code elementClass}.
     */
    public static HeapSource ofList(List<?> list, Class<?> elementClass) {
        Objects.requireNonNull(list, "list");
        Objects.requireNonNull(elementClass, "elementClass");
        if (!(list instanceof RandomAccess)) {
            throw new IllegalArgumentException("list is not indexable by position: " + list.getClass().getName());
        }
        if (elementClass.isPrimitive()) {
            throw new IllegalArgumentException("list elements cannot be primitive: " + elementClass.getName());
        }
        return new HeapSource(elementClass, list.size(), null, list::get);
    }

    /**
     * Source over a random-access list, inferring the element class from its contents.
     * All non-null elements must share exactly one class; enum constants count as their enum
     * type. Pass the class to {@link #ofList(List, Class)} for lists mixing subclasses.
     * A list holding only nulls has no element class; all its elements tie.
     */
    public static HeapSource ofList(List<?> list) {
        Objects.requireNonNull(list, "list");
        if (list.isEmpty()) {
            return ofList(list, Object.class);
        }
        Class<?> cls = null;
        for (Object o : list) {
            if (o == null) {
                continue;
            }
            Class<?> c = o instanceof Enum<?> e ? e.getDeclaringClass() : o.getClass();
            if (cls == null) {
                cls = c;
            } else if (cls != c) {
                throw new IllegalArgumentException("list elements are not homogeneous: "
                    + cls.getName() + " and " + c.getName());
            }
        }
        if (cls == null) {
            if (!(list instanceof RandomAccess)) {
                throw new IllegalArgumentException("list is not indexable by position: " + list.getClass().getName());
            }
            return new HeapSource(null, list.size(), null, list::get);
        }
        return ofList(list, cls);
    }

    @Override
    protected int length() {
        return length;
    }

    @Override
    protected boolean allTied() {
        return elementClass == null;
    }

    @Override
    protected ElementType elementType() {
        return ElementTypes.of(elementClass);
    }

    // =================================================================
    // Null guards
    // =================================================================

    @Override
    protected IndexedLess guard(LeafPath path, IndexedLess resolved, IndexedLess next) {
        Class<?> jt = path.getType().getJavaType();
        if (jt == null || jt.isPrimitive()) {
            return resolved;
        }
        ObjectAccessor<Object> ref = refs(path);
        IndexedLess inner = resolved != null ? resolved : IndexedLess.EMPTY;
        return (i, j) -> {
            Object a = ref.get(i), b = ref.get(j);
            if (a == null || b == null) {
                if (a == b) {
                    return next != null && next.less(i, j);
                }
                return a == null;
            }
            return inner.less(i, j);
        };
    }

    // =================================================================
    // Leaf accessors
    // =================================================================

    @Override
    protected BooleanAccessor booleans(LeafPath path) {
        if (isRootPrimitive(path)) {
            boolean[] a = (boolean[]) primitiveArray;
            return i -> a[i];
        }
        if (isPrimitiveField(path)) {
            VarHandle h = handle(path.getField());
            ObjectAccessor<Object> owner = refs(path.getParent());
            return i -> (boolean) h.get(owner.get(i));
        }
        ObjectAccessor<Object> ref = refs(path);
        return i -> (Boolean) ref.get(i);
    }

    @Override
    protected IntAccessor ints(LeafPath path) {
        Class<?> jt = path.getType().getJavaType();
        if (isRootPrimitive(path)) {
            if (primitiveArray instanceof byte[] a) return i -> a[i];
            if (primitiveArray instanceof short[] a) return i -> a[i];
            if (primitiveArray instanceof char[] a) return i -> a[i];
            int[] a = (int[]) primitiveArray;
            return i -> a[i];
        }
        if (isPrimitiveField(path)) {
            VarHandle h = handle(path.getField());
            ObjectAccessor<Object> owner = refs(path.getParent());
            if (jt == byte.class) return i -> (byte) h.get(owner.get(i));
            if (jt == short.class) return i -> (short) h.get(owner.get(i));
            if (jt == char.class) return i -> (char) h.get(owner.get(i));
            return i -> (int) h.get(owner.get(i));
        }
        ObjectAccessor<Object> ref = refs(path);
        if (jt == Character.class) return i -> (Character) ref.get(i);
        if (Enum.class.isAssignableFrom(jt)) return i -> ((Enum<?>) ref.get(i)).ordinal();
        return i -> ((Number) ref.get(i)).intValue();
    }

    @Override
    protected LongAccessor longs(LeafPath path) {
        Class<?> jt = path.getType().getJavaType();
        if (isRootPrimitive(path)) {
            long[] a = (long[]) primitiveArray;
            return i -> a[i];
        }
        if (isPrimitiveField(path)) {
            VarHandle h = handle(path.getField());
            ObjectAccessor<Object> owner = refs(path.getParent());
            return i -> (long) h.get(owner.get(i));
        }
        ObjectAccessor<Object> ref = refs(path);
        if (jt == Long.class) return i -> (Long) ref.get(i);
        // opaque platform object: identity only, never dereferenced
        return i -> System.identityHashCode(ref.get(i)) & 0xffffffffL;
    }

    @Override
    protected FloatAccessor floats(LeafPath path) {
        if (isRootPrimitive(path)) {
            float[] a = (float[]) primitiveArray;
            return i -> a[i];
        }
        if (isPrimitiveField(path)) {
            VarHandle h = handle(path.getField());
            ObjectAccessor<Object> owner = refs(path.getParent());
            return i -> (float) h.get(owner.get(i));
        }
        ObjectAccessor<Object> ref = refs(path);
        return i -> (Float) ref.get(i);
    }

    @Override
    protected DoubleAccessor doubles(LeafPath path) {
        if (isRootPrimitive(path)) {
            double[] a = (double[]) primitiveArray;
            return i -> a[i];
        }
        if (isPrimitiveField(path)) {
            VarHandle h = handle(path.getField());
            ObjectAccessor<Object> owner = refs(path.getParent());
            return i -> (double) h.get(owner.get(i));
        }
        ObjectAccessor<Object> ref = refs(path);
        return i -> (Double) ref.get(i);
    }

    @Override
    protected ObjectAccessor<String> strings(LeafPath path) {
        ObjectAccessor<Object> ref = refs(path);
        return i -> (String) ref.get(i);
    }

    // =================================================================
    // Reference chains
    // =================================================================

    private boolean isRootPrimitive(LeafPath path) {
        return path.isRoot() && primitiveArray != null;
    }

    private static boolean isPrimitiveField(LeafPath path) {
        return path.getField() != null && path.getType().getJavaType().isPrimitive();
    }

    /**
     * Reader for the reference at {@code path}: the element itself, then one field hop per step.
     * Callers only reach a hop after the guards above it have seen non-null owners.
     */
    private ObjectAccessor<Object> refs(LeafPath path) {
        ObjectAccessor<Object> ref = elements;
        for (FieldDescriptor f : path.fieldChain()) {
            VarHandle h = handle(f);
            ObjectAccessor<Object> owner = ref;
            ref = i -> h.get(owner.get(i));
        }
        return ref;
    }

    private VarHandle handle(FieldDescriptor f) {
        VarHandle h = handles.get(f);
        if (h != null) {
            return h;
        }
        java.lang.reflect.Field member = f.member();
        if (member == null) {
            throw new UnsupportedTypeException(f.type().getName(), f.name(), "field has no backing Java member");
        }
        try {
            MethodHandles.Lookup lookup = MethodHandles.privateLookupIn(member.getDeclaringClass(), MethodHandles.lookup());
            h = lookup.unreflectVarHandle(member);
        } catch (IllegalAccessException e) {
            throw new UnsupportedTypeException(member.getDeclaringClass().getName(), f.name(),
                "field is not accessible", e);
        }
        handles.put(f, h);
        return h;
    }
}
