package com.ethnicthv.lesser.core.compare;

import com.ethnicthv.lesser.core.type.ElementType;
import com.ethnicthv.lesser.core.type.FieldDescriptor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Position of one value inside an element: its type, the cumulative byte offset from the
 * element base, and the chain of steps (fields, array indices, complex parts) leading to it.
 * Paths are immutable; each step creates a child.
 */
public final class LeafPath {
    private final LeafPath parent;
    private final ElementType type;
    private final long offset;
    private final FieldDescriptor field;
    private final String label;

    private LeafPath(LeafPath parent, ElementType type, long offset, FieldDescriptor field, String label) {
        this.parent = parent;
        this.type = type;
        this.offset = offset;
        this.field = field;
        this.label = label;
    }

    public static LeafPath root(ElementType type) {
        return new LeafPath(null, type, 0, null, "");
    }

    public LeafPath field(FieldDescriptor f) {
        return new LeafPath(this, f.type(), offset + f.offset(), f, "." + f.name());
    }

    public LeafPath element(int index) {
        ElementType elem = type.getElem();
        return new LeafPath(this, elem, offset + elem.getSize() * index, null, "[" + index + "]");
    }

    /**
     * Synthetic sub-value of a scalar, e.g. the real or imaginary half of a complex number.
     */
    public LeafPath part(ElementType partType, long delta, String name) {
        return new LeafPath(this, partType, offset + delta, null, "." + name);
    }

    public LeafPath getParent() {
        return parent;
    }

    public ElementType getType() {
        return type;
    }

    public long getOffset() {
        return offset;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Field selected by the last step, or null if the last step was not a field selection
     */
    public FieldDescriptor getField() {
        return field;
    }

    /**
     * Fields selected on the way from the root to this path, outermost first.
     *
     * @throws IllegalStateException if the path contains a non-field step
     */
    public List<FieldDescriptor> fieldChain() {
        Deque<FieldDescriptor> chain = new ArrayDeque<>();
        for (LeafPath p = this; p.parent != null; p = p.parent) {
            if (p.field == null) {
                throw new IllegalStateException("Path " + this + " has a non-field step");
            }
            chain.addFirst(p.field);
        }
        return new ArrayList<>(chain);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (LeafPath p = this; p != null; p = p.parent) {
            sb.insert(0, p.label);
        }
        return sb.length() > 0 && sb.charAt(0) == '.' ? sb.substring(1) : sb.toString();
    }
}
