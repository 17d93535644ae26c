package com.ethnicthv.lesser.core.type;

import java.lang.reflect.Field;

/**
 * One named member of a STRUCT {@link ElementType}.
 *
 * @param name   declared field name
 * @param type   the field's own descriptor
 * @param offset byte offset of the field within the enclosing struct
 * @param member backing Java field for reflected heap types, null for buffer layouts
 */
public record FieldDescriptor(String name, ElementType type, long offset, Field member) {

    public FieldDescriptor(String name, ElementType type, long offset) {
        this(name, type, offset, null);
    }

    /**
     * A discard placeholder is named with underscores only ("_", "__", ...)
     * and contributes no leaves to an ordering.
     */
    public boolean isDiscard() {
        return isDiscardName(name);
    }

    public static boolean isDiscardName(String name) {
        if (name == null || name.isEmpty()) return false;
        for (int i = 0; i < name.length(); i++) {
            if (name.charAt(i) != '_') return false;
        }
        return true;
    }

    public long end() {
        return offset + type.getSize();
    }
}
