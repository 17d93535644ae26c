package com.ethnicthv.lesser.core;

/**
 * Thrown while building a less predicate when the element type reaches a shape that
 * cannot be ordered: open (interface / Object) values, nested sequences, invalid kinds
 * or self-referencing classes. Carries the offending type name and the field path at
 * which it was found.
 */
public class UnsupportedTypeException extends IllegalArgumentException {
    private final String typeName;
    private final String path;

    public UnsupportedTypeException(String typeName, String path, String reason) {
        super("un-sortable type " + typeName + (path == null || path.isEmpty() ? "" : " at " + path) + ": " + reason);
        this.typeName = typeName;
        this.path = path;
    }

    public UnsupportedTypeException(String typeName, String path, String reason, Throwable cause) {
        this(typeName, path, reason);
        initCause(cause);
    }

    public String getTypeName() {
        return typeName;
    }

    /**
     * Dotted path from the element root to the rejected type ("" for the element itself)
     */
    public String getPath() {
        return path;
    }
}
