package com.ethnicthv.lesser.core.type;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marker interface for classes that describe a flat struct layout.
 * Annotated fields are turned into an {@link ElementType} by {@link ElementTypes#layoutOf(Class)};
 * the class itself is never instantiated by the library.
 */
public interface Struct {

    /**
     * Annotation to mark a field as a struct field with layout information
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(java.lang.annotation.ElementType.FIELD)
    @interface Field {
        /**
         * Kind override (INVALID means derive from the Java type).
         * With an override the Java field type is only a placeholder.
         */
        Kind kind() default Kind.INVALID;

        /**
         * Fixed element count for array-typed fields (0 means not an array)
         */
        int length() default 0;

        /**
         * Explicit offset position in bytes (-1 means auto-layout)
         */
        int offset() default -1;

        /**
         * Alignment requirement in bytes (0 means natural alignment)
         */
        int alignment() default 0;
    }

    /**
     * Annotation to specify the overall struct layout
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(java.lang.annotation.ElementType.TYPE)
    @interface Layout {
        /**
         * Layout strategy: SEQUENTIAL (packed), PADDING (aligned) or EXPLICIT
         */
        LayoutType value() default LayoutType.PADDING;

        /**
         * Total size override (-1 means auto-calculate)
         */
        int size() default -1;
    }

    enum LayoutType {
        SEQUENTIAL,  // Pack fields sequentially
        PADDING,     // Add padding for alignment
        EXPLICIT     // Use explicit offsets
    }
}
