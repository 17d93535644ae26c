package com.ethnicthv.lesser.core.memory;

import com.ethnicthv.lesser.core.type.ElementType;
import com.ethnicthv.lesser.core.type.Kind;

import java.nio.ByteBuffer;

/**
 * Reusable handle to read and write one element of a {@link StructArray}.
 * Values are addressed by path ("a", "pos.x", "vals[2]"); the path's kind must match the accessor width.
 * The handle can be rebound to another index with {@link #at(int)} so a single instance can fill a whole array.
 */
public class ElementHandle {
    private final StructArray array;
    private int index;

    ElementHandle(StructArray array, int index) {
        this.array = array;
        this.index = index;
    }

    /**
     * Rebind this handle to element {@code index} of the same array
     */
    public ElementHandle at(int index) {
        this.index = index;
        return this;
    }

    public int index() {
        return index;
    }

    private int resolve(String path, int width, boolean floating) {
        ElementType.Location loc = array.getType().locate(path);
        Kind k = loc.type().getKind();
        boolean ok = floating ? k.isFloat() : (!k.isFloat() && !k.isComplex() && !k.isComposite() && k != Kind.STRING);
        if (!ok || k.getSize() != width) {
            throw new IllegalArgumentException("Path " + path + " is " + k + ", not a " + width + "-byte "
                + (floating ? "float" : "integer") + " slot");
        }
        return array.base(index) + (int) loc.offset();
    }

    private int resolveKind(String path, Kind expected) {
        ElementType.Location loc = array.getType().locate(path);
        if (loc.type().getKind() != expected) {
            throw new IllegalArgumentException("Path " + path + " is " + loc.type().getKind() + ", not " + expected);
        }
        return array.base(index) + (int) loc.offset();
    }

    private ByteBuffer buf() {
        return array.buffer();
    }

    // ------------- Getters -------------
    public boolean getBoolean(String path) {
        return buf().get(resolveKind(path, Kind.BOOL)) != 0;
    }

    public byte getByte(String path) {
        return buf().get(resolve(path, 1, false));
    }

    public short getShort(String path) {
        return buf().getShort(resolve(path, 2, false));
    }

    public char getChar(String path) {
        return buf().getChar(resolve(path, 2, false));
    }

    public int getInt(String path) {
        return buf().getInt(resolve(path, 4, false));
    }

    public long getLong(String path) {
        return buf().getLong(resolve(path, 8, false));
    }

    public float getFloat(String path) {
        return buf().getFloat(resolve(path, 4, true));
    }

    public double getDouble(String path) {
        return buf().getDouble(resolve(path, 8, true));
    }

    public String getString(String path) {
        return array.stringAt(buf().getInt(resolveKind(path, Kind.STRING)));
    }

    /**
     * Real part of a COMPLEX64 or COMPLEX128 slot
     */
    public double getReal(String path) {
        return complexPart(path, false);
    }

    public double getImag(String path) {
        return complexPart(path, true);
    }

    private double complexPart(String path, boolean imag) {
        ElementType.Location loc = array.getType().locate(path);
        int at = array.base(index) + (int) loc.offset();
        return switch (loc.type().getKind()) {
            case COMPLEX64 -> buf().getFloat(at + (imag ? 4 : 0));
            case COMPLEX128 -> buf().getDouble(at + (imag ? 8 : 0));
            default -> throw new IllegalArgumentException("Path " + path + " is not a complex slot");
        };
    }

    // ------------- Setters -------------
    public ElementHandle setBoolean(String path, boolean value) {
        buf().put(resolveKind(path, Kind.BOOL), (byte) (value ? 1 : 0));
        return this;
    }

    public ElementHandle setByte(String path, byte value) {
        buf().put(resolve(path, 1, false), value);
        return this;
    }

    public ElementHandle setShort(String path, short value) {
        buf().putShort(resolve(path, 2, false), value);
        return this;
    }

    public ElementHandle setChar(String path, char value) {
        buf().putChar(resolve(path, 2, false), value);
        return this;
    }

    public ElementHandle setInt(String path, int value) {
        buf().putInt(resolve(path, 4, false), value);
        return this;
    }

    public ElementHandle setLong(String path, long value) {
        buf().putLong(resolve(path, 8, false), value);
        return this;
    }

    public ElementHandle setFloat(String path, float value) {
        buf().putFloat(resolve(path, 4, true), value);
        return this;
    }

    public ElementHandle setDouble(String path, double value) {
        buf().putDouble(resolve(path, 8, true), value);
        return this;
    }

    public ElementHandle setString(String path, String value) {
        buf().putInt(resolveKind(path, Kind.STRING), array.intern(value));
        return this;
    }

    public ElementHandle setComplex(String path, double real, double imag) {
        ElementType.Location loc = array.getType().locate(path);
        int at = array.base(index) + (int) loc.offset();
        switch (loc.type().getKind()) {
            case COMPLEX64 -> {
                buf().putFloat(at, (float) real);
                buf().putFloat(at + 4, (float) imag);
            }
            case COMPLEX128 -> {
                buf().putDouble(at, real);
                buf().putDouble(at + 8, imag);
            }
            default -> throw new IllegalArgumentException("Path " + path + " is not a complex slot");
        }
        return this;
    }
}
