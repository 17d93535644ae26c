package com.ethnicthv.lesser.core.compare;

import com.ethnicthv.lesser.core.IndexedLess;
import com.ethnicthv.lesser.core.UnsupportedTypeException;
import com.ethnicthv.lesser.core.memory.ElementHandle;
import com.ethnicthv.lesser.core.memory.StructArray;
import com.ethnicthv.lesser.core.type.ElementType;
import com.ethnicthv.lesser.core.type.ElementTypes;
import com.ethnicthv.lesser.core.type.Kind;
import com.ethnicthv.lesser.core.type.Struct;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for predicates over flat struct arrays
 */
public class StructArraySourceTest {

    static class Handles implements Struct {
        @Struct.Field(kind = Kind.UINT8)
        byte small;
        @Struct.Field(kind = Kind.UINT32)
        int medium;
        @Struct.Field(kind = Kind.UINT64)
        long large;
        @Struct.Field(kind = Kind.POINTER)
        long ptr;
    }

    static class WithSlice implements Struct {
        @Struct.Field
        int id;
        @Struct.Field(kind = Kind.SLICE)
        long items;
    }

    private static IndexedLess lessOn(String field, Kind kind, long a, long b) {
        ElementType type = ElementType.struct("one").field(field, kind).build();
        StructArray array = StructArray.allocate(type, 2);
        ElementHandle h = array.element(0);
        switch (kind.getSize()) {
            case 1 -> {
                h.setByte(field, (byte) a);
                h.at(1).setByte(field, (byte) b);
            }
            case 2 -> {
                h.setShort(field, (short) a);
                h.at(1).setShort(field, (short) b);
            }
            case 4 -> {
                h.setInt(field, (int) a);
                h.at(1).setInt(field, (int) b);
            }
            default -> {
                h.setLong(field, a);
                h.at(1).setLong(field, b);
            }
        }
        return new StructArraySource(array).build();
    }

    @Test
    @DisplayName("unsigned kinds compare as unsigned")
    void testUnsignedKinds() {
        assertTrue(lessOn("v", Kind.UINT8, 1, 0xFF).less(0, 1));
        assertTrue(lessOn("v", Kind.INT8, 0xFF, 1).less(0, 1));
        assertTrue(lessOn("v", Kind.UINT16, 1, 0xFFFF).less(0, 1));
        assertTrue(lessOn("v", Kind.INT16, 0xFFFF, 1).less(0, 1));
        assertTrue(lessOn("v", Kind.UINT32, 1, 0xFFFF_FFFFL).less(0, 1));
        assertTrue(lessOn("v", Kind.INT32, 0xFFFF_FFFFL, 1).less(0, 1));
        assertTrue(lessOn("v", Kind.UINT64, 1, -1L).less(0, 1));
        assertTrue(lessOn("v", Kind.INT64, -1L, 1).less(0, 1));
    }

    @Test
    @DisplayName("handle kinds compare their raw value unsigned")
    void testReferenceLikeKinds() {
        for (Kind k : new Kind[]{Kind.CHAN, Kind.FUNC, Kind.MAP, Kind.POINTER, Kind.UNSAFE_POINTER, Kind.UINTPTR}) {
            IndexedLess less = lessOn("h", k, 0x10, 0x8000_0000_0000_0000L);
            assertTrue(less.less(0, 1), k.name());
            assertFalse(less.less(1, 0), k.name());
        }
    }

    @Test
    void testAnnotatedLayout() {
        StructArray array = StructArray.allocate(ElementTypes.layoutOf(Handles.class), 3);
        ElementHandle h = array.element(0);
        h.setByte("small", (byte) 0x80).setInt("medium", 1);
        h.at(1).setByte("small", (byte) 0x7F).setInt("medium", -1);
        h.at(2).setByte("small", (byte) 0x7F).setInt("medium", 5);

        StructArraySource source = new StructArraySource(array);
        IndexedLess less = source.build();

        assertEquals(4, source.leafCount());
        assertTrue(less.less(1, 0), "0x7F < 0x80 unsigned");
        assertTrue(less.less(2, 1), "5 < 0xFFFFFFFF unsigned");
    }

    @Test
    void testEnumAndFloatSlots() {
        ElementType type = ElementType.struct("e")
            .field("state", Kind.ENUM)
            .field("w", Kind.FLOAT32)
            .build();
        StructArray array = StructArray.allocate(type, 2);
        array.element(0).setInt("state", 2).setFloat("w", 1f);
        array.element(1).setInt("state", 2).setFloat("w", Float.NaN);

        IndexedLess less = new StructArraySource(array).build();

        assertTrue(less.less(1, 0));
    }

    @Test
    @DisplayName("nested sequences in layouts are rejected")
    void testRejectsSlice() {
        StructArray array = StructArray.allocate(ElementTypes.layoutOf(WithSlice.class), 2);
        UnsupportedTypeException e = assertThrows(UnsupportedTypeException.class,
            () -> new StructArraySource(array).build());
        assertEquals("items", e.getPath());
    }

    @Test
    void testStructWithoutLeaves() {
        ElementType type = ElementType.struct("blank").field("_", Kind.INT64).build();
        StructArray array = StructArray.allocate(type, 2);
        assertSame(IndexedLess.EMPTY, new StructArraySource(array).build());
    }
}
