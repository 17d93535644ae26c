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
import com.ethnicthv.lesser.core.type.FieldDescriptor;
import com.ethnicthv.lesser.core.type.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * LessBuilder - compiles the element type of one collection into a single {@link IndexedLess}.
 * <p>
 * The element type is walked once, depth first. Arrays and structs are unfolded from their last
 * member to their first, each member's comparator receiving the previously built one as its
 * "on equal" continuation, so at runtime index 0 / the first declared field decides first.
 * Subclasses supply the typed leaf accessors for their storage.
 */
public abstract class LessBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(LessBuilder.class);

    private static final ElementType F32 = ElementType.of(Kind.FLOAT32);
    private static final ElementType F64 = ElementType.of(Kind.FLOAT64);

    private int leaves;

    /**
     * Number of elements in the collection
     */
    protected abstract int length();

    protected abstract ElementType elementType();

    protected abstract BooleanAccessor booleans(LeafPath path);

    /**
     * INT8/INT16/INT32 sign-extended, UINT8/UINT16 zero-extended, UINT32 raw bits, ENUM ordinal.
     */
    protected abstract IntAccessor ints(LeafPath path);

    /**
     * INT64, UINT64 and reference-like kinds.
     */
    protected abstract LongAccessor longs(LeafPath path);

    protected abstract FloatAccessor floats(LeafPath path);

    protected abstract DoubleAccessor doubles(LeafPath path);

    protected abstract ObjectAccessor<String> strings(LeafPath path);

    /**
     * True when every element is known to tie with every other before any type is inspected,
     * e.g. a list holding only nulls.
     */
    protected boolean allTied() {
        return false;
    }

    /**
     * Hook run around every resolved node. Storage with nullable references wraps the node so
     * that missing values are ordered before it; flat storage returns {@code resolved} unchanged.
     */
    protected IndexedLess guard(LeafPath path, IndexedLess resolved, IndexedLess next) {
        return resolved;
    }

    /**
     * Build the predicate. Empty collections, and collections whose elements all tie, get
     * {@link IndexedLess#EMPTY} without their element type being inspected.
     *
     * @throws UnsupportedTypeException if any reachable leaf cannot be ordered
     */
    public final IndexedLess build() {
        if (length() == 0 || allTied()) {
            return IndexedLess.EMPTY;
        }
        ElementType type = elementType();
        leaves = 0;
        IndexedLess less = resolve(LeafPath.root(type), null);
        LOG.debug("Compiled less predicate for {} with {} leaves", type, leaves);
        return less != null ? less : IndexedLess.EMPTY;
    }

    /**
     * Number of leaf comparators created by the last {@link #build()}.
     */
    public int leafCount() {
        return leaves;
    }

    final IndexedLess resolve(LeafPath path, IndexedLess next) {
        ElementType t = path.getType();
        IndexedLess less = switch (t.getKind()) {
            case BOOL -> leaf(LeafComparators.ofBoolean(booleans(path), next));
            case INT8, INT16, INT32, UINT8, UINT16, ENUM -> leaf(LeafComparators.ofInt(ints(path), next));
            case UINT32 -> leaf(LeafComparators.ofUnsignedInt(ints(path), next));
            case INT64 -> leaf(LeafComparators.ofLong(longs(path), next));
            case UINT64, CHAN, FUNC, MAP, POINTER, UNSAFE_POINTER, UINTPTR ->
                leaf(LeafComparators.ofUnsignedLong(longs(path), next));
            case FLOAT32 -> leaf(LeafComparators.ofFloat(floats(path), next));
            case FLOAT64 -> leaf(LeafComparators.ofDouble(doubles(path), next));
            case COMPLEX64 -> {
                IndexedLess imag = leaf(LeafComparators.ofFloat(floats(path.part(F32, 4, "imag")), next));
                yield leaf(LeafComparators.ofFloat(floats(path.part(F32, 0, "real")), imag));
            }
            case COMPLEX128 -> {
                IndexedLess imag = leaf(LeafComparators.ofDouble(doubles(path.part(F64, 8, "imag")), next));
                yield leaf(LeafComparators.ofDouble(doubles(path.part(F64, 0, "real")), imag));
            }
            case STRING -> leaf(LeafComparators.ofString(strings(path), next));
            case ARRAY -> {
                IndexedLess ret = next;
                for (int k = t.getLength() - 1; k >= 0; k--) {
                    ret = resolve(path.element(k), ret);
                }
                yield ret;
            }
            case STRUCT -> {
                // walk fields from the back, building the tie-breaker chain in reverse
                IndexedLess ret = next;
                List<FieldDescriptor> fields = t.getFields();
                for (int k = fields.size() - 1; k >= 0; k--) {
                    FieldDescriptor f = fields.get(k);
                    if (f.isDiscard()) {
                        continue;
                    }
                    ret = resolve(path.field(f), ret);
                }
                yield ret;
            }
            case SLICE -> throw new UnsupportedTypeException(t.getName(), path.toString(),
                "nested sequences cannot be ordered");
            case INTERFACE -> throw new UnsupportedTypeException(t.getName(), path.toString(),
                "open values cannot be ordered");
            case INVALID -> throw new UnsupportedTypeException(t.getName(), path.toString(), "invalid kind");
        };
        return guard(path, less, next);
    }

    private IndexedLess leaf(IndexedLess less) {
        leaves++;
        return less;
    }
}
