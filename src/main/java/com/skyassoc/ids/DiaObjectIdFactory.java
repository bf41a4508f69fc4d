package com.skyassoc.ids;

import com.skyassoc.config.ConfigurationException;

/**
 * Sequential DIA object ids scoped to one sky cell.
 *
 * Layout of a 64-bit id:
 * <pre>
 *   [ cellId : bitWidth bits ][ sequence : 64 - bitWidth bits ]
 * </pre>
 * The sequence starts at 1, so no id equals the bare cell prefix.
 *
 * Two factories hand out disjoint ids exactly when their id ranges do not
 * overlap (see {@link #rangesOverlap}). At one bit width that means distinct
 * cell ids. Across bit widths a narrow cell covers every wider cell that
 * starts with its bits, e.g. (cellId=1, bitWidth=1) and (cellId=2,
 * bitWidth=2) both issue {@code 0x8000000000000001}. Callers sharing an id
 * namespace must therefore fix one bit width for all cells, or check pairs
 * with {@link #rangesOverlap} first.
 *
 * Ids are 64-bit patterns: a cell id with its top bit set yields negative
 * {@code long} values, which {@link #cellIdOf} still decodes.
 */
public final class DiaObjectIdFactory {

    private final long cellId;
    private final int bitWidth;
    private final int sequenceBits;
    private final long maxSequence;
    private long sequence;

    public DiaObjectIdFactory(long cellId, int bitWidth) {
        if (bitWidth < 1 || bitWidth > 63) {
            throw new ConfigurationException("bitWidth must be in [1, 63], got " + bitWidth);
        }
        if (cellId < 0 || (bitWidth < 63 && cellId >= (1L << bitWidth))) {
            throw new ConfigurationException(
                "cellId " + cellId + " does not fit in " + bitWidth + " bits");
        }
        this.cellId = cellId;
        this.bitWidth = bitWidth;
        this.sequenceBits = 64 - bitWidth;
        // sequenceBits is at least 1; 64 bits of sequence is impossible here
        this.maxSequence = (1L << sequenceBits) - 1;
        this.sequence = 0;
    }

    public long next() {
        if (sequence >= maxSequence) {
            throw new IllegalStateException("Id space of cell " + cellId + " exhausted after "
                + sequence + " ids (" + sequenceBits + " sequence bits)");
        }
        sequence++;
        return (cellId << sequenceBits) | sequence;
    }

    public long cellId() {
        return cellId;
    }

    public int bitWidth() {
        return bitWidth;
    }

    /** Number of ids handed out so far. */
    public long issued() {
        return sequence;
    }

    /** True if some id could be issued both under (cellA, bitsA) and under (cellB, bitsB). */
    public static boolean rangesOverlap(long cellA, int bitsA, long cellB, int bitsB) {
        if (bitsA > bitsB) {
            return rangesOverlap(cellB, bitsB, cellA, bitsA);
        }
        return cellA == cellB >>> (bitsB - bitsA);
    }

    /** Cell prefix of an id produced by a factory with the same bit width. */
    public static long cellIdOf(long diaObjectId, int bitWidth) {
        return diaObjectId >>> (64 - bitWidth);
    }
}
