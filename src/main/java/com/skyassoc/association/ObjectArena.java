package com.skyassoc.association;

import com.skyassoc.geometry.SphericalMean;
import com.skyassoc.geometry.UnitVector;
import com.skyassoc.model.DiaObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Live DIA objects of one run, stored densely and addressed by a stable
 * integer index (creation order).
 *
 * Each object sits in exactly one cell bucket: the cell of its current mean.
 * Buckets hold indices, never object references.
 */
final class ObjectArena {

    private long[] ids = new long[64];
    private long[] cells = new long[64];
    private UnitVector[] means = new UnitVector[64];
    // Reported position; a founding source keeps its exact input coordinates
    private double[] ras = new double[64];
    private double[] decs = new double[64];
    private final List<SphericalMean> accumulators = new ArrayList<>();
    private final Map<Long, List<Integer>> buckets = new HashMap<>();
    private int size;

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    long idAt(int index) {
        return ids[index];
    }

    UnitVector meanAt(int index) {
        return means[index];
    }

    int countAt(int index) {
        return accumulators.get(index).count();
    }

    /** Adds a one-source object and returns its index. */
    int create(long id, double ra, double dec, UnitVector position, long cell) {
        ensureCapacity(size + 1);
        int index = size++;
        ids[index] = id;
        cells[index] = cell;
        means[index] = position;
        ras[index] = ra;
        decs[index] = dec;
        accumulators.add(new SphericalMean().add(position));
        buckets.computeIfAbsent(cell, c -> new ArrayList<>()).add(index);
        return index;
    }

    /** Folds a source position into the object's mean and returns the new mean. */
    UnitVector accumulate(int index, UnitVector position) {
        UnitVector mean = accumulators.get(index).add(position).mean();
        means[index] = mean;
        ras[index] = mean.ra();
        decs[index] = mean.dec();
        return mean;
    }

    /**
     * Re-files the object under {@code newCell}.
     *
     * @return true if the object changed cell
     */
    boolean moveTo(int index, long newCell) {
        long oldCell = cells[index];
        if (oldCell == newCell) return false;
        List<Integer> old = buckets.get(oldCell);
        old.remove(Integer.valueOf(index));
        if (old.isEmpty()) buckets.remove(oldCell);
        buckets.computeIfAbsent(newCell, c -> new ArrayList<>()).add(index);
        cells[index] = newCell;
        return true;
    }

    /** Indices of every object whose current cell is in {@code searchCells}, ascending. */
    int[] candidates(Set<Long> searchCells) {
        int n = 0;
        int[] out = new int[8];
        for (long cell : searchCells) {
            List<Integer> bucket = buckets.get(cell);
            if (bucket == null) continue;
            for (int index : bucket) {
                if (n == out.length) out = Arrays.copyOf(out, n * 2);
                out[n++] = index;
            }
        }
        int[] result = Arrays.copyOf(out, n);
        Arrays.sort(result);
        return result;
    }

    List<DiaObject> toDiaObjects() {
        var objects = new ArrayList<DiaObject>(size);
        for (int i = 0; i < size; i++) {
            objects.add(DiaObject.of(ids[i], ras[i], decs[i], countAt(i)));
        }
        return objects;
    }

    private void ensureCapacity(int required) {
        if (required <= ids.length) return;
        int capacity = Math.max(required, ids.length * 2);
        ids = Arrays.copyOf(ids, capacity);
        cells = Arrays.copyOf(cells, capacity);
        means = Arrays.copyOf(means, capacity);
        ras = Arrays.copyOf(ras, capacity);
        decs = Arrays.copyOf(decs, capacity);
    }
}
