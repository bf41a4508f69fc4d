package com.skyassoc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One detection on a difference image. Read-only to the association engine.
 *
 * @param diaSourceId unique within its visit
 * @param visitId     exposure the source was detected on (ccdVisitId)
 * @param ra          right ascension, degrees
 * @param dec         declination, degrees
 * @param columns     any further measurement columns, carried through untouched
 */
public record DiaSource(
    long diaSourceId,
    long visitId,
    double ra,
    double dec,
    Map<String, Object> columns
) {
    public DiaSource {
        // LinkedHashMap keeps column order and, unlike Map.copyOf, tolerates null cells
        columns = columns == null || columns.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public static DiaSource of(long diaSourceId, long visitId, double ra, double dec) {
        return new DiaSource(diaSourceId, visitId, ra, dec, Map.of());
    }

    /** Composite key; unique across an input table. */
    public Key key() {
        return new Key(visitId, diaSourceId);
    }

    public record Key(long visitId, long diaSourceId) {
        @Override
        public String toString() {
            return "(visit=" + visitId + ", diaSourceId=" + diaSourceId + ")";
        }
    }
}
