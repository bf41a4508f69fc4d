package com.skyassoc.model;

/**
 * A source row after association: the input row plus the id of the object
 * it was attached to or founded.
 */
public record AssociatedSource(DiaSource source, long diaObjectId) {

    public AssociatedSource {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
    }

    public long diaSourceId() {
        return source.diaSourceId();
    }

    public long visitId() {
        return source.visitId();
    }

    public double ra() {
        return source.ra();
    }

    public double dec() {
        return source.dec();
    }
}
