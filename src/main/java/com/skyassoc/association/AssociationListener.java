package com.skyassoc.association;

import com.skyassoc.model.DiaSource;

/**
 * Observes per-source decisions of an association run, in replay order.
 */
public interface AssociationListener {

    AssociationListener NONE = new AssociationListener() {
        @Override
        public void onObjectCreated(DiaSource source, long diaObjectId, CreateReason reason) {}

        @Override
        public void onSourceAttached(DiaSource source, long diaObjectId, double separationRad) {}
    };

    /** Why a source founded a new object instead of joining one. */
    enum CreateReason {
        /** First visit of the run: nothing to match against yet. */
        FIRST_VISIT,
        /** No live object in the cells around the source. */
        NO_CANDIDATES,
        /** Nearest candidate at or beyond the tolerance. */
        OUT_OF_TOLERANCE,
        /** Nearest candidate already took a source from this visit. */
        CLAIMED
    }

    void onObjectCreated(DiaSource source, long diaObjectId, CreateReason reason);

    /**
     * @param separationRad separation between the source and the object's mean
     *                      position just before the source was added
     */
    void onSourceAttached(DiaSource source, long diaObjectId, double separationRad);
}
