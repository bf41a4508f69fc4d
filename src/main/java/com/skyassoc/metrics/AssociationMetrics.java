package com.skyassoc.metrics;

/**
 * Counters collected while one association run is in progress.
 *
 * A run is single-threaded, so plain fields are enough; {@link #snapshot()}
 * freezes them into an {@link AssociationStats} for the result.
 */
public class AssociationMetrics {

    private long visitsProcessed;
    private long sourcesProcessed;
    private long objectsCreated;
    private long sourcesAttached;
    private long noCandidates;
    private long outOfTolerance;
    private long claimConflicts;
    private long separationsComputed;
    private long cellMigrations;

    private final long startNanos = System.nanoTime();

    public void recordVisit()                 { visitsProcessed++; }
    public void recordObjectCreated()         { objectsCreated++; sourcesProcessed++; }
    public void recordSourceAttached()        { sourcesAttached++; sourcesProcessed++; }
    public void recordNoCandidates()          { noCandidates++; }
    public void recordOutOfTolerance()        { outOfTolerance++; }
    public void recordClaimConflict()         { claimConflicts++; }
    public void recordSeparations(int count)  { separationsComputed += count; }
    public void recordCellMigration()         { cellMigrations++; }

    public AssociationStats snapshot() {
        return new AssociationStats(
            visitsProcessed,
            sourcesProcessed,
            objectsCreated,
            sourcesAttached,
            noCandidates,
            outOfTolerance,
            claimConflicts,
            separationsComputed,
            cellMigrations,
            System.nanoTime() - startNanos);
    }
}
