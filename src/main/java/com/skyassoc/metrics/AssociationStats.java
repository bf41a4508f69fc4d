package com.skyassoc.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable counters of one association run.
 *
 * {@code sourcesProcessed == objectsCreated + sourcesAttached} always holds,
 * and every created object past the first visit is explained by exactly one
 * of {@code noCandidates}, {@code outOfTolerance} or {@code claimConflicts}.
 */
public record AssociationStats(
    @JsonProperty("visits_processed")      long visitsProcessed,
    @JsonProperty("sources_processed")     long sourcesProcessed,
    @JsonProperty("objects_created")       long objectsCreated,
    @JsonProperty("sources_attached")      long sourcesAttached,
    @JsonProperty("no_candidates")         long noCandidates,
    @JsonProperty("out_of_tolerance")      long outOfTolerance,
    @JsonProperty("claim_conflicts")       long claimConflicts,
    @JsonProperty("separations_computed")  long separationsComputed,
    @JsonProperty("cell_migrations")       long cellMigrations,
    @JsonProperty("elapsed_nanos")         long elapsedNanos
) {
    public static final AssociationStats EMPTY = new AssociationStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    /** Mean number of exact separations per source that went through the index. */
    public double meanCandidatesPerQuery() {
        long queried = sourcesProcessed - foundingSources();
        return queried == 0 ? 0.0 : (double) separationsComputed / queried;
    }

    private long foundingSources() {
        return objectsCreated - noCandidates - outOfTolerance - claimConflicts;
    }
}
