package com.skyassoc.model;

import com.skyassoc.metrics.AssociationStats;

import java.util.List;

/**
 * Output of one association run.
 *
 * @param assocDiaSources every input source, in input row order, with its object id
 * @param diaObjects      every object created by the run, in creation order
 * @param stats           run counters
 */
public record AssociationResult(
    List<AssociatedSource> assocDiaSources,
    List<DiaObject> diaObjects,
    AssociationStats stats
) {
    public AssociationResult {
        assocDiaSources = List.copyOf(assocDiaSources);
        diaObjects = List.copyOf(diaObjects);
    }

    public static AssociationResult empty() {
        return new AssociationResult(List.of(), List.of(), AssociationStats.EMPTY);
    }
}
