package com.skyassoc.association;

import com.skyassoc.association.AssociationListener.CreateReason;
import com.skyassoc.config.AssociationConfig;
import com.skyassoc.config.WithinVisitOrder;
import com.skyassoc.geometry.Angles;
import com.skyassoc.geometry.UnitVector;
import com.skyassoc.ids.DiaObjectIdFactory;
import com.skyassoc.index.SkyCellIndex;
import com.skyassoc.metrics.AssociationMetrics;
import com.skyassoc.metrics.AssociationStats;
import com.skyassoc.model.AssociatedSource;
import com.skyassoc.model.AssociationResult;
import com.skyassoc.model.DiaSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Greedy nearest-neighbour association of DIA sources into DIA objects.
 *
 * Visits are replayed in ascending visit id. Every source of the first visit
 * founds an object. Each later source is matched against the live objects
 * filed under the H3 cells within twice the tolerance; the nearest one wins
 * if it is strictly closer than the tolerance and has not already taken a
 * source from the same visit. Otherwise the source founds a new object.
 * A claimed nearest object does not fall back to the second nearest.
 *
 * One instance holds only configuration and the cell index and can serve any
 * number of sequential runs. A run itself is single-threaded; runs over
 * disjoint sky cells may use separate instances in parallel.
 */
public class SimpleAssociation {

    private static final Logger log = LoggerFactory.getLogger(SimpleAssociation.class);

    // The cell filter is only a proxy; a wider search keeps objects whose
    // mean drifted or whose cell straddles the disc edge.
    static final double SEARCH_RADIUS_FACTOR = 2.0;
    private static final int WIDE_SEARCH_CELLS = 32;

    private final AssociationConfig config;
    private final SkyCellIndex index;
    private final double toleranceRad;

    public SimpleAssociation(AssociationConfig config) {
        this(config, new SkyCellIndex(config.resolution()));
    }

    public SimpleAssociation(AssociationConfig config, SkyCellIndex index) {
        if (index.resolution() != config.resolution()) {
            throw new IllegalArgumentException("Index resolution " + index.resolution()
                + " does not match configured resolution " + config.resolution());
        }
        this.config = config;
        this.index = index;
        this.toleranceRad = config.toleranceRadians();
        double searchRadius = SEARCH_RADIUS_FACTOR * toleranceRad;
        if (searchRadius > WIDE_SEARCH_CELLS * index.maxCircumradius()) {
            log.warn("Search radius {}\" spans more than {} cells at H3 resolution {}; "
                    + "a coarser resolution keeps candidate lookup cheap",
                Angles.radiansToArcsec(searchRadius), WIDE_SEARCH_CELLS, index.resolution());
        }
    }

    public AssociationConfig config() {
        return config;
    }

    public AssociationResult associate(List<DiaSource> diaSources, long cellId, int bitWidth) {
        return associate(diaSources, cellId, bitWidth, AssociationListener.NONE);
    }

    /**
     * Associates the sources into objects.
     *
     * @param diaSources sources with unique (visitId, diaSourceId) keys
     * @param cellId     sky cell the produced objects are filed under; seeds the ids
     * @param bitWidth   number of id bits reserved for {@code cellId}
     * @param listener   receives one callback per source, in replay order
     * @return the sources, in input order, with object ids, and the new objects
     * @throws com.skyassoc.config.ConfigurationException if cellId/bitWidth cannot seed ids
     * @throws IllegalArgumentException                   on a duplicate source key
     * @throws com.skyassoc.geometry.GeometryException    on an invalid coordinate
     */
    public AssociationResult associate(List<DiaSource> diaSources, long cellId, int bitWidth,
                                       AssociationListener listener) {
        var idFactory = new DiaObjectIdFactory(cellId, bitWidth);
        requireUniqueKeys(diaSources);
        if (diaSources.isEmpty()) {
            log.info("No DiaSources to associate for cell {}", cellId);
            return AssociationResult.empty();
        }

        var metrics = new AssociationMetrics();
        var arena = new ObjectArena();
        long[] objectIdOf = new long[diaSources.size()];

        for (Map.Entry<Long, List<Integer>> visit : groupByVisit(diaSources).entrySet()) {
            metrics.recordVisit();
            List<Integer> rows = visit.getValue();

            if (arena.isEmpty()) {
                for (int row : rows) {
                    DiaSource src = diaSources.get(row);
                    objectIdOf[row] = arena.idAt(createObject(src, arena, idFactory, metrics));
                    listener.onObjectCreated(src, objectIdOf[row], CreateReason.FIRST_VISIT);
                }
                log.debug("Visit {}: founded {} DiaObjects", visit.getKey(), rows.size());
                continue;
            }

            Set<Integer> claimed = new HashSet<>();
            for (int row : rows) {
                objectIdOf[row] = matchOrCreate(diaSources.get(row), arena, claimed, idFactory, metrics, listener);
            }
            log.debug("Visit {}: {} sources, {} claimed, {} live DiaObjects",
                visit.getKey(), rows.size(), claimed.size(), arena.size());
        }

        var associated = new ArrayList<AssociatedSource>(diaSources.size());
        for (int row = 0; row < diaSources.size(); row++) {
            associated.add(new AssociatedSource(diaSources.get(row), objectIdOf[row]));
        }
        AssociationStats stats = metrics.snapshot();
        log.info("Associated {} DiaSources over {} visits into {} DiaObjects for cell {} "
                + "(attached={}, claimConflicts={}, outOfTolerance={}, noCandidates={}) in {} ms",
            stats.sourcesProcessed(), stats.visitsProcessed(), stats.objectsCreated(), cellId,
            stats.sourcesAttached(), stats.claimConflicts(), stats.outOfTolerance(),
            stats.noCandidates(), stats.elapsedNanos() / 1_000_000);

        return new AssociationResult(associated, arena.toDiaObjects(), stats);
    }

    private long matchOrCreate(DiaSource src, ObjectArena arena, Set<Integer> claimed,
                               DiaObjectIdFactory idFactory, AssociationMetrics metrics,
                               AssociationListener listener) {
        UnitVector position = UnitVector.fromRaDec(src.ra(), src.dec());
        Set<Long> searchCells = index.cellsWithin(src.ra(), src.dec(), SEARCH_RADIUS_FACTOR * toleranceRad);
        int[] candidates = arena.candidates(searchCells);

        if (candidates.length == 0) {
            metrics.recordNoCandidates();
            return created(src, arena, claimed, idFactory, metrics, listener, CreateReason.NO_CANDIDATES);
        }

        // candidates are ascending, so the strict < keeps the oldest object on ties
        int nearest = -1;
        double minSeparation = Double.POSITIVE_INFINITY;
        for (int candidate : candidates) {
            double separation = position.angleTo(arena.meanAt(candidate));
            if (separation < minSeparation) {
                minSeparation = separation;
                nearest = candidate;
            }
        }
        metrics.recordSeparations(candidates.length);

        if (!(minSeparation < toleranceRad)) {
            metrics.recordOutOfTolerance();
            return created(src, arena, claimed, idFactory, metrics, listener, CreateReason.OUT_OF_TOLERANCE);
        }
        if (claimed.contains(nearest)) {
            metrics.recordClaimConflict();
            log.debug("DiaObject {} already claimed this visit; DiaSource {} founds a new object",
                arena.idAt(nearest), src.diaSourceId());
            return created(src, arena, claimed, idFactory, metrics, listener, CreateReason.CLAIMED);
        }

        attach(nearest, position, arena, metrics);
        claimed.add(nearest);
        long diaObjectId = arena.idAt(nearest);
        listener.onSourceAttached(src, diaObjectId, minSeparation);
        return diaObjectId;
    }

    // The new object already holds a source from this visit, so it is claimed too.
    private long created(DiaSource src, ObjectArena arena, Set<Integer> claimed, DiaObjectIdFactory idFactory,
                         AssociationMetrics metrics, AssociationListener listener, CreateReason reason) {
        int objectIndex = createObject(src, arena, idFactory, metrics);
        claimed.add(objectIndex);
        long diaObjectId = arena.idAt(objectIndex);
        listener.onObjectCreated(src, diaObjectId, reason);
        return diaObjectId;
    }

    /** Founds a one-source object and returns its arena index. */
    private int createObject(DiaSource src, ObjectArena arena, DiaObjectIdFactory idFactory,
                             AssociationMetrics metrics) {
        UnitVector position = UnitVector.fromRaDec(src.ra(), src.dec());
        long cell = index.cellOf(src.ra(), src.dec());
        int objectIndex = arena.create(idFactory.next(), src.ra(), src.dec(), position, cell);
        metrics.recordObjectCreated();
        return objectIndex;
    }

    private void attach(int objectIndex, UnitVector position, ObjectArena arena, AssociationMetrics metrics) {
        UnitVector mean = arena.accumulate(objectIndex, position);
        if (arena.moveTo(objectIndex, index.cellOf(mean.ra(), mean.dec()))) {
            metrics.recordCellMigration();
        }
        metrics.recordSourceAttached();
    }

    /** Visit id to row indices; visits ascending, rows in the configured order. */
    private Map<Long, List<Integer>> groupByVisit(List<DiaSource> diaSources) {
        var visits = new TreeMap<Long, List<Integer>>();
        for (int row = 0; row < diaSources.size(); row++) {
            visits.computeIfAbsent(diaSources.get(row).visitId(), v -> new ArrayList<>()).add(row);
        }
        if (config.withinVisitOrder() == WithinVisitOrder.SOURCE_ID) {
            Comparator<Integer> bySourceId = Comparator.comparingLong(row -> diaSources.get(row).diaSourceId());
            visits.values().forEach(rows -> rows.sort(bySourceId));
        }
        return visits;
    }

    private static void requireUniqueKeys(List<DiaSource> diaSources) {
        var seen = new HashSet<DiaSource.Key>(diaSources.size() * 2);
        for (DiaSource src : diaSources) {
            if (!seen.add(src.key())) {
                throw new IllegalArgumentException("Duplicate DiaSource key " + src.key());
            }
        }
    }

    @Override
    public String toString() {
        return "SimpleAssociation{tolerance=" + config.toleranceArcsec() + "\", resolution="
            + index.resolution() + ", search radius=" + Angles.radiansToArcsec(SEARCH_RADIUS_FACTOR * toleranceRad)
            + "\"}";
    }
}
