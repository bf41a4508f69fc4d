package com.skyassoc.index;

import com.skyassoc.geometry.Angles;
import com.skyassoc.geometry.GeometryException;
import com.skyassoc.geometry.UnitVector;
import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;
import com.uber.h3core.util.LatLng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps sky coordinates onto H3 cells at a fixed resolution.
 *
 * The celestial sphere is treated as the H3 globe: declination is
 * latitude and right ascension, wrapped to [-180, 180), is longitude.
 * H3 works on the sphere natively, so angular distances carry over
 * without any Earth-radius scaling.
 *
 * Thread safety: H3Core is thread-safe after initialization and the index
 * holds no other mutable state.
 */
public final class SkyCellIndex {

    private static final Logger log = LoggerFactory.getLogger(SkyCellIndex.class);

    // Hard stop for ring growth; only reachable with a radius far larger
    // than the cells (a misconfigured resolution).
    private static final int MAX_RINGS = 512;

    // H3 hexagons are irregular and vary in size across the grid; the
    // average edge is scaled up to bound every cell at the resolution.
    private static final double EDGE_TO_CIRCUMRADIUS_BOUND = 2.0;
    private static final double PENTAGON_MARGIN = 1.25;

    private final H3Core h3;
    private final int resolution;
    private final double maxCircumradius;

    public SkyCellIndex(int resolution) {
        this.resolution = resolution;
        try {
            this.h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new GeometryException("Failed to load H3 native library: " + e.getMessage(), e);
        }
        this.maxCircumradius = boundCircumradius();
        log.info("SkyCellIndex initialized at H3 resolution {} (max cell circumradius {}\")",
            resolution, Angles.radiansToArcsec(maxCircumradius));
    }

    public int resolution() {
        return resolution;
    }

    /** Upper bound on {@link #circumradius(long)} for any cell at this resolution, in radians. */
    public double maxCircumradius() {
        return maxCircumradius;
    }

    /** Cell containing the given coordinate. */
    public long cellOf(double raDeg, double decDeg) {
        requireValid(raDeg, decDeg);
        return h3.latLngToCell(decDeg, Angles.raToLongitude(raDeg), resolution);
    }

    /**
     * Every cell whose area may intersect the disc of {@code radiusRad}
     * around the coordinate.
     *
     * Rings are walked outwards from the centre cell. A cell is kept when its
     * centre lies within {@code radius + maxCircumradius()} of the query
     * point, which no intersecting cell can fail. Only cell centres are
     * looked up per ring; no boundaries are computed. Walking stops after the
     * first ring that contributes nothing; if the ring budget runs out first,
     * the budget doubles and the walk restarts.
     */
    public Set<Long> cellsWithin(double raDeg, double decDeg, double radiusRad) {
        if (!(radiusRad >= 0.0)) {
            throw new GeometryException("Search radius must be non-negative, got " + radiusRad);
        }
        UnitVector centre = UnitVector.fromRaDec(raDeg, decDeg);
        long origin = cellOf(raDeg, decDeg);
        double reach = radiusRad + maxCircumradius;

        int k = initialRingCount(reach);
        while (true) {
            List<List<Long>> rings = h3.gridDiskDistances(origin, k);
            var cells = new HashSet<Long>();
            boolean closed = false;
            for (List<Long> ring : rings) {
                int before = cells.size();
                for (long cell : ring) {
                    if (cellCentre(cell).angleTo(centre) <= reach) {
                        cells.add(cell);
                    }
                }
                if (cells.size() == before) {
                    closed = true;
                    break;
                }
            }
            if (closed) {
                log.debug("cellsWithin radius={}\" -> {} cells (k={})",
                    Angles.radiansToArcsec(radiusRad), cells.size(), k);
                return cells;
            }
            if (k >= MAX_RINGS) {
                throw new GeometryException("Search radius " + Angles.radiansToArcsec(radiusRad)
                    + "\" needs more than " + MAX_RINGS + " rings at resolution " + resolution);
            }
            k = Math.min(MAX_RINGS, k * 2);
        }
    }

    /** Centre of the cell as a unit vector. */
    public UnitVector cellCentre(long cell) {
        LatLng c = h3.cellToLatLng(cell);
        return UnitVector.fromRaDec(c.lng, c.lat);
    }

    /** Largest angular distance from the cell centre to one of its vertices. */
    public double circumradius(long cell) {
        UnitVector c = cellCentre(cell);
        double max = 0.0;
        for (LatLng v : h3.cellToBoundary(cell)) {
            max = Math.max(max, c.angleTo(UnitVector.fromRaDec(v.lng, v.lat)));
        }
        return max;
    }

    // Pentagon neighbourhoods carry the strongest distortion of the grid.
    private double boundCircumradius() {
        double bound = EDGE_TO_CIRCUMRADIUS_BOUND * h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.rads);
        for (long pentagon : h3.getPentagons(resolution)) {
            for (long cell : h3.gridDisk(pentagon, 1)) {
                bound = Math.max(bound, PENTAGON_MARGIN * circumradius(cell));
            }
        }
        return bound;
    }

    // Neighbouring centres sit at least 1.5 circumradii apart, so this many
    // rings reach past the disc; the walk grows it if distortion says otherwise.
    private int initialRingCount(double reach) {
        return Math.max(1, (int) Math.ceil(reach / (1.5 * maxCircumradius / EDGE_TO_CIRCUMRADIUS_BOUND)) + 1);
    }

    private static void requireValid(double raDeg, double decDeg) {
        // Same rules as UnitVector: fail before H3 silently clamps garbage.
        UnitVector.fromRaDec(raDeg, decDeg);
    }
}
