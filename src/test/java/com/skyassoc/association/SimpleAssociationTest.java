package com.skyassoc.association;

import com.skyassoc.association.AssociationListener.CreateReason;
import com.skyassoc.config.AssociationConfig;
import com.skyassoc.config.ConfigurationException;
import com.skyassoc.config.WithinVisitOrder;
import com.skyassoc.geometry.Angles;
import com.skyassoc.geometry.GeometryException;
import com.skyassoc.geometry.UnitVector;
import com.skyassoc.index.SkyCellIndex;
import com.skyassoc.model.AssociatedSource;
import com.skyassoc.model.AssociationResult;
import com.skyassoc.model.Band;
import com.skyassoc.model.DiaObject;
import com.skyassoc.model.DiaSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimpleAssociationTest {

    private static final long CELL = 1234;
    private static final int BITS = 20;
    private static final double ARCSEC = 1.0 / 3600.0;

    private static SkyCellIndex index;
    private static SimpleAssociation association;

    @BeforeAll
    static void setUp() {
        index = new SkyCellIndex(AssociationConfig.DEFAULT_RESOLUTION);
        association = new SimpleAssociation(AssociationConfig.defaults(), index);
    }

    private static long id(long seq) {
        return (CELL << (64 - BITS)) | seq;
    }

    @Test
    void singleVisit_farApartSources_becomeSeparateObjects() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(2, 100, 10.0, 20.0 + 5 * ARCSEC),
            DiaSource.of(3, 100, 10.0 + 5 * ARCSEC, 20.0));

        var result = association.associate(sources, CELL, BITS);

        assertEquals(3, result.diaObjects().size());
        result.diaObjects().forEach(o -> assertEquals(1, o.nDiaSources()));
        assertEquals(List.of(id(1), id(2), id(3)),
            result.assocDiaSources().stream().map(AssociatedSource::diaObjectId).toList());
    }

    @Test
    void firstVisit_neverMatches_evenWithinTolerance() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(2, 100, 10.0, 20.0 + 0.1 * ARCSEC));

        var result = association.associate(sources, CELL, BITS);

        assertEquals(2, result.diaObjects().size());
    }

    @Test
    void twoVisits_closeSources_mergeIntoOneObject() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(1, 101, 10.00005, 20.00005));

        var result = association.associate(sources, CELL, BITS);

        assertEquals(1, result.diaObjects().size());
        DiaObject obj = result.diaObjects().get(0);
        assertEquals(id(1), obj.diaObjectId());
        assertEquals(2, obj.nDiaSources());
        assertTrue(obj.ra() > 10.0 && obj.ra() < 10.00005, "ra=" + obj.ra());
        assertTrue(obj.dec() > 20.0 && obj.dec() < 20.00005, "dec=" + obj.dec());
        result.assocDiaSources().forEach(s -> assertEquals(id(1), s.diaObjectId()));
    }

    @Test
    void claimedObject_sendsSecondSourceOfTheVisitToANewObject() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(1, 101, 10.0, 20.0 + 0.1 * ARCSEC),
            DiaSource.of(2, 101, 10.0, 20.0 - 0.1 * ARCSEC));
        var reasons = new ArrayList<CreateReason>();

        var result = association.associate(sources, CELL, BITS, recordingReasons(reasons));

        assertEquals(2, result.diaObjects().size());
        assertEquals(id(1), result.assocDiaSources().get(1).diaObjectId());
        assertEquals(id(2), result.assocDiaSources().get(2).diaObjectId());
        assertEquals(2, result.diaObjects().get(0).nDiaSources());
        assertEquals(1, result.diaObjects().get(1).nDiaSources());
        assertEquals(List.of(CreateReason.FIRST_VISIT, CreateReason.CLAIMED), reasons);
        assertEquals(1, result.stats().claimConflicts());
    }

    @Test
    void claimedNearest_doesNotFallBackToSecondNearest() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(2, 100, 10.0, 20.0 + 0.6 * ARCSEC),
            DiaSource.of(1, 101, 10.0, 20.0 + 0.1 * ARCSEC),
            DiaSource.of(2, 101, 10.0, 20.0 + 0.2 * ARCSEC));

        var result = association.associate(sources, CELL, BITS);

        // source 2 of visit 101 is within tolerance of both objects; the nearer one is taken
        assertEquals(3, result.diaObjects().size());
        assertEquals(id(1), result.assocDiaSources().get(2).diaObjectId());
        assertEquals(id(3), result.assocDiaSources().get(3).diaObjectId());
        assertEquals(1, result.diaObjects().get(1).nDiaSources());
    }

    @Test
    void claimSet_resetsAtEveryVisit() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(1, 101, 10.0, 20.0 + 0.1 * ARCSEC),
            DiaSource.of(1, 102, 10.0, 20.0 - 0.1 * ARCSEC),
            DiaSource.of(1, 103, 10.0, 20.0));

        var result = association.associate(sources, CELL, BITS);

        assertEquals(1, result.diaObjects().size());
        assertEquals(4, result.diaObjects().get(0).nDiaSources());
    }

    @Test
    void separationEqualToTolerance_doesNotMatch() {
        var first = DiaSource.of(1, 100, 10.0, 20.0);
        var second = DiaSource.of(1, 101, 10.0, 20.0 + 0.5 * ARCSEC);
        double separation = UnitVector.fromRaDec(first.ra(), first.dec())
            .angleTo(UnitVector.fromRaDec(second.ra(), second.dec()));

        // largest tolerance whose radian value does not exceed the separation
        double tolerance = Angles.radiansToArcsec(separation);
        while (Angles.arcsecToRadians(tolerance) > separation) tolerance = Math.nextDown(tolerance);
        while (Angles.arcsecToRadians(Math.nextUp(tolerance)) <= separation) tolerance = Math.nextUp(tolerance);
        assertEquals(0.5, tolerance, 1e-9);

        var atBoundary = new SimpleAssociation(AssociationConfig.defaults().withToleranceArcsec(tolerance), index);
        assertEquals(2, atBoundary.associate(List.of(first, second), CELL, BITS).diaObjects().size());

        var justAbove = new SimpleAssociation(
            AssociationConfig.defaults().withToleranceArcsec(tolerance * (1 + 1e-9)), index);
        assertEquals(1, justAbove.associate(List.of(first, second), CELL, BITS).diaObjects().size());
    }

    @Test
    void emptyInput_givesEmptyOutputs() {
        var result = association.associate(List.of(), CELL, BITS);

        assertTrue(result.assocDiaSources().isEmpty());
        assertTrue(result.diaObjects().isEmpty());
        assertEquals(0, result.stats().sourcesProcessed());
    }

    @Test
    void differentCells_produceDisjointIds() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(2, 100, 10.0, 21.0),
            DiaSource.of(1, 101, 10.0, 22.0));

        var a = association.associate(sources, 7, 16);
        var b = association.associate(sources, 8, 16);

        Set<Long> ids = new HashSet<>();
        a.diaObjects().forEach(o -> assertTrue(ids.add(o.diaObjectId())));
        b.diaObjects().forEach(o -> assertTrue(ids.add(o.diaObjectId()), "collision on " + o.diaObjectId()));
    }

    @Test
    void visits_areReplayedInAscendingOrder() {
        // rows of the later visit come first in the table
        var sources = List.of(
            DiaSource.of(1, 200, 10.0, 20.0 + 0.1 * ARCSEC),
            DiaSource.of(2, 200, 10.0, 20.0 - 0.1 * ARCSEC),
            DiaSource.of(1, 100, 10.0, 20.0));

        var result = association.associate(sources, CELL, BITS);

        assertEquals(id(1), result.assocDiaSources().get(2).diaObjectId(), "visit 100 founds the first object");
        assertEquals(id(1), result.assocDiaSources().get(0).diaObjectId());
        assertEquals(id(2), result.assocDiaSources().get(1).diaObjectId());
        // output keeps input row order
        assertEquals(200, result.assocDiaSources().get(0).visitId());
    }

    @Test
    void sourceIdOrder_overridesRowOrderWithinAVisit() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(9, 101, 10.0, 20.0 + 0.1 * ARCSEC),
            DiaSource.of(3, 101, 10.0, 20.0 - 0.1 * ARCSEC));

        AssociationResult byRow = association.associate(sources, CELL, BITS);
        AssociationResult bySourceId = new SimpleAssociation(
            AssociationConfig.defaults().withWithinVisitOrder(WithinVisitOrder.SOURCE_ID), index)
            .associate(sources, CELL, BITS);

        assertEquals(id(1), byRow.assocDiaSources().get(1).diaObjectId());
        assertEquals(id(2), byRow.assocDiaSources().get(2).diaObjectId());
        assertEquals(id(2), bySourceId.assocDiaSources().get(1).diaObjectId());
        assertEquals(id(1), bySourceId.assocDiaSources().get(2).diaObjectId());
    }

    @Test
    void sourcesAcrossRaZero_associate() {
        var sources = List.of(
            DiaSource.of(1, 100, 359.99995, 0.0),
            DiaSource.of(1, 101, 0.00005, 0.0));

        var result = association.associate(sources, CELL, BITS);

        assertEquals(1, result.diaObjects().size());
        double ra = result.diaObjects().get(0).ra();
        assertTrue(ra < 1e-6 || ra > 360.0 - 1e-6, "mean ra should sit on the 0/360 seam: " + ra);
    }

    @Test
    void sourcesAroundThePole_associate() {
        var sources = List.of(
            DiaSource.of(1, 100, 0.0, 90.0 - 0.00001),
            DiaSource.of(1, 101, 180.0, 90.0 - 0.00001));

        var result = association.associate(sources, CELL, BITS);

        assertEquals(1, result.diaObjects().size());
        assertEquals(90.0, result.diaObjects().get(0).dec(), 1e-9);
    }

    @Test
    void equidistantObjects_tieBreakToTheOldest() {
        var sources = List.of(
            DiaSource.of(1, 100, 42.0, -7.0),
            DiaSource.of(2, 100, 42.0, -7.0),
            DiaSource.of(3, 100, 42.0, -7.0),
            DiaSource.of(1, 101, 42.0, -7.0));

        var result = association.associate(sources, CELL, BITS);

        assertEquals(3, result.diaObjects().size());
        assertEquals(id(1), result.assocDiaSources().get(3).diaObjectId());
        assertEquals(2, result.diaObjects().get(0).nDiaSources());
    }

    @Test
    void coincidentSources_neverStackTwoSourcesOfAVisitOnOneObject() {
        var sources = new ArrayList<DiaSource>();
        for (long visit = 1; visit <= 5; visit++) {
            for (long s = 1; s <= 3; s++) {
                sources.add(DiaSource.of(s, visit, 42.0, -7.0));
            }
        }

        var result = association.associate(sources, CELL, BITS);

        assertEquals(15, result.diaObjects().stream().mapToInt(DiaObject::nDiaSources).sum());
        assertTrue(result.diaObjects().size() >= 3);
        Set<String> seen = new HashSet<>();
        result.assocDiaSources().forEach(s ->
            assertTrue(seen.add(s.visitId() + "/" + s.diaObjectId()), "visit " + s.visitId() + " stacked"));
        var stats = result.stats();
        assertEquals(stats.sourcesProcessed(), stats.objectsCreated() + stats.sourcesAttached());
    }

    @Test
    void objectFoundedInAVisit_cannotTakeAnotherSourceOfThatVisit() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(1, 101, 10.0, 20.0 + 0.8 * ARCSEC),
            DiaSource.of(2, 101, 10.0, 20.0 + 1.0 * ARCSEC),
            DiaSource.of(1, 102, 10.0, 20.0 + 1.0 * ARCSEC));
        var reasons = new ArrayList<CreateReason>();

        var result = association.associate(sources, CELL, BITS, recordingReasons(reasons));

        // source 2 of visit 101 is nearest to the object source 1 founded in the same visit
        assertEquals(3, result.diaObjects().size());
        assertEquals(id(2), result.assocDiaSources().get(1).diaObjectId());
        assertEquals(id(3), result.assocDiaSources().get(2).diaObjectId());
        assertEquals(List.of(CreateReason.FIRST_VISIT, CreateReason.OUT_OF_TOLERANCE, CreateReason.CLAIMED),
            reasons);
        // the claim does not outlive the visit
        assertEquals(id(3), result.assocDiaSources().get(3).diaObjectId());
    }

    @Test
    void extraColumns_areCarriedThrough() {
        var source = new DiaSource(1, 100, 10.0, 20.0, Map.of("psFlux", 123.4, "band", "g"));

        var result = association.associate(List.of(source), CELL, BITS);

        assertSame(source, result.assocDiaSources().get(0).source());
        assertEquals(123.4, result.assocDiaSources().get(0).source().columns().get("psFlux"));
    }

    @Test
    void newObjects_haveZeroedAuxiliaryColumns() {
        var result = association.associate(List.of(DiaSource.of(1, 100, 10.0, 20.0)), CELL, BITS);
        DiaObject obj = result.diaObjects().get(0);

        assertEquals(10.0, obj.ra());
        assertEquals(20.0, obj.dec());
        assertEquals(0, obj.pmParallaxNdata());
        assertEquals(0L, obj.nearbyObj1());
        assertEquals(0L, obj.flags());
        for (Band band : Band.values()) {
            assertEquals(0, obj.psFluxNdata(band));
        }
        assertEquals(6, obj.psFluxNdata().size());
    }

    @Test
    void duplicateSourceKey_isRejected() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(1, 100, 11.0, 20.0));

        assertThrows(IllegalArgumentException.class, () -> association.associate(sources, CELL, BITS));
    }

    @Test
    void sameSourceIdInDifferentVisits_isAllowed() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(1, 101, 11.0, 20.0));

        assertEquals(2, association.associate(sources, CELL, BITS).diaObjects().size());
    }

    @Test
    void invalidCoordinate_raisesGeometryError() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(1, 101, 10.0, Double.NaN));

        assertThrows(GeometryException.class, () -> association.associate(sources, CELL, BITS));
    }

    @Test
    void invalidIdSeed_raisesConfigurationError() {
        var sources = List.of(DiaSource.of(1, 100, 10.0, 20.0));

        assertThrows(ConfigurationException.class, () -> association.associate(sources, CELL, 0));
        assertThrows(ConfigurationException.class, () -> association.associate(sources, 1L << 20, 20));
        assertThrows(ConfigurationException.class, () -> association.associate(List.of(), CELL, 64));
    }

    @Test
    void mismatchedIndexResolution_isRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new SimpleAssociation(AssociationConfig.defaults().withResolution(9), index));
    }

    @Test
    void stats_accountForEverySource() {
        var sources = List.of(
            DiaSource.of(1, 100, 10.0, 20.0),
            DiaSource.of(1, 101, 10.0, 20.0 + 0.1 * ARCSEC),
            DiaSource.of(2, 101, 10.0, 20.0 - 0.1 * ARCSEC),
            DiaSource.of(3, 101, 10.0, 20.0 + 0.8 * ARCSEC),
            DiaSource.of(4, 101, 50.0, 20.0));

        var stats = association.associate(sources, CELL, BITS).stats();

        assertEquals(2, stats.visitsProcessed());
        assertEquals(5, stats.sourcesProcessed());
        assertEquals(1, stats.sourcesAttached());
        assertEquals(4, stats.objectsCreated());
        assertEquals(1, stats.claimConflicts());
        assertEquals(1, stats.outOfTolerance());
        assertEquals(1, stats.noCandidates());
        assertTrue(stats.separationsComputed() >= 3);
    }

    private static AssociationListener recordingReasons(List<CreateReason> reasons) {
        return new AssociationListener() {
            @Override
            public void onObjectCreated(DiaSource source, long diaObjectId, CreateReason reason) {
                reasons.add(reason);
            }

            @Override
            public void onSourceAttached(DiaSource source, long diaObjectId, double separationRad) {}
        };
    }
}
