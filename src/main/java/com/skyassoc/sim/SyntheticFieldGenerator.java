package com.skyassoc.sim;

import com.skyassoc.geometry.Angles;
import com.skyassoc.model.DiaSource;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Random;

/**
 * Deterministic multi-visit source tables around a set of fixed sky positions.
 *
 * Each true position is detected on a visit with probability
 * {@code detectionProbability}, displaced by Gaussian noise of
 * {@code jitterArcsec} per axis. Rows come out grouped by visit, sources
 * numbered from 1 within a visit. Every source carries a {@code truthId}
 * column naming the position it was drawn from and a {@code psFlux} column.
 */
public class SyntheticFieldGenerator {

    private final double centreRa;
    private final double centreDec;
    private final double fieldRadiusArcsec;
    private final double jitterArcsec;
    private final double detectionProbability;
    private final long seed;

    public SyntheticFieldGenerator(double centreRa, double centreDec, double fieldRadiusArcsec,
                                   double jitterArcsec, double detectionProbability, long seed) {
        if (fieldRadiusArcsec <= 0 || jitterArcsec < 0) {
            throw new IllegalArgumentException("fieldRadiusArcsec must be > 0 and jitterArcsec >= 0");
        }
        if (detectionProbability <= 0 || detectionProbability > 1) {
            throw new IllegalArgumentException("detectionProbability must be in (0, 1]");
        }
        this.centreRa = centreRa;
        this.centreDec = centreDec;
        this.fieldRadiusArcsec = fieldRadiusArcsec;
        this.jitterArcsec = jitterArcsec;
        this.detectionProbability = detectionProbability;
        this.seed = seed;
    }

    public static SyntheticFieldGenerator deterministic(String fieldId, String scenario,
                                                        double centreRa, double centreDec,
                                                        double fieldRadiusArcsec, double jitterArcsec,
                                                        double detectionProbability) {
        return new SyntheticFieldGenerator(centreRa, centreDec, fieldRadiusArcsec, jitterArcsec,
            detectionProbability, fieldSeed(fieldId, scenario));
    }

    public long seed() {
        return seed;
    }

    /**
     * Seed for a named field and scenario, stable across JVMs and runs.
     * FNV-1a over the UTF-8 bytes of {@code fieldId:scenario}, finished with
     * the murmur3 fmix64 step.
     */
    public static long fieldSeed(String fieldId, String scenario) {
        long hash = 0xcbf29ce484222325L;
        for (byte b : (fieldId + ":" + scenario).getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= 0x100000001b3L;
        }
        hash ^= (hash >>> 33);
        hash *= 0xff51afd7ed558ccdL;
        hash ^= (hash >>> 33);
        hash *= 0xc4ceb9fe1a85ec53L;
        hash ^= (hash >>> 33);
        return hash;
    }

    /**
     * @param truePositions number of distinct sky positions
     * @param visits        number of visits, ids {@code firstVisitId, firstVisitId + 1, ...}
     */
    public List<DiaSource> generate(int truePositions, int visits, long firstVisitId) {
        var prng = new Random(seed);
        double[][] truth = new double[truePositions][];
        for (int t = 0; t < truePositions; t++) {
            // uniform over the disc: r ~ sqrt(u)
            double r = fieldRadiusArcsec * Math.sqrt(prng.nextDouble());
            double theta = 2 * Math.PI * prng.nextDouble();
            truth[t] = offset(centreRa, centreDec, r * Math.cos(theta), r * Math.sin(theta));
        }

        var sources = new ArrayList<DiaSource>();
        for (int v = 0; v < visits; v++) {
            long visitId = firstVisitId + v;
            long sourceId = 1;
            for (int t = 0; t < truePositions; t++) {
                if (prng.nextDouble() >= detectionProbability) continue;
                double[] p = offset(truth[t][0], truth[t][1],
                    prng.nextGaussian() * jitterArcsec, prng.nextGaussian() * jitterArcsec);
                var columns = new LinkedHashMap<String, Object>();
                columns.put("truthId", t);
                columns.put("psFlux", 1000.0 + 50.0 * prng.nextGaussian());
                sources.add(new DiaSource(sourceId++, visitId, p[0], p[1], columns));
            }
        }
        return sources;
    }

    // Small-angle tangent-plane offset; fine for fields of a few arcminutes.
    private static double[] offset(double ra, double dec, double eastArcsec, double northArcsec) {
        double newDec = dec + northArcsec / Angles.ARCSEC_PER_DEGREE;
        double newRa = ra + eastArcsec / Angles.ARCSEC_PER_DEGREE / Math.cos(Math.toRadians(dec));
        return new double[]{Angles.normalizeRa(newRa), Math.max(-90.0, Math.min(90.0, newDec))};
    }
}
