package com.skyassoc.config;

import com.skyassoc.geometry.Angles;

import java.util.Locale;
import java.util.Map;

/**
 * Tuning for one association run.
 *
 * @param toleranceArcsec  maximum separation, in arcseconds, for a source to
 *                         join an existing object (strictly less than)
 * @param resolution       H3 resolution of the candidate index; 11 gives
 *                         cells of roughly 0.9 arcsec on the sky
 * @param withinVisitOrder replay order of sources inside a visit
 */
public record AssociationConfig(
    double toleranceArcsec,
    int resolution,
    WithinVisitOrder withinVisitOrder
) {
    public static final double DEFAULT_TOLERANCE_ARCSEC = 0.5;
    public static final int    DEFAULT_RESOLUTION       = 11;
    public static final int    MIN_RESOLUTION           = 1;
    public static final int    MAX_RESOLUTION           = 15;

    public static final String ENV_TOLERANCE_ARCSEC   = "ASSOC_TOLERANCE_ARCSEC";
    public static final String ENV_RESOLUTION         = "ASSOC_H3_RESOLUTION";
    public static final String ENV_WITHIN_VISIT_ORDER = "ASSOC_WITHIN_VISIT_ORDER";

    public AssociationConfig {
        if (!Double.isFinite(toleranceArcsec) || toleranceArcsec <= 0.0) {
            throw new ConfigurationException(
                "toleranceArcsec must be positive and finite, got " + toleranceArcsec);
        }
        if (resolution < MIN_RESOLUTION || resolution > MAX_RESOLUTION) {
            throw new ConfigurationException(
                "resolution must be in [" + MIN_RESOLUTION + ", " + MAX_RESOLUTION
                    + "], got " + resolution);
        }
        if (withinVisitOrder == null) {
            throw new ConfigurationException("withinVisitOrder must not be null");
        }
    }

    public static AssociationConfig defaults() {
        return new AssociationConfig(DEFAULT_TOLERANCE_ARCSEC, DEFAULT_RESOLUTION, WithinVisitOrder.INPUT);
    }

    /** Reads overrides from an environment map, typically {@code System.getenv()}. */
    public static AssociationConfig fromEnv(Map<String, String> env) {
        String tolerance = env.getOrDefault(ENV_TOLERANCE_ARCSEC, String.valueOf(DEFAULT_TOLERANCE_ARCSEC));
        String resolution = env.getOrDefault(ENV_RESOLUTION, String.valueOf(DEFAULT_RESOLUTION));
        String order = env.getOrDefault(ENV_WITHIN_VISIT_ORDER, WithinVisitOrder.INPUT.name());
        try {
            return new AssociationConfig(
                Double.parseDouble(tolerance.trim()),
                Integer.parseInt(resolution.trim()),
                WithinVisitOrder.valueOf(order.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            throw new ConfigurationException("Invalid association settings in environment: " + e.getMessage(), e);
        }
    }

    public double toleranceRadians() {
        return Angles.arcsecToRadians(toleranceArcsec);
    }

    public AssociationConfig withToleranceArcsec(double arcsec) {
        return new AssociationConfig(arcsec, resolution, withinVisitOrder);
    }

    public AssociationConfig withResolution(int res) {
        return new AssociationConfig(toleranceArcsec, res, withinVisitOrder);
    }

    public AssociationConfig withWithinVisitOrder(WithinVisitOrder order) {
        return new AssociationConfig(toleranceArcsec, resolution, order);
    }
}
