package com.skyassoc.geometry;

public final class Angles {

    public static final double ARCSEC_PER_DEGREE = 3600.0;

    public static double arcsecToRadians(double arcsec) {
        return Math.toRadians(arcsec / ARCSEC_PER_DEGREE);
    }

    public static double radiansToArcsec(double radians) {
        return Math.toDegrees(radians) * ARCSEC_PER_DEGREE;
    }

    /** Wraps any right ascension into [0, 360). */
    public static double normalizeRa(double raDeg) {
        double ra = raDeg % 360.0;
        if (ra < 0) ra += 360.0;
        // -1e-17 % 360 + 360 rounds to exactly 360.0
        return ra >= 360.0 ? 0.0 : ra;
    }

    /** Maps a right ascension onto the [-180, 180) longitude range H3 expects. */
    public static double raToLongitude(double raDeg) {
        double ra = normalizeRa(raDeg);
        return ra >= 180.0 ? ra - 360.0 : ra;
    }

    private Angles() {}
}
