package com.skyassoc.geometry;

/**
 * Point on the unit sphere as a Cartesian 3-vector.
 *
 * x points at (ra=0, dec=0), y at (ra=90, dec=0), z at the north pole.
 */
public record UnitVector(double x, double y, double z) {

    /**
     * Converts equatorial coordinates in degrees to a unit vector.
     *
     * @throws GeometryException if either coordinate is not finite or
     *                           |dec| exceeds 90 degrees
     */
    public static UnitVector fromRaDec(double raDeg, double decDeg) {
        if (!Double.isFinite(raDeg) || !Double.isFinite(decDeg)) {
            throw new GeometryException(
                "Non-finite sky coordinate: ra=" + raDeg + ", dec=" + decDeg);
        }
        if (decDeg < -90.0 || decDeg > 90.0) {
            throw new GeometryException("Declination out of range: " + decDeg);
        }
        double ra  = Math.toRadians(raDeg);
        double dec = Math.toRadians(decDeg);
        double cosDec = Math.cos(dec);
        return new UnitVector(cosDec * Math.cos(ra), cosDec * Math.sin(ra), Math.sin(dec));
    }

    /** Right ascension in degrees, in [0, 360). Zero at the poles. */
    public double ra() {
        if (x == 0.0 && y == 0.0) return 0.0;
        return Angles.normalizeRa(Math.toDegrees(Math.atan2(y, x)));
    }

    /** Declination in degrees, in [-90, 90]. */
    public double dec() {
        return Math.toDegrees(Math.atan2(z, Math.hypot(x, y)));
    }

    public double dot(UnitVector o) {
        return x * o.x + y * o.y + z * o.z;
    }

    /**
     * Great-circle separation in radians.
     * atan2(|a x b|, a . b) keeps full precision for sub-arcsecond angles,
     * where acos(a . b) collapses to zero.
     */
    public double angleTo(UnitVector o) {
        double cx = y * o.z - z * o.y;
        double cy = z * o.x - x * o.z;
        double cz = x * o.y - y * o.x;
        return Math.atan2(Math.sqrt(cx * cx + cy * cy + cz * cz), dot(o));
    }
}
