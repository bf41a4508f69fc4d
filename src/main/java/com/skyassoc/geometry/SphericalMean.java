package com.skyassoc.geometry;

/**
 * Online spherical average: a running sum of unit vectors plus a count.
 *
 * The mean direction is the normalised sum, which is exactly the average
 * of every point ever added, without keeping the points themselves.
 */
public final class SphericalMean {

    private double sumX;
    private double sumY;
    private double sumZ;
    private int count;

    public SphericalMean add(UnitVector v) {
        sumX += v.x();
        sumY += v.y();
        sumZ += v.z();
        count++;
        return this;
    }

    public int count() {
        return count;
    }

    /**
     * @throws GeometryException if nothing was added or the points cancel out
     */
    public UnitVector mean() {
        double norm = Math.sqrt(sumX * sumX + sumY * sumY + sumZ * sumZ);
        if (count == 0 || norm == 0.0) {
            throw new GeometryException(
                "Spherical mean undefined for " + count + " point(s) with zero vector sum");
        }
        return new UnitVector(sumX / norm, sumY / norm, sumZ / norm);
    }
}
