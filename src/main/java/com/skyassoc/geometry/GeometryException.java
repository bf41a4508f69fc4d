package com.skyassoc.geometry;

import com.skyassoc.AssociationException;

/**
 * Raised for coordinates the sphere cannot represent (NaN, infinite,
 * |dec| &gt; 90) and for degenerate spherical means.
 */
public class GeometryException extends AssociationException {

    public GeometryException(String message) {
        super(message);
    }

    public GeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
