package com.skyassoc;

/**
 * Base type for every failure raised by the association core.
 * Unchecked: a failed call leaves no partial state behind, so callers
 * have nothing to recover.
 */
public class AssociationException extends RuntimeException {

    public AssociationException(String message) {
        super(message);
    }

    public AssociationException(String message, Throwable cause) {
        super(message, cause);
    }
}
