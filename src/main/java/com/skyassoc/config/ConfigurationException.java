package com.skyassoc.config;

import com.skyassoc.AssociationException;

/** Degenerate or unparseable configuration, raised before any work starts. */
public class ConfigurationException extends AssociationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
