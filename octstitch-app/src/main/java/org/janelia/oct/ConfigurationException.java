package org.janelia.oct;

/**
 * Indicates a scan, lattice, or processing configuration that cannot be used.
 * Raised while validating inputs, before any output row is processed.
 *
 * @author Eric Trautman
 */
public class ConfigurationException
        extends IllegalArgumentException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message,
                                  final Throwable cause) {
        super(message, cause);
    }
}
