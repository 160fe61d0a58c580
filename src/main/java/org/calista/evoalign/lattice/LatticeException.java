package org.calista.evoalign.lattice;

/**
 * Malformed lattice document, unknown context/dimension/value, or an invalid algebra call.
 * Always surfaced to the caller; coverage math never defaults around it.
 */
public class LatticeException extends RuntimeException {

    public LatticeException(String message) {
        super(message);
    }

    public LatticeException(String message, Throwable cause) {
        super(message, cause);
    }
}
