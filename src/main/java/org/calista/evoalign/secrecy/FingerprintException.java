package org.calista.evoalign.secrecy;

/**
 * Malformed hashing scheme or registry, or a missing HMAC key. Fails closed: an audit that
 * hits this is reported as failed, never as "no leak".
 */
public class FingerprintException extends RuntimeException {

    public FingerprintException(String message) {
        super(message);
    }

    public FingerprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
