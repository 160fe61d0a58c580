package org.calista.evoalign.canonical;

/**
 * Value has no canonical JSON form (sets, non-string keys, non-finite numbers, arbitrary objects).
 */
public final class NotSerializableException extends IllegalArgumentException {

    public NotSerializableException(String message) {
        super(message);
    }
}
