package org.calista.evoalign.secrecy.key;

import java.util.Optional;

/**
 * Source of HMAC keys for keyed fingerprint schemes. Looked up by the name derived from
 * the scheme's key_id.
 */
public interface KeyProvider {

    /** Key bytes, or empty when the name is unknown or the key is blank. */
    Optional<byte[]> find(String name);
}
