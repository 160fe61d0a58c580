package org.calista.evoalign.secrecy.key.impl;

import org.calista.evoalign.secrecy.key.KeyProvider;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fixed in-memory keys (tests, embedding callers with their own secret store).
 */
public final class StaticKeyProvider implements KeyProvider {

    private final Map<String, byte[]> keys;

    private StaticKeyProvider(Map<String, byte[]> keys) {
        this.keys = keys;
    }

    public static StaticKeyProvider empty() {
        return new StaticKeyProvider(Map.of());
    }

    public static StaticKeyProvider of(String name, String key) {
        return builder().put(name, key).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<byte[]> find(String name) {
        byte[] k = name == null ? null : keys.get(name);
        if (k == null || k.length == 0) return Optional.empty();
        return Optional.of(k.clone());
    }

    public static final class Builder {
        private final Map<String, byte[]> keys = new HashMap<>();

        public Builder put(String name, String key) {
            Objects.requireNonNull(key, "key");
            return put(name, key.getBytes(StandardCharsets.UTF_8));
        }

        public Builder put(String name, byte[] key) {
            keys.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(key, "key").clone());
            return this;
        }

        public StaticKeyProvider build() {
            return new StaticKeyProvider(Map.copyOf(keys));
        }
    }
}
