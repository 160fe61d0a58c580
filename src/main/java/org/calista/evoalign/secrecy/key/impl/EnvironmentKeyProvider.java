package org.calista.evoalign.secrecy.key.impl;

import org.calista.evoalign.secrecy.key.KeyProvider;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Keys from environment variables, UTF-8 encoded. Blank values count as absent.
 */
public final class EnvironmentKeyProvider implements KeyProvider {

    private final Map<String, String> env;

    public EnvironmentKeyProvider() {
        this(System.getenv());
    }

    public EnvironmentKeyProvider(Map<String, String> env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    @Override
    public Optional<byte[]> find(String name) {
        if (name == null) return Optional.empty();
        String v = env.get(name);
        if (v == null || v.isEmpty()) return Optional.empty();
        return Optional.of(v.getBytes(StandardCharsets.UTF_8));
    }
}
