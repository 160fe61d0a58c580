package org.calista.evoalign;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Test fixtures from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    public static final String LATTICE = "lattice/context_lattice_v1.yaml";
    public static final String LATTICE_SCHEMA = "schemas/ContextLattice.schema.json";

    private Fixtures() {}

    public static String text(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) throw new IllegalArgumentException("No fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Writes the fixture to {@code root/relTarget}, creating parents. */
    public static Path copy(String name, Path root, String relTarget) throws IOException {
        return write(root, relTarget, text(name));
    }

    public static Path write(Path root, String rel, String content) throws IOException {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }
}
